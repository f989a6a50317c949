package dk.cloudcreate.servicebus.sagas;

import dk.cloudcreate.essentials.shared.reflection.Reflector;
import dk.cloudcreate.servicebus.common.context.MessageDeliveryContext;
import dk.cloudcreate.servicebus.common.messages.*;
import dk.cloudcreate.servicebus.sagas.store.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Starts, loads and saves {@link Saga}'s.<br>
 * When a saga is saved, its fired commands followed by its raised events are delivered through the
 * {@link MessageDeliveryContext} once the {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork} that stored the saga has been committed.
 */
public class SagaProvider {
    private static final Logger log = LoggerFactory.getLogger(SagaProvider.class);

    private final SagaStore      sagaStore;
    private final SagaSerializer sagaSerializer;

    public SagaProvider(SagaStore sagaStore) {
        this(sagaStore, new SagaSerializer());
    }

    public SagaProvider(SagaStore sagaStore, SagaSerializer sagaSerializer) {
        this.sagaStore = requireNonNull(sagaStore, "No sagaStore provided");
        this.sagaSerializer = requireNonNull(sagaSerializer, "No sagaSerializer provided");
    }

    /**
     * Create a new saga using its <code>(SagaId)</code> constructor, start it with the command and store it
     *
     * @param id                     the saga identifier, which determines the saga type
     * @param command                the command that starts the saga
     * @param messageDeliveryContext the context the fired commands and raised events are delivered through after commit
     * @param <S>                    the saga type
     * @return the started saga
     * @throws DuplicateSagaIdException if a saga with the same identifier already exists
     * @throws SagaStoreException       in case of any other failure
     */
    @SuppressWarnings("unchecked")
    public <S extends Saga> S start(SagaId id, Command command, MessageDeliveryContext messageDeliveryContext) {
        requireNonNull(id, "No id provided");
        requireNonNull(command, "No command provided");
        requireNonNull(messageDeliveryContext, "No messageDeliveryContext provided");

        S saga = (S) Reflector.reflectOn(id.sagaClass()).newInstance(id);
        saga.start(command);
        saga.markAsStarted();
        log.debug("[{}:{}] Started saga with command '{}'", id.sagaClass().getName(), id, command.getClass().getName());
        store(saga, messageDeliveryContext, true);
        return saga;
    }

    /**
     * Load a saga
     *
     * @param id  the saga identifier
     * @param <S> the saga type
     * @return the saga or {@link Optional#empty()} if no saga exists with the identifier
     * @throws SagaStoreException in case the saga couldn't be loaded
     */
    @SuppressWarnings("unchecked")
    public <S extends Saga> Optional<S> obtain(SagaId id) {
        requireNonNull(id, "No id provided");
        try {
            return sagaStore.load(id)
                            .map(serializedSaga -> (S) sagaSerializer.deserialize(serializedSaga));
        } catch (SagaStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SagaStoreException(msg("[{}:{}] Failed to load saga", id.sagaClass().getName(), id), e);
        }
    }

    /**
     * Save the changes of an existing saga
     *
     * @param saga                   the saga
     * @param messageDeliveryContext the context the fired commands and raised events are delivered through after commit
     * @throws SagaStoreException in case the saga doesn't exist or couldn't be saved
     */
    public void save(Saga saga, MessageDeliveryContext messageDeliveryContext) {
        requireNonNull(saga, "No saga provided");
        requireNonNull(messageDeliveryContext, "No messageDeliveryContext provided");
        store(saga, messageDeliveryContext, false);
    }

    private void store(Saga saga, MessageDeliveryContext messageDeliveryContext, boolean isNew) {
        var messages = new ArrayList<Message>(saga.pendingCommands());
        messages.addAll(saga.pendingEvents());
        Runnable afterSaveHandler = () -> {
            if (!messages.isEmpty()) {
                log.debug("[{}:{}] Delivering {} message(s)", saga.getClass().getName(), saga.id(), messages.size());
                messageDeliveryContext.delivery(messages);
            }
        };

        try {
            var serializedSaga = sagaSerializer.serialize(saga);
            if (isNew) {
                sagaStore.save(serializedSaga, afterSaveHandler);
            } else {
                sagaStore.update(serializedSaga, afterSaveHandler);
            }
            saga.clear();
        } catch (SagaStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SagaStoreException(msg("[{}:{}] Failed to store saga", saga.getClass().getName(), saga.id()), e);
        }
    }
}
