package dk.cloudcreate.servicebus.sagas;

import dk.cloudcreate.servicebus.common.messages.*;
import dk.cloudcreate.servicebus.sagas.contract.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for sagas: long running business processes that react to events by changing their own state,
 * raising new events and firing commands.
 * <p>
 * A saga starts out as {@link SagaStatus#CREATED} and is closed by {@link #makeCompleted(String)} or {@link #makeFailed(String)}.
 * Once closed its state can no longer be changed.<br>
 * Raised events are applied to the saga through the {@link SagaEventHandlers} returned by {@link #eventHandlers()}.
 * Raised events and fired commands are buffered until the {@link SagaProvider} saves the saga and delivers them.
 * <p>
 * <b>Please note:</b> Sagas loaded from storage are created using Objenesis, which doesn't initialize fields
 * nor call any constructor. Initialize the saga state in a handler for {@link SagaCreated} instead of using field initializers,
 * and keep the {@link SagaEventHandlers} in a static field.
 */
public abstract class Saga {
    private static final Logger log = LoggerFactory.getLogger(Saga.class);

    private           SagaId         id;
    private           SagaStatus     status;
    private           OffsetDateTime createdAt;
    private           OffsetDateTime closedAt;
    private transient List<Event>    events;
    private transient List<Command>  commands;

    protected Saga(SagaId id) {
        requireNonNull(id, "No saga id provided");
        if (id.sagaClass() != getClass()) {
            throw new InvalidSagaIdentifierException(msg("The class of the saga in the identifier (\"{}\") differs from the saga to which it was transmitted (\"{}\")",
                                                         id.sagaClass().getName(),
                                                         getClass().getName()));
        }
        clear();
        this.id = id;
        this.status = SagaStatus.CREATED;
        this.createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        raise(new SagaCreated(id, createdAt));
    }

    /**
     * Start the saga flow
     *
     * @param command the command that triggered the saga
     */
    public abstract void start(Command command);

    /**
     * The mapping from event type to the handlers that apply the raised events to this saga
     */
    protected abstract SagaEventHandlers<? extends Saga> eventHandlers();

    public final SagaId id() {
        return id;
    }

    public final SagaStatus status() {
        return status;
    }

    public final OffsetDateTime createdAt() {
        return createdAt;
    }

    /**
     * The time the saga was completed or failed
     */
    public final Optional<OffsetDateTime> closedAt() {
        return Optional.ofNullable(closedAt);
    }

    /**
     * Apply the event to the saga and buffer it for delivery
     *
     * @throws ChangeSagaStateFailedException if the saga is closed
     */
    protected final void raise(Event event) {
        requireNonNull(event, "No event provided");
        assertNotClosed();
        if (!eventHandlers().apply(this, event)) {
            log.trace("[{}:{}] No handler for event '{}'", getClass().getName(), id, event.getClass().getName());
        }
        _events().add(event);
    }

    /**
     * Buffer the command for delivery
     *
     * @throws ChangeSagaStateFailedException if the saga is closed
     */
    protected final void fire(Command command) {
        requireNonNull(command, "No command provided");
        assertNotClosed();
        _commands().add(command);
    }

    protected final void makeCompleted() {
        makeCompleted(null);
    }

    /**
     * Close the saga as {@link SagaStatus#COMPLETED}
     *
     * @param withReason optional reason
     * @throws ChangeSagaStateFailedException if the saga is closed
     */
    protected final void makeCompleted(String withReason) {
        changeStatus(SagaStatus.COMPLETED, withReason);
    }

    protected final void makeFailed() {
        makeFailed(null);
    }

    /**
     * Close the saga as {@link SagaStatus#FAILED}
     *
     * @param withReason optional reason
     * @throws ChangeSagaStateFailedException if the saga is closed
     */
    protected final void makeFailed(String withReason) {
        changeStatus(SagaStatus.FAILED, withReason);
    }

    private void changeStatus(SagaStatus newStatus, String withReason) {
        assertNotClosed();
        var event = new SagaStatusChanged(id, status, newStatus, withReason, OffsetDateTime.now(ZoneOffset.UTC));
        // The status only changes once the handler accepted the event, same as for raise(Event)
        eventHandlers().apply(this, event);
        status = newStatus;
        closedAt = event.datetime;
        _events().add(event);
        log.debug("[{}:{}] Changed status from {} to {}{}",
                  getClass().getName(),
                  id,
                  event.previousStatus,
                  newStatus,
                  withReason != null ? " with reason: " + withReason : "");
    }

    /**
     * Called by the {@link SagaProvider} once {@link #start(Command)} has run
     */
    final void markAsStarted() {
        if (status == SagaStatus.CREATED) {
            status = SagaStatus.IN_PROGRESS;
        }
    }

    /**
     * The raised events that haven't been delivered yet. Reading them clears the buffer.
     */
    final List<Event> raisedEvents() {
        var raisedEvents = List.copyOf(_events());
        events = new ArrayList<>();
        return raisedEvents;
    }

    /**
     * The fired commands that haven't been delivered yet. Reading them clears the buffer.
     */
    final List<Command> firedCommands() {
        var firedCommands = List.copyOf(_commands());
        commands = new ArrayList<>();
        return firedCommands;
    }

    /**
     * The raised events that haven't been delivered yet. The buffer is left untouched.
     */
    final List<Event> pendingEvents() {
        return List.copyOf(_events());
    }

    /**
     * The fired commands that haven't been delivered yet. The buffer is left untouched.
     */
    final List<Command> pendingCommands() {
        return List.copyOf(_commands());
    }

    /**
     * Clear the raised events and fired commands
     */
    final void clear() {
        events = new ArrayList<>();
        commands = new ArrayList<>();
    }

    private void assertNotClosed() {
        if (status.isClosed()) {
            throw new ChangeSagaStateFailedException("Changing the state of the saga is impossible: the saga is complete");
        }
    }

    private List<Event> _events() {
        if (events == null) {
            events = new ArrayList<>();
        }
        return events;
    }

    private List<Command> _commands() {
        if (commands == null) {
            commands = new ArrayList<>();
        }
        return commands;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id=" + id +
                ", status=" + status +
                ", createdAt=" + createdAt +
                ", closedAt=" + closedAt +
                '}';
    }
}
