package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.servicebus.common.context.MessageDeliveryContext;
import dk.cloudcreate.servicebus.common.messages.Event;
import dk.cloudcreate.servicebus.eventsourcing.eventstream.*;
import dk.cloudcreate.servicebus.eventsourcing.snapshots.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Loads and saves {@link Aggregate}'s.
 * <p>
 * <b>Load:</b> the latest {@link AggregateSnapshot} (if any) is used as the starting point and only the events
 * after the snapshot version are replayed, otherwise the full event stream is replayed onto a blank
 * {@link Aggregate} instance created by the {@link AggregateInstanceFactory}.
 * <p>
 * <b>Save:</b> the uncommitted events of the {@link Aggregate} either create the event stream (if they contain {@link AggregateCreated})
 * or are appended to it. Once the {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork} that wrote the events has been committed,
 * the domain events are delivered through the {@link MessageDeliveryContext}, after which the {@link Snapshotter} is asked if
 * a new snapshot must be created.
 */
public class EventSourcingProvider {
    private static final Logger log = LoggerFactory.getLogger(EventSourcingProvider.class);

    private final EventStreamStore                    eventStreamStore;
    private final AggregateEventStreamDataTransformer transformer;
    private final Snapshotter                         snapshotter;
    private final AggregateInstanceFactory            aggregateInstanceFactory;

    public EventSourcingProvider(EventStreamStore eventStreamStore,
                                 AggregateEventStreamDataTransformer transformer,
                                 Snapshotter snapshotter) {
        this(eventStreamStore, transformer, snapshotter, AggregateInstanceFactory.objenesisInstanceFactory());
    }

    public EventSourcingProvider(EventStreamStore eventStreamStore,
                                 AggregateEventStreamDataTransformer transformer,
                                 Snapshotter snapshotter,
                                 AggregateInstanceFactory aggregateInstanceFactory) {
        this.eventStreamStore = requireNonNull(eventStreamStore, "No eventStreamStore provided");
        this.transformer = requireNonNull(transformer, "No transformer provided");
        this.snapshotter = requireNonNull(snapshotter, "No snapshotter provided");
        this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "No aggregateInstanceFactory provided");
    }

    /**
     * Load an {@link Aggregate}
     *
     * @param id   the aggregate identifier
     * @param <ID> the aggregate id type
     * @param <A>  the aggregate type
     * @return the aggregate or {@link Optional#empty()} if neither an event stream nor a snapshot exists for the identifier
     * @throws LoadStreamFailedException in case loading or rehydrating the aggregate failed
     */
    @SuppressWarnings("unchecked")
    public <ID extends AggregateId, A extends Aggregate<ID>> Optional<A> load(ID id) {
        requireNonNull(id, "No id provided");
        try {
            var snapshot = snapshotter.load(id);
            var fromVersion = snapshot.map(aggregateSnapshot -> aggregateSnapshot.aggregate().version() + 1)
                                      .orElse(Aggregate.START_PLAYHEAD_INDEX);
            var storedStream = eventStreamStore.loadStream(id, fromVersion);
            if (storedStream.isEmpty() && snapshot.isEmpty()) {
                log.debug("[{}:{}] No event stream or snapshot found", id.getClass().getName(), id);
                return Optional.empty();
            }

            Aggregate<?> aggregate = snapshot.isPresent() ?
                                     snapshot.get().aggregate() :
                                     aggregateInstanceFactory.create(id.aggregateClass());
            if (storedStream.isPresent()) {
                var eventStream = transformer.streamToDomainRepresentation(storedStream.get());
                aggregate.rehydrate(eventStream);
                log.debug("[{}:{}] Loaded aggregate '{}' {} and {} event(s), version is {}",
                          id.getClass().getName(),
                          id,
                          aggregate.getClass().getName(),
                          snapshot.isPresent() ? "from snapshot" : "without snapshot",
                          eventStream.events().size(),
                          aggregate.version());
            }
            return Optional.of((A) aggregate);
        } catch (RuntimeException e) {
            throw new LoadStreamFailedException(msg("[{}:{}] Failed to load aggregate '{}'",
                                                    id.getClass().getName(),
                                                    id,
                                                    id.aggregateClass().getName()),
                                                e);
        }
    }

    /**
     * Save the uncommitted events of the {@link Aggregate}.<br>
     * If a {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork} is active the events are written as part of it and delivered
     * when it commits, otherwise the events are written and committed before this method returns.
     *
     * @param aggregate              the aggregate to save
     * @param messageDeliveryContext the context the domain events are delivered through after commit
     * @throws NonUniqueStreamIdException if the aggregate is new and an event stream with the same identifier already exists
     * @throws SaveStreamFailedException  in case of any other failure
     */
    public void save(Aggregate<?> aggregate, MessageDeliveryContext messageDeliveryContext) {
        requireNonNull(aggregate, "No aggregate provided");
        requireNonNull(messageDeliveryContext, "No messageDeliveryContext provided");
        var eventStream = aggregate.makeStream();
        if (eventStream.isEmpty()) {
            log.trace("[{}:{}] No uncommitted events to save", aggregate.id().getClass().getName(), aggregate.id());
            return;
        }

        List<Event> domainEvents = eventStream.events()
                                              .stream()
                                              .map(AggregateEvent::event)
                                              .collect(Collectors.toList());
        var savedVersion = aggregate.version();
        Runnable afterSaveHandler = () -> {
            try {
                log.debug("[{}:{}] Delivering {} event(s)", aggregate.id().getClass().getName(), aggregate.id(), domainEvents.size());
                messageDeliveryContext.delivery(domainEvents);
            } finally {
                snapshotIfRequired(aggregate, savedVersion);
            }
        };

        try {
            var storedStream = transformer.streamToStoredRepresentation(eventStream);
            if (eventStream.containsAggregateCreated()) {
                eventStreamStore.saveStream(storedStream, afterSaveHandler);
            } else {
                eventStreamStore.appendStream(storedStream, afterSaveHandler);
            }
        } catch (NonUniqueStreamIdException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SaveStreamFailedException(msg("[{}:{}] Failed to save {} event(s) of aggregate '{}'",
                                                    aggregate.id().getClass().getName(),
                                                    aggregate.id(),
                                                    domainEvents.size(),
                                                    aggregate.getClass().getName()),
                                                e);
        }
        aggregate.markChangesAsCommitted();
        log.debug("[{}:{}] Saved events {}-{}",
                  aggregate.id().getClass().getName(),
                  aggregate.id(),
                  eventStream.fromPlayhead().orElse(null),
                  eventStream.toPlayhead().orElse(null));
    }

    private void snapshotIfRequired(Aggregate<?> aggregate, long savedVersion) {
        if (aggregate.version() != savedVersion) {
            // The aggregate has changed since it was saved, so its state no longer matches the persisted stream
            log.debug("[{}:{}] Skipping snapshot as the aggregate version {} differs from the saved version {}",
                      aggregate.id().getClass().getName(),
                      aggregate.id(),
                      aggregate.version(),
                      savedVersion);
            return;
        }
        var lastSnapshot = snapshotter.load(aggregate.id());
        if (snapshotter.snapshotMustBeCreated(aggregate, lastSnapshot)) {
            snapshotter.store(new AggregateSnapshot<Aggregate<?>>(aggregate, savedVersion));
        }
    }
}
