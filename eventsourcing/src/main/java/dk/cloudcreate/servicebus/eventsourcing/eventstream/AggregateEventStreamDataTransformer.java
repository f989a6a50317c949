package dk.cloudcreate.servicebus.eventsourcing.eventstream;

import dk.cloudcreate.servicebus.common.messages.Event;
import dk.cloudcreate.servicebus.eventsourcing.*;

import java.time.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Converts between the domain representation ({@link AggregateEventStream}) and the stored representation
 * ({@link StoredAggregateEventStream}) of an aggregate event stream
 */
public class AggregateEventStreamDataTransformer {
    private final AggregateEventSerializer eventSerializer;

    public AggregateEventStreamDataTransformer(AggregateEventSerializer eventSerializer) {
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
    }

    public StoredAggregateEventStream streamToStoredRepresentation(AggregateEventStream aggregateEventStream) {
        requireNonNull(aggregateEventStream, "No aggregateEventStream provided");
        var recordedAt = OffsetDateTime.now(ZoneOffset.UTC);
        var storedEvents = aggregateEventStream.events()
                                               .stream()
                                               .map(aggregateEvent -> new StoredAggregateEvent(aggregateEvent.eventId(),
                                                                                               aggregateEvent.playhead(),
                                                                                               aggregateEvent.event().getClass().getName(),
                                                                                               eventSerializer.serialize(aggregateEvent.event()),
                                                                                               aggregateEvent.occurredAt(),
                                                                                               recordedAt))
                                               .collect(Collectors.toList());
        return new StoredAggregateEventStream(aggregateEventStream.aggregateId().value(),
                                              aggregateEventStream.aggregateId().getClass().getName(),
                                              aggregateEventStream.aggregateClass().getName(),
                                              storedEvents);
    }

    public AggregateEventStream streamToDomainRepresentation(StoredAggregateEventStream storedAggregateEventStream) {
        requireNonNull(storedAggregateEventStream, "No storedAggregateEventStream provided");
        var aggregateId = AggregateId.restore(storedAggregateEventStream.aggregateIdClass,
                                              storedAggregateEventStream.aggregateId,
                                              storedAggregateEventStream.aggregateClass);
        var events = storedAggregateEventStream.storedAggregateEvents
                .stream()
                .map(storedEvent -> {
                    Event event = eventSerializer.unserialize(storedEvent.eventClass, storedEvent.payload);
                    if (event == null) {
                        throw new EventStreamStoreException(msg("Event '{}' with playhead {} of aggregate '{}' deserialized to null",
                                                                storedEvent.eventClass,
                                                                storedEvent.playhead,
                                                                storedAggregateEventStream.aggregateId));
                    }
                    return new AggregateEvent(storedEvent.eventId, event, storedEvent.playhead, storedEvent.occurredAt);
                })
                .collect(Collectors.toList());
        return new AggregateEventStream(aggregateId, aggregateId.aggregateClass(), events);
    }
}
