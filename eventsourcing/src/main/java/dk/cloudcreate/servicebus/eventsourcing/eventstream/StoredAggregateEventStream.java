package dk.cloudcreate.servicebus.eventsourcing.eventstream;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The stored (serialized) representation of an aggregate event stream
 */
public final class StoredAggregateEventStream {
    public final String                     aggregateId;
    /**
     * Fully Qualified Class Name of the {@link dk.cloudcreate.servicebus.eventsourcing.AggregateId}
     */
    public final String                     aggregateIdClass;
    /**
     * Fully Qualified Class Name of the {@link dk.cloudcreate.servicebus.eventsourcing.Aggregate}
     */
    public final String                     aggregateClass;
    /**
     * The events ordered by their playhead
     */
    public final List<StoredAggregateEvent> storedAggregateEvents;

    public StoredAggregateEventStream(String aggregateId,
                                      String aggregateIdClass,
                                      String aggregateClass,
                                      List<StoredAggregateEvent> storedAggregateEvents) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateIdClass = requireNonNull(aggregateIdClass, "No aggregateIdClass provided");
        this.aggregateClass = requireNonNull(aggregateClass, "No aggregateClass provided");
        this.storedAggregateEvents = List.copyOf(requireNonNull(storedAggregateEvents, "No storedAggregateEvents provided"));
    }

    @Override
    public String toString() {
        return "StoredAggregateEventStream{" +
                "aggregateId='" + aggregateId + '\'' +
                ", aggregateIdClass='" + aggregateIdClass + '\'' +
                ", aggregateClass='" + aggregateClass + '\'' +
                ", numberOfEvents=" + storedAggregateEvents.size() +
                '}';
    }
}
