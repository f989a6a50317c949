package dk.cloudcreate.servicebus.eventsourcing;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The ordered events of a single {@link Aggregate}, either the events raised since the aggregate was loaded
 * (see {@link Aggregate#makeStream()}) or a range of its persisted history
 */
public final class AggregateEventStream {
    private final AggregateId                    aggregateId;
    private final Class<? extends Aggregate<?>> aggregateClass;
    private final List<AggregateEvent>           events;

    public AggregateEventStream(AggregateId aggregateId, Class<? extends Aggregate<?>> aggregateClass, List<AggregateEvent> events) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateClass = requireNonNull(aggregateClass, "No aggregateClass provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    public AggregateId aggregateId() {
        return aggregateId;
    }

    public Class<? extends Aggregate<?>> aggregateClass() {
        return aggregateClass;
    }

    public List<AggregateEvent> events() {
        return events;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Does the stream contain the {@link AggregateCreated} event, i.e. is this the stream of a new {@link Aggregate}
     */
    public boolean containsAggregateCreated() {
        return events.stream().anyMatch(aggregateEvent -> aggregateEvent.event() instanceof AggregateCreated);
    }

    /**
     * The playhead of the first event in the stream
     */
    public Optional<Long> fromPlayhead() {
        return isEmpty() ? Optional.empty() : Optional.of(events.get(0).playhead());
    }

    /**
     * The playhead of the last event in the stream
     */
    public Optional<Long> toPlayhead() {
        return isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1).playhead());
    }

    @Override
    public String toString() {
        return "AggregateEventStream{" +
                "aggregateId=" + aggregateId +
                ", aggregateClass=" + aggregateClass.getName() +
                ", fromPlayhead=" + fromPlayhead().orElse(null) +
                ", toPlayhead=" + toPlayhead().orElse(null) +
                ", numberOfEvents=" + events.size() +
                '}';
    }
}
