package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.servicebus.common.messages.Event;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The first event in every {@link Aggregate} event stream. Raised by the {@link Aggregate} constructor.<br>
 * A stream that contains this event is created (see {@link dk.cloudcreate.servicebus.eventsourcing.eventstream.EventStreamStore#saveStream}),
 * all other streams are appended to an existing stream.
 */
public final class AggregateCreated implements Event {
    public final String         id;
    public final String         idClass;
    public final String         aggregateClass;
    public final OffsetDateTime datetime;

    public AggregateCreated(AggregateId id, Class<?> aggregateClass, OffsetDateTime datetime) {
        requireNonNull(id, "No id provided");
        this.id = id.value();
        this.idClass = id.getClass().getName();
        this.aggregateClass = requireNonNull(aggregateClass, "No aggregateClass provided").getName();
        this.datetime = requireNonNull(datetime, "No datetime provided");
    }

    @Override
    public String toString() {
        return "AggregateCreated{" +
                "id='" + id + '\'' +
                ", idClass='" + idClass + '\'' +
                ", aggregateClass='" + aggregateClass + '\'' +
                ", datetime=" + datetime +
                '}';
    }
}
