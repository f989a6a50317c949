package dk.cloudcreate.servicebus.eventsourcing.eventstream;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The stored (serialized) representation of a single event in an aggregate event stream
 */
public final class StoredAggregateEvent {
    public final UUID           eventId;
    public final long           playhead;
    /**
     * Fully Qualified Class Name of the serialized event
     */
    public final String         eventClass;
    public final String         payload;
    public final OffsetDateTime occurredAt;
    public final OffsetDateTime recordedAt;

    public StoredAggregateEvent(UUID eventId,
                                long playhead,
                                String eventClass,
                                String payload,
                                OffsetDateTime occurredAt,
                                OffsetDateTime recordedAt) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.playhead = playhead;
        this.eventClass = requireNonNull(eventClass, "No eventClass provided");
        this.payload = requireNonNull(payload, "No payload provided");
        this.occurredAt = requireNonNull(occurredAt, "No occurredAt provided");
        this.recordedAt = requireNonNull(recordedAt, "No recordedAt provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredAggregateEvent)) return false;
        return eventId.equals(((StoredAggregateEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "StoredAggregateEvent{" +
                "eventId=" + eventId +
                ", playhead=" + playhead +
                ", eventClass='" + eventClass + '\'' +
                ", occurredAt=" + occurredAt +
                ", recordedAt=" + recordedAt +
                '}';
    }
}
