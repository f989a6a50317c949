package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.servicebus.common.messages.Event;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * A domain {@link Event} together with its position (playhead) in the {@link Aggregate}'s event stream
 */
public final class AggregateEvent {
    private final UUID           eventId;
    private final Event          event;
    private final long           playhead;
    private final OffsetDateTime occurredAt;

    public AggregateEvent(UUID eventId, Event event, long playhead, OffsetDateTime occurredAt) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.event = requireNonNull(event, "No event provided");
        this.occurredAt = requireNonNull(occurredAt, "No occurredAt provided");
        requireTrue(playhead > Aggregate.START_PLAYHEAD_INDEX, "playhead must be greater than START_PLAYHEAD_INDEX");
        this.playhead = playhead;
    }

    /**
     * Wrap a newly raised event
     *
     * @param event    the event
     * @param playhead the playhead the event is assigned
     * @return the new {@link AggregateEvent}
     */
    public static AggregateEvent create(Event event, long playhead) {
        return new AggregateEvent(UUID.randomUUID(), event, playhead, OffsetDateTime.now(ZoneOffset.UTC));
    }

    public UUID eventId() {
        return eventId;
    }

    public Event event() {
        return event;
    }

    public long playhead() {
        return playhead;
    }

    public OffsetDateTime occurredAt() {
        return occurredAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateEvent)) return false;
        return eventId.equals(((AggregateEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "AggregateEvent{" +
                "eventId=" + eventId +
                ", event=" + event.getClass().getName() +
                ", playhead=" + playhead +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
