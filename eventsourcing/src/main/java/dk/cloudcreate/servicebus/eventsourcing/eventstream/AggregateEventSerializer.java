package dk.cloudcreate.servicebus.eventsourcing.eventstream;

import dk.cloudcreate.servicebus.common.messages.Event;

/**
 * Converts domain events to and from the payload stored in the {@link EventStreamStore}
 */
public interface AggregateEventSerializer {
    String serialize(Event event);

    /**
     * @param eventClass Fully Qualified Class Name of the event
     * @param payload    the serialized event
     * @return the event
     */
    Event unserialize(String eventClass, String payload);
}
