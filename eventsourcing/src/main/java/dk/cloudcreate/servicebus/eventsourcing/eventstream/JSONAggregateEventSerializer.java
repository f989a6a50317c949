package dk.cloudcreate.servicebus.eventsourcing.eventstream;

import dk.cloudcreate.servicebus.common.messages.Event;
import dk.cloudcreate.servicebus.common.serializer.json.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link AggregateEventSerializer} that stores events as JSON
 */
public class JSONAggregateEventSerializer implements AggregateEventSerializer {
    private final JSONSerializer jsonSerializer;

    public JSONAggregateEventSerializer() {
        this(new JacksonJSONSerializer());
    }

    public JSONAggregateEventSerializer(JSONSerializer jsonSerializer) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    @Override
    public String serialize(Event event) {
        return jsonSerializer.serialize(event);
    }

    @Override
    public Event unserialize(String eventClass, String payload) {
        return jsonSerializer.deserialize(payload, eventClass);
    }
}
