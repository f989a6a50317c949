package dk.cloudcreate.servicebus.scheduler;

import dk.cloudcreate.servicebus.common.messages.Command;
import dk.cloudcreate.servicebus.common.serializer.json.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Converts the {@link Command} of a {@link ScheduledOperation} to and from an opaque byte payload.<br>
 * The payload is a JSON envelope holding the command type and the command JSON:
 * <pre>{@code
 * {"commandType":"com.company.ShipOrder","command":"{\"orderId\":\"order-1\"}"}
 * }</pre>
 */
public class ScheduledCommandSerializer {
    private final JSONSerializer jsonSerializer;

    public ScheduledCommandSerializer() {
        this(new JacksonJSONSerializer());
    }

    public ScheduledCommandSerializer(JSONSerializer jsonSerializer) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    public byte[] serialize(Command command) {
        requireNonNull(command, "No command provided");
        return jsonSerializer.serializeAsBytes(new CommandEnvelope(command.getClass().getName(),
                                                                   jsonSerializer.serialize(command)));
    }

    public Command deserialize(byte[] payload) {
        requireNonNull(payload, "No payload provided");
        var envelope = jsonSerializer.deserialize(payload, CommandEnvelope.class);
        Object command = jsonSerializer.deserialize(envelope.command, envelope.commandType);
        if (!(command instanceof Command)) {
            throw new JSONDeserializationException(msg("Scheduled payload of type '{}' isn't a Command", envelope.commandType));
        }
        return (Command) command;
    }

    static class CommandEnvelope {
        String commandType;
        String command;

        CommandEnvelope(String commandType, String command) {
            this.commandType = commandType;
            this.command = command;
        }
    }
}
