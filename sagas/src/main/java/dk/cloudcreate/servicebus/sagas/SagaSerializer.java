package dk.cloudcreate.servicebus.sagas;

import dk.cloudcreate.servicebus.common.serializer.json.*;
import dk.cloudcreate.servicebus.sagas.store.SerializedSaga;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Converts a {@link Saga} to and from its {@link SerializedSaga} representation.<br>
 * The buffered events and commands are never serialized and are always empty on a deserialized {@link Saga}.
 */
public class SagaSerializer {
    private final JSONSerializer jsonSerializer;

    public SagaSerializer() {
        this(new JacksonJSONSerializer());
    }

    public SagaSerializer(JSONSerializer jsonSerializer) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    public SerializedSaga serialize(Saga saga) {
        requireNonNull(saga, "No saga provided");
        return new SerializedSaga(saga.id().id(),
                                  saga.id().getClass().getName(),
                                  saga.getClass().getName(),
                                  jsonSerializer.serialize(saga),
                                  saga.status().name(),
                                  saga.createdAt(),
                                  saga.closedAt().orElse(null));
    }

    public Saga deserialize(SerializedSaga serializedSaga) {
        requireNonNull(serializedSaga, "No serializedSaga provided");
        Object deserialized = jsonSerializer.deserialize(serializedSaga.payload, serializedSaga.sagaClass);
        if (!(deserialized instanceof Saga)) {
            throw new JSONDeserializationException(msg("Saga '{}' with id '{}' deserialized to '{}'",
                                                       serializedSaga.sagaClass,
                                                       serializedSaga.id,
                                                       deserialized == null ? null : deserialized.getClass().getName()));
        }
        var saga = (Saga) deserialized;
        saga.clear();
        return saga;
    }
}
