package dk.cloudcreate.servicebus.common.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}
 *
 * @see #createDefaultObjectMapper()
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private final ObjectMapper objectMapper;

    /**
     * Create a serializer using {@link #createDefaultObjectMapper()}
     */
    public JacksonJSONSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper instance provided");
    }

    /**
     * Create an {@link ObjectMapper} that serializes the <b>fields</b> (ignoring <code>transient</code> fields, getters and setters)
     * of the objects, supports the JSR-310 date/time types and is able to deserialize into types that don't have a default
     * constructor (see {@link ObjenesisJacksonModule}), which e.g. is the case for immutable events, aggregates and sagas.
     *
     * @return the configured {@link ObjectMapper}
     */
    public static ObjectMapper createDefaultObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(new ObjenesisJacksonModule());
        objectMapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        objectMapper.configure(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE, false);
        return objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public String serialize(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (Exception e) {
            throw new JSONSerializationException(msg("Failed to serialize '{}' to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @Override
    public byte[] serializeAsBytes(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsBytes(objectToSerialize);
        } catch (Exception e) {
            throw new JSONSerializationException(msg("Failed to serialize '{}' to JSON", objectToSerialize.getClass().getName()), e);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T deserialize(String json, String javaType) {
        requireNonNull(javaType, "No javaType provided");
        Class<?> type;
        try {
            type = Class.forName(javaType);
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(msg("Failed to resolve the Java type '{}'", javaType), e);
        }
        return (T) deserialize(json, type);
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (Exception e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to '{}'", javaType.getName()), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (Exception e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to '{}'", javaType.getName()), e);
        }
    }
}
