package dk.cloudcreate.servicebus.common.serializer.json;

public class JSONDeserializationException extends RuntimeException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
