package dk.cloudcreate.servicebus.common.serializer.json;

public class JSONSerializationException extends RuntimeException {
    public JSONSerializationException(String message) {
        super(message);
    }

    public JSONSerializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
