package dk.cloudcreate.servicebus.eventsourcing.eventstream;

public class EventStreamStoreException extends RuntimeException {
    public EventStreamStoreException() {
    }

    public EventStreamStoreException(String message) {
        super(message);
    }

    public EventStreamStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventStreamStoreException(Throwable cause) {
        super(cause);
    }

    public EventStreamStoreException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
