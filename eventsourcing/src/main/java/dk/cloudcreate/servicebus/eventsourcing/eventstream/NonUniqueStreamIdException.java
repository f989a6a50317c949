package dk.cloudcreate.servicebus.eventsourcing.eventstream;

/**
 * Thrown when a stream is created for an aggregate identifier that already has a stream
 */
public class NonUniqueStreamIdException extends EventStreamStoreException {
    public NonUniqueStreamIdException() {
    }

    public NonUniqueStreamIdException(String message) {
        super(message);
    }

    public NonUniqueStreamIdException(String message, Throwable cause) {
        super(message, cause);
    }

    public NonUniqueStreamIdException(Throwable cause) {
        super(cause);
    }

    public NonUniqueStreamIdException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
