package dk.cloudcreate.servicebus.eventsourcing;

/**
 * Wraps any failure, except {@link dk.cloudcreate.servicebus.eventsourcing.eventstream.NonUniqueStreamIdException}, that occurred while saving an {@link Aggregate}
 */
public class SaveStreamFailedException extends AggregateException {
    public SaveStreamFailedException() {
    }

    public SaveStreamFailedException(String message) {
        super(message);
    }

    public SaveStreamFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public SaveStreamFailedException(Throwable cause) {
        super(cause);
    }

    public SaveStreamFailedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
