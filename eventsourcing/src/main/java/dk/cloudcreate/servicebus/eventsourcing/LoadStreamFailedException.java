package dk.cloudcreate.servicebus.eventsourcing;

/**
 * Wraps any failure (e.g. a storage or deserialization failure) that occurred while loading an {@link Aggregate}
 */
public class LoadStreamFailedException extends AggregateException {
    public LoadStreamFailedException() {
    }

    public LoadStreamFailedException(String message) {
        super(message);
    }

    public LoadStreamFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public LoadStreamFailedException(Throwable cause) {
        super(cause);
    }

    public LoadStreamFailedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
