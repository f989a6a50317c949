package dk.cloudcreate.servicebus.eventsourcing;

/**
 * Thrown when the playhead of an event being rehydrated isn't exactly one higher than the version of the {@link Aggregate}
 */
public class AggregateStreamOutOfOrderException extends AggregateException {
    public AggregateStreamOutOfOrderException() {
    }

    public AggregateStreamOutOfOrderException(String message) {
        super(message);
    }

    public AggregateStreamOutOfOrderException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateStreamOutOfOrderException(Throwable cause) {
        super(cause);
    }

    public AggregateStreamOutOfOrderException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
