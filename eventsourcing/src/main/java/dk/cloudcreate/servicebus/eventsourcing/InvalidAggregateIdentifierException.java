package dk.cloudcreate.servicebus.eventsourcing;

/**
 * Thrown when an {@link AggregateId} is used with an {@link Aggregate} type it doesn't belong to
 */
public class InvalidAggregateIdentifierException extends AggregateException {
    public InvalidAggregateIdentifierException() {
    }

    public InvalidAggregateIdentifierException(String message) {
        super(message);
    }

    public InvalidAggregateIdentifierException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidAggregateIdentifierException(Throwable cause) {
        super(cause);
    }

    public InvalidAggregateIdentifierException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
