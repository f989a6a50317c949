package dk.cloudcreate.servicebus.sagas;

public class InvalidSagaIdentifierException extends RuntimeException {
    public InvalidSagaIdentifierException() {
    }

    public InvalidSagaIdentifierException(String message) {
        super(message);
    }

    public InvalidSagaIdentifierException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidSagaIdentifierException(Throwable cause) {
        super(cause);
    }

    public InvalidSagaIdentifierException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
