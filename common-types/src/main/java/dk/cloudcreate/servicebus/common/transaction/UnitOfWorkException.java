package dk.cloudcreate.servicebus.common.transaction;

/**
 * Represents an Exception that occurred in relation to a {@link UnitOfWork}, e.g. a failure to begin, commit or roll back
 * the underlying transaction, or a checked exception thrown inside {@link UnitOfWorkFactory#usingUnitOfWork}
 */
public class UnitOfWorkException extends RuntimeException {
    public UnitOfWorkException() {
    }

    public UnitOfWorkException(String message) {
        super(message);
    }

    public UnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnitOfWorkException(Throwable cause) {
        super(cause);
    }

    public UnitOfWorkException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
