package dk.cloudcreate.servicebus.common.transaction;

/**
 * Thrown when an active {@link UnitOfWork} is required, but none is associated with the current thread
 */
public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }

    public NoActiveUnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    public NoActiveUnitOfWorkException(Throwable cause) {
        super(cause);
    }

    public NoActiveUnitOfWorkException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
