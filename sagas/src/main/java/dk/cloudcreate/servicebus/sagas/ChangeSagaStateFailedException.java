package dk.cloudcreate.servicebus.sagas;

/**
 * Thrown when the state of a closed {@link Saga} is changed
 */
public class ChangeSagaStateFailedException extends RuntimeException {
    public ChangeSagaStateFailedException() {
    }

    public ChangeSagaStateFailedException(String message) {
        super(message);
    }

    public ChangeSagaStateFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChangeSagaStateFailedException(Throwable cause) {
        super(cause);
    }

    public ChangeSagaStateFailedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
