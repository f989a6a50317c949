package dk.cloudcreate.servicebus.sagas.store;

/**
 * Thrown when a saga is started with an identifier that's already in use
 */
public class DuplicateSagaIdException extends SagaStoreException {
    public DuplicateSagaIdException() {
    }

    public DuplicateSagaIdException(String message) {
        super(message);
    }

    public DuplicateSagaIdException(String message, Throwable cause) {
        super(message, cause);
    }

    public DuplicateSagaIdException(Throwable cause) {
        super(cause);
    }

    public DuplicateSagaIdException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
