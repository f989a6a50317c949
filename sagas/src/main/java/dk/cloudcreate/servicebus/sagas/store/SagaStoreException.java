package dk.cloudcreate.servicebus.sagas.store;

public class SagaStoreException extends RuntimeException {
    public SagaStoreException() {
    }

    public SagaStoreException(String message) {
        super(message);
    }

    public SagaStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public SagaStoreException(Throwable cause) {
        super(cause);
    }

    public SagaStoreException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
