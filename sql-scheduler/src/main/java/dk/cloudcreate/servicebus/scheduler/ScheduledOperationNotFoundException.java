package dk.cloudcreate.servicebus.scheduler;

public class ScheduledOperationNotFoundException extends RuntimeException {
    public ScheduledOperationNotFoundException() {
    }

    public ScheduledOperationNotFoundException(String message) {
        super(message);
    }

    public ScheduledOperationNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public ScheduledOperationNotFoundException(Throwable cause) {
        super(cause);
    }

    public ScheduledOperationNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
