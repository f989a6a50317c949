package dk.cloudcreate.servicebus.eventsourcing.snapshots;

public class SnapshotStoreException extends RuntimeException {
    public SnapshotStoreException() {
    }

    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public SnapshotStoreException(Throwable cause) {
        super(cause);
    }

    public SnapshotStoreException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
