package dk.cloudcreate.servicebus.sagas;

/**
 * The life cycle status of a {@link Saga}. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum SagaStatus {
    /**
     * The saga has been created, but {@link Saga#start} hasn't run yet
     */
    CREATED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    /**
     * Can the saga still change its state
     */
    public boolean inProgress() {
        return this != COMPLETED && this != FAILED;
    }

    public boolean isClosed() {
        return !inProgress();
    }
}
