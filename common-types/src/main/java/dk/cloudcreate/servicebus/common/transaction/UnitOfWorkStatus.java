package dk.cloudcreate.servicebus.common.transaction;

/**
 * The status of a {@link UnitOfWork}
 */
public enum UnitOfWorkStatus {
    /**
     * The {@link UnitOfWork} has been created, but not yet {@link #Started}
     */
    Ready(false),
    /**
     * The {@link UnitOfWork} has been started (i.e. the underlying database transaction has begun)
     */
    Started(false),
    /**
     * The {@link UnitOfWork} and its database transaction have been committed
     */
    Committed(true),
    /**
     * The {@link UnitOfWork} and its database transaction have been rolled back
     */
    RolledBack(true),
    /**
     * The {@link UnitOfWork} is still active, but MUST be rolled back when it ends
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
