package dk.cloudcreate.servicebus.common.transaction;

/**
 * A unit of work wraps exactly one underlying database transaction. It's owned by the single logical
 * operation that started it and must never be shared between concurrent operations.
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and the underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#Committed}<br>
     * If the {@link UnitOfWork} has been marked as {@link UnitOfWorkStatus#MarkedForRollbackOnly} it will be rolled back instead
     *
     * @throws UnitOfWorkException if the commit failed or the {@link UnitOfWork} was rolled back because it was marked as rollback only.
     *                             In the latter case the cause is the exception that marked it as rollback only
     */
    void commit();

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}.<br>
     * Calling rollback on an already completed {@link UnitOfWork} is ignored
     *
     * @param cause the cause of the rollback
     */
    void rollback(Exception cause);

    /**
     * Get the status of the {@link UnitOfWork}
     */
    UnitOfWorkStatus status();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    void markAsRollbackOnly(Exception cause);

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     */
    default void rollback() {
        // Use any exception saved using #markAsRollbackOnly(Exception)
        rollback(getCauseOfRollback());
    }

    /**
     * Register a resource that should have its {@link UnitOfWorkLifecycleCallback} called when this {@link UnitOfWork}
     * commits or rolls back.<br>
     * Example - deliver messages once the rows that produced them have been committed:
     * <pre>{@code
     * unitOfWork.registerLifecycleCallbackForResource(events, new UnitOfWorkLifecycleCallback<List<Event>>() {
     *     @Override
     *     public void afterCommit(UnitOfWork unitOfWork, List<List<Event>> associatedResources) {
     *         associatedResources.forEach(deliveryContext::delivery);
     *     }
     * });
     * }</pre>
     *
     * @param resource                     the resource that should be tracked
     * @param associatedUnitOfWorkCallback the callback instance for the given resource
     * @param <T>                          the type of resource
     * @return the <code>resource</code>
     */
    <T> T registerLifecycleCallbackForResource(T resource, UnitOfWorkLifecycleCallback<T> associatedUnitOfWorkCallback);
}
