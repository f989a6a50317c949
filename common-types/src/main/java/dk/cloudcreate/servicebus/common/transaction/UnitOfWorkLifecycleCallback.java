package dk.cloudcreate.servicebus.common.transaction;

import java.util.List;

/**
 * Callback that can be registered with a {@link UnitOfWork} for one or more resources (e.g. the messages
 * that must be delivered once a write has been committed).<br>
 * When the {@link UnitOfWork} is committed or rolled back the callback is called with all the resources that
 * were associated with it through {@link UnitOfWork#registerLifecycleCallbackForResource(Object, UnitOfWorkLifecycleCallback)}
 * <p>
 * {@link #afterCommit(UnitOfWork, List)} is only called after the underlying database transaction has been committed,
 * and never if the commit failed.
 *
 * @param <RESOURCE_TYPE> the type of resource tracked
 */
public interface UnitOfWorkLifecycleCallback<RESOURCE_TYPE> {
    default void beforeCommit(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources) {
    }

    void afterCommit(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources);

    default void beforeRollback(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources, Exception causeOfTheRollback) {
    }

    default void afterRollback(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources, Exception causeOfTheRollback) {
    }
}
