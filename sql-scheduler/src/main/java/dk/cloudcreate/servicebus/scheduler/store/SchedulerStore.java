package dk.cloudcreate.servicebus.scheduler.store;

import dk.cloudcreate.servicebus.scheduler.*;

import java.util.Optional;

/**
 * Durable registry of {@link ScheduledOperation}'s ordered by their date.<br>
 * Each change computes the operation that is due next and claims it, so concurrent writers never announce the same
 * operation twice. The claimed {@link NextScheduledOperation} is handed to the post callback after the change has been committed.
 */
public interface SchedulerStore {
    /**
     * Add an operation
     *
     * @param operation the operation to add
     * @param postAdd   called after commit with the added operation and the operation due next
     */
    void add(ScheduledOperation operation, PostAdd postAdd);

    /**
     * Remove an operation. Removing an unknown operation only recomputes the operation due next
     *
     * @param id         the id of the operation to remove
     * @param postRemove called after commit with the operation due next
     */
    void remove(ScheduledOperationId id, PostRemove postRemove);

    /**
     * Remove an operation and hand it to the <code>postExtract</code> callback
     *
     * @param id          the id of the operation to extract
     * @param postExtract called after commit with the extracted operation and the operation due next
     * @throws ScheduledOperationNotFoundException if no operation exists with the id, or another writer extracted or removed it first
     */
    void extract(ScheduledOperationId id, PostExtract postExtract);

    /**
     * Load an operation
     *
     * @param id the operation id
     * @return the operation or {@link Optional#empty()} if it doesn't exist
     */
    Optional<ScheduledOperation> load(ScheduledOperationId id);

    @FunctionalInterface
    interface PostAdd {
        void added(ScheduledOperation operation, Optional<NextScheduledOperation> nextOperation);
    }

    @FunctionalInterface
    interface PostRemove {
        void removed(Optional<NextScheduledOperation> nextOperation);
    }

    @FunctionalInterface
    interface PostExtract {
        void extracted(ScheduledOperation operation, Optional<NextScheduledOperation> nextOperation);
    }
}
