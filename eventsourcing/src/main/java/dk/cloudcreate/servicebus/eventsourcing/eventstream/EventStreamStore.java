package dk.cloudcreate.servicebus.eventsourcing.eventstream;

import dk.cloudcreate.servicebus.eventsourcing.AggregateId;

import java.util.Optional;

/**
 * Persists and loads the event streams of aggregates.<br>
 * All writes happen within a {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork}: if one is active it's joined,
 * otherwise a new one is created and committed by the store. The <code>afterSaveHandler</code> given to the write operations
 * is called only after that {@link dk.cloudcreate.servicebus.common.transaction.UnitOfWork} has been committed, and never if
 * it's rolled back.
 */
public interface EventStreamStore {
    /**
     * Create a new stream
     *
     * @param storedAggregateEventStream the stream, which must contain the first event(s) of the aggregate
     * @param afterSaveHandler           called after the write has been committed
     * @throws NonUniqueStreamIdException if a stream already exists for the aggregate identifier
     * @throws EventStreamStoreException  in case of any other failure
     */
    void saveStream(StoredAggregateEventStream storedAggregateEventStream, Runnable afterSaveHandler);

    /**
     * Append events to an existing stream
     *
     * @param storedAggregateEventStream the events to append
     * @param afterSaveHandler           called after the write has been committed
     * @throws EventStreamStoreException in case the stream doesn't exist, an event with the same playhead has already been persisted or
     *                                   in case of any other failure
     */
    void appendStream(StoredAggregateEventStream storedAggregateEventStream, Runnable afterSaveHandler);

    /**
     * Load the events of a stream, starting with the event with playhead <code>fromVersion</code>
     *
     * @param id          the aggregate identifier
     * @param fromVersion the lowest (inclusive) playhead to load
     * @return the stream or {@link Optional#empty()} if no stream exists for the identifier
     */
    default Optional<StoredAggregateEventStream> loadStream(AggregateId id, long fromVersion) {
        return loadStream(id, fromVersion, Optional.empty());
    }

    /**
     * Load the events of a stream within the playhead range [<code>fromVersion</code>; <code>toVersion</code>]
     *
     * @param id          the aggregate identifier
     * @param fromVersion the lowest (inclusive) playhead to load
     * @param toVersion   the optional highest (inclusive) playhead to load
     * @return the stream or {@link Optional#empty()} if no stream exists for the identifier
     */
    Optional<StoredAggregateEventStream> loadStream(AggregateId id, long fromVersion, Optional<Long> toVersion);

    /**
     * Mark the stream as closed
     *
     * @param id the aggregate identifier
     * @return true if an open stream was closed
     */
    boolean closeStream(AggregateId id);
}
