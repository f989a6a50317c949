package dk.cloudcreate.servicebus.eventsourcing.snapshots;

import dk.cloudcreate.servicebus.eventsourcing.AggregateId;

import java.util.Optional;

/**
 * Storage for the latest {@link AggregateSnapshot} of each aggregate
 */
public interface SnapshotStore {
    void save(AggregateSnapshot<?> aggregateSnapshot);

    Optional<AggregateSnapshot<?>> load(AggregateId id);

    /**
     * Remove the snapshot of the aggregate (if any)
     */
    void remove(AggregateId id);
}
