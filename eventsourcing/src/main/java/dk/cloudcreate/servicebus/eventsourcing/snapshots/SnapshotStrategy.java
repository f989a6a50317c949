package dk.cloudcreate.servicebus.eventsourcing.snapshots;

import dk.cloudcreate.servicebus.eventsourcing.Aggregate;

import java.util.Optional;

/**
 * Decides whether a new {@link AggregateSnapshot} must be created after an {@link Aggregate} has been saved
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
@FunctionalInterface
public interface SnapshotStrategy {
    /**
     * @param aggregate        the aggregate that was just saved
     * @param previousSnapshot the latest snapshot of the aggregate (if any)
     * @return true if a new snapshot must be created
     */
    boolean isSnapshotRequired(Aggregate<?> aggregate, Optional<AggregateSnapshot<?>> previousSnapshot);
}
