package dk.cloudcreate.servicebus.eventsourcing.snapshots;

import dk.cloudcreate.servicebus.eventsourcing.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Loads and stores {@link AggregateSnapshot}'s and decides, using the {@link SnapshotStrategy}, when a new snapshot must be created.<br>
 * Snapshots are only a cache of the event stream, so failures to load or store a snapshot are logged and otherwise treated as
 * if there was no snapshot.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class Snapshotter {
    private static final Logger log = LoggerFactory.getLogger(Snapshotter.class);

    private final SnapshotStore    snapshotStore;
    private final SnapshotStrategy snapshotStrategy;

    /**
     * Create a {@link Snapshotter} using a {@link SnapshotVersionStrategy} with the default step size
     */
    public Snapshotter(SnapshotStore snapshotStore) {
        this(snapshotStore, new SnapshotVersionStrategy());
    }

    public Snapshotter(SnapshotStore snapshotStore, SnapshotStrategy snapshotStrategy) {
        this.snapshotStore = requireNonNull(snapshotStore, "No snapshotStore provided");
        this.snapshotStrategy = requireNonNull(snapshotStrategy, "No snapshotStrategy provided");
    }

    public Optional<AggregateSnapshot<?>> load(AggregateId id) {
        requireNonNull(id, "No id provided");
        try {
            return snapshotStore.load(id);
        } catch (RuntimeException e) {
            log.error(msg("[{}:{}] Failed to load snapshot, falling back to replaying the full event stream",
                          id.getClass().getName(),
                          id),
                      e);
            return Optional.empty();
        }
    }

    /**
     * Replace the previous snapshot of the aggregate with the given snapshot
     *
     * @return true if the snapshot was stored
     */
    public boolean store(AggregateSnapshot<?> aggregateSnapshot) {
        requireNonNull(aggregateSnapshot, "No aggregateSnapshot provided");
        var id = aggregateSnapshot.aggregate().id();
        try {
            snapshotStore.remove(id);
            snapshotStore.save(aggregateSnapshot);
            log.debug("[{}:{}] Stored snapshot with version {}", id.getClass().getName(), id, aggregateSnapshot.version());
            return true;
        } catch (RuntimeException e) {
            log.error(msg("[{}:{}] Failed to store snapshot with version {}",
                          id.getClass().getName(),
                          id,
                          aggregateSnapshot.version()),
                      e);
            return false;
        }
    }

    public boolean snapshotMustBeCreated(Aggregate<?> aggregate, Optional<AggregateSnapshot<?>> lastSnapshot) {
        return snapshotStrategy.isSnapshotRequired(aggregate, lastSnapshot);
    }
}
