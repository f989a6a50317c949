package dk.cloudcreate.servicebus.eventsourcing.snapshots;

import dk.cloudcreate.servicebus.eventsourcing.Aggregate;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * {@link SnapshotStrategy} that requires a new snapshot every time the aggregate version has moved
 * at least <code>stepSize</code> playheads past the previous snapshot (or past the start of the stream, if there's no snapshot)
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class SnapshotVersionStrategy implements SnapshotStrategy {
    public static final int DEFAULT_STEP_SIZE = 10;

    private final int stepSize;

    public SnapshotVersionStrategy() {
        this(DEFAULT_STEP_SIZE);
    }

    public SnapshotVersionStrategy(int stepSize) {
        requireTrue(stepSize > 0, "stepSize must be > 0");
        this.stepSize = stepSize;
    }

    @Override
    public boolean isSnapshotRequired(Aggregate<?> aggregate, Optional<AggregateSnapshot<?>> previousSnapshot) {
        requireNonNull(aggregate, "No aggregate provided");
        requireNonNull(previousSnapshot, "No previousSnapshot option provided");
        return previousSnapshot.map(snapshot -> aggregate.version() - snapshot.version() >= stepSize)
                               .orElseGet(() -> aggregate.version() >= stepSize);
    }

    public int getStepSize() {
        return stepSize;
    }

    @Override
    public String toString() {
        return "SnapshotVersionStrategy{" +
                "stepSize=" + stepSize +
                '}';
    }
}
