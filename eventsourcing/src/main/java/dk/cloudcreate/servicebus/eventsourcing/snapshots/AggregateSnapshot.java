package dk.cloudcreate.servicebus.eventsourcing.snapshots;

import dk.cloudcreate.servicebus.eventsourcing.Aggregate;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * A materialized {@link Aggregate} together with the version (playhead) it was captured at
 *
 * @param <A> the aggregate type
 */
public final class AggregateSnapshot<A extends Aggregate<?>> {
    private final A    aggregate;
    private final long version;

    public AggregateSnapshot(A aggregate, long version) {
        this.aggregate = requireNonNull(aggregate, "No aggregate provided");
        requireTrue(version >= Aggregate.START_PLAYHEAD_INDEX, "version must be >= " + Aggregate.START_PLAYHEAD_INDEX);
        this.version = version;
    }

    public A aggregate() {
        return aggregate;
    }

    public long version() {
        return version;
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" +
                "aggregateClass=" + aggregate.getClass().getName() +
                ", aggregateId=" + aggregate.id() +
                ", version=" + version +
                '}';
    }
}
