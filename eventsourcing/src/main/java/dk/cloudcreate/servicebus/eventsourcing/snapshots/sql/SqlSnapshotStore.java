package dk.cloudcreate.servicebus.eventsourcing.snapshots.sql;

import dk.cloudcreate.servicebus.common.serializer.json.*;
import dk.cloudcreate.servicebus.common.transaction.*;
import dk.cloudcreate.servicebus.eventsourcing.*;
import dk.cloudcreate.servicebus.eventsourcing.snapshots.*;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * SQL based {@link SnapshotStore}, which stores the {@link Aggregate} of each {@link AggregateSnapshot} as JSON.<br>
 * The table holds at most one snapshot per aggregate.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class SqlSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SqlSnapshotStore.class);

    public static final String DEFAULT_SNAPSHOTS_TABLE_NAME = "event_store_snapshots";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final JSONSerializer                                                jsonSerializer;
    private final String                                                        snapshotsTableName;

    public SqlSnapshotStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, new JacksonJSONSerializer(), Optional.empty());
    }

    /**
     * @param unitOfWorkFactory  the unit of work factory
     * @param jsonSerializer     the serializer used for the snapshot payload
     * @param snapshotsTableName the optional name of the snapshots table (default {@value #DEFAULT_SNAPSHOTS_TABLE_NAME})
     */
    public SqlSnapshotStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                            JSONSerializer jsonSerializer,
                            Optional<String> snapshotsTableName) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.snapshotsTableName = requireNonNull(snapshotsTableName, "No snapshotsTableName option provided").orElse(DEFAULT_SNAPSHOTS_TABLE_NAME);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute(bind("CREATE TABLE IF NOT EXISTS {:snapshotsTable} (\n" +
                                                     "  id VARCHAR(255) NOT NULL,\n" +
                                                     "  identifier_class VARCHAR(255) NOT NULL,\n" +
                                                     "  aggregate_class VARCHAR(255) NOT NULL,\n" +
                                                     "  version BIGINT NOT NULL,\n" +
                                                     "  payload TEXT NOT NULL,\n" +
                                                     "  created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                     "  PRIMARY KEY (id, identifier_class)\n" +
                                                     ")",
                                             arg("snapshotsTable", this.snapshotsTableName)));
            log.info("Initialized snapshots table '{}'", this.snapshotsTableName);
        });
    }

    @Override
    public void save(AggregateSnapshot<?> aggregateSnapshot) {
        requireNonNull(aggregateSnapshot, "No aggregateSnapshot provided");
        var aggregate = aggregateSnapshot.aggregate();
        var payload   = jsonSerializer.serialize(aggregate);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle()
                      .createUpdate(bind("INSERT INTO {:snapshotsTable} (id, identifier_class, aggregate_class, version, payload, created_at) " +
                                                 "VALUES (:id, :identifierClass, :aggregateClass, :version, :payload, :createdAt)",
                                         arg("snapshotsTable", snapshotsTableName)))
                      .bind("id", aggregate.id().value())
                      .bind("identifierClass", aggregate.id().getClass().getName())
                      .bind("aggregateClass", aggregate.getClass().getName())
                      .bind("version", aggregateSnapshot.version())
                      .bind("payload", payload)
                      .bind("createdAt", OffsetDateTime.now(ZoneOffset.UTC))
                      .execute();
            log.trace("[{}:{}] Inserted snapshot with version {} into '{}'",
                      aggregate.id().getClass().getName(),
                      aggregate.id(),
                      aggregateSnapshot.version(),
                      snapshotsTableName);
        });
    }

    /**
     * The row is read inside a {@link UnitOfWork}, while the payload is deserialized outside it, so an unreadable
     * snapshot never marks a surrounding {@link UnitOfWork} as rollback only
     */
    @Override
    public Optional<AggregateSnapshot<?>> load(AggregateId id) {
        requireNonNull(id, "No id provided");
        Optional<SnapshotRow> snapshotRow = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                                                     .createQuery(bind("SELECT aggregate_class, version, payload FROM {:snapshotsTable} " +
                                                                                                                               "WHERE id = :id AND identifier_class = :identifierClass",
                                                                                                                       arg("snapshotsTable", snapshotsTableName)))
                                                                                                     .bind("id", id.value())
                                                                                                     .bind("identifierClass", id.getClass().getName())
                                                                                                     .map(row -> new SnapshotRow(row.getColumn("aggregate_class", String.class),
                                                                                                                                 row.getColumn("version", Long.class),
                                                                                                                                 row.getColumn("payload", String.class)))
                                                                                                     .findOne());
        return snapshotRow.map(row -> toSnapshot(id, row.aggregateClass, row.version, row.payload));
    }

    private AggregateSnapshot<?> toSnapshot(AggregateId id, String aggregateClass, long version, String payload) {
        Object aggregate = jsonSerializer.deserialize(payload, aggregateClass);
        if (!(aggregate instanceof Aggregate)) {
            throw new SnapshotStoreException(msg("[{}:{}] Snapshot payload of type '{}' isn't an Aggregate",
                                                 id.getClass().getName(),
                                                 id,
                                                 aggregateClass));
        }
        var snapshotAggregate = (Aggregate<?>) aggregate;
        if (snapshotAggregate.version() != version) {
            throw new SnapshotStoreException(msg("[{}:{}] Snapshot version {} differs from the version {} of the snapshot aggregate",
                                                 id.getClass().getName(),
                                                 id,
                                                 version,
                                                 snapshotAggregate.version()));
        }
        return new AggregateSnapshot<Aggregate<?>>(snapshotAggregate, version);
    }

    @Override
    public void remove(AggregateId id) {
        requireNonNull(id, "No id provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var rowsDeleted = unitOfWork.handle()
                                        .createUpdate(bind("DELETE FROM {:snapshotsTable} WHERE id = :id AND identifier_class = :identifierClass",
                                                           arg("snapshotsTable", snapshotsTableName)))
                                        .bind("id", id.value())
                                        .bind("identifierClass", id.getClass().getName())
                                        .execute();
            log.trace("[{}:{}] Removed {} snapshot(s) from '{}'", id.getClass().getName(), id, rowsDeleted, snapshotsTableName);
        });
    }

    public String getSnapshotsTableName() {
        return snapshotsTableName;
    }

    private static class SnapshotRow {
        final String aggregateClass;
        final long   version;
        final String payload;

        SnapshotRow(String aggregateClass, long version, String payload) {
            this.aggregateClass = aggregateClass;
            this.version = version;
            this.payload = payload;
        }
    }
}
