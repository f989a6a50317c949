package dk.cloudcreate.servicebus.eventsourcing.eventstream.sql;

import dk.cloudcreate.essentials.shared.Exceptions;
import dk.cloudcreate.servicebus.common.transaction.*;
import dk.cloudcreate.servicebus.eventsourcing.AggregateId;
import dk.cloudcreate.servicebus.eventsourcing.eventstream.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * SQL based {@link EventStreamStore} that keeps one row per stream in the stream table and one row per event in the events table.<br>
 * Uniqueness of a stream is enforced by the primary key of the stream table and uniqueness of a playhead within a stream is enforced
 * by a unique constraint on the events table, so concurrent attempts to create the same stream, or to append the same playhead,
 * are detected by the database.<br>
 * The SQL is compatible with PostgreSQL (and H2 in PostgreSQL mode).
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class SqlEventStreamStore implements EventStreamStore {
    private static final Logger log = LoggerFactory.getLogger(SqlEventStreamStore.class);

    public static final String DEFAULT_STREAM_TABLE_NAME        = "event_store_stream";
    public static final String DEFAULT_STREAM_EVENTS_TABLE_NAME = "event_store_stream_events";
    /**
     * SQLState for unique constraint violations
     */
    static final        String UNIQUE_VIOLATION_SQL_STATE       = "23505";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final String                                                        streamTableName;
    private final String                                                        streamEventsTableName;
    private final AfterSaveHandlersCallback                                     afterSaveHandlersCallback;

    public SqlEventStreamStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, Optional.empty(), Optional.empty());
    }

    /**
     * @param unitOfWorkFactory     the unit of work factory
     * @param streamTableName       the optional name of the stream table (default {@value #DEFAULT_STREAM_TABLE_NAME})
     * @param streamEventsTableName the optional name of the events table (default {@value #DEFAULT_STREAM_EVENTS_TABLE_NAME})
     */
    public SqlEventStreamStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                               Optional<String> streamTableName,
                               Optional<String> streamEventsTableName) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.streamTableName = requireNonNull(streamTableName, "No streamTableName option provided").orElse(DEFAULT_STREAM_TABLE_NAME);
        this.streamEventsTableName = requireNonNull(streamEventsTableName, "No streamEventsTableName option provided").orElse(DEFAULT_STREAM_EVENTS_TABLE_NAME);
        this.afterSaveHandlersCallback = new AfterSaveHandlersCallback();
        initializeTables();
    }

    private void initializeTables() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.execute(bind("CREATE TABLE IF NOT EXISTS {:streamTable} (\n" +
                                        "  id VARCHAR(255) NOT NULL,\n" +
                                        "  identifier_class VARCHAR(255) NOT NULL,\n" +
                                        "  aggregate_class VARCHAR(255) NOT NULL,\n" +
                                        "  created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                        "  closed_at TIMESTAMP WITH TIME ZONE,\n" +
                                        "  PRIMARY KEY (id, identifier_class)\n" +
                                        ")",
                                arg("streamTable", streamTableName)));
            handle.execute(bind("CREATE TABLE IF NOT EXISTS {:eventsTable} (\n" +
                                        "  id VARCHAR(36) PRIMARY KEY,\n" +
                                        "  stream_id VARCHAR(255) NOT NULL,\n" +
                                        "  identifier_class VARCHAR(255) NOT NULL,\n" +
                                        "  playhead BIGINT NOT NULL,\n" +
                                        "  event_class VARCHAR(255) NOT NULL,\n" +
                                        "  payload TEXT NOT NULL,\n" +
                                        "  occured_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                        "  recorded_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                        "  CONSTRAINT {:eventsTable}_playhead_key UNIQUE (stream_id, identifier_class, playhead)\n" +
                                        ")",
                                arg("eventsTable", streamEventsTableName)));
            log.info("Initialized event stream tables '{}' and '{}'", streamTableName, streamEventsTableName);
        });
    }

    @Override
    public void saveStream(StoredAggregateEventStream storedAggregateEventStream, Runnable afterSaveHandler) {
        requireNonNull(storedAggregateEventStream, "No storedAggregateEventStream provided");
        requireNonNull(afterSaveHandler, "No afterSaveHandler provided");
        requireTrue(!storedAggregateEventStream.storedAggregateEvents.isEmpty(), "Cannot save a stream without events");

        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            log.debug("[{}:{}] Creating stream with {} event(s)",
                      storedAggregateEventStream.aggregateIdClass,
                      storedAggregateEventStream.aggregateId,
                      storedAggregateEventStream.storedAggregateEvents.size());
            try {
                unitOfWork.handle()
                          .createUpdate(bind("INSERT INTO {:streamTable} (id, identifier_class, aggregate_class, created_at) " +
                                                     "VALUES (:id, :identifierClass, :aggregateClass, :createdAt)",
                                             arg("streamTable", streamTableName)))
                          .bind("id", storedAggregateEventStream.aggregateId)
                          .bind("identifierClass", storedAggregateEventStream.aggregateIdClass)
                          .bind("aggregateClass", storedAggregateEventStream.aggregateClass)
                          .bind("createdAt", OffsetDateTime.now(ZoneOffset.UTC))
                          .execute();
            } catch (RuntimeException e) {
                if (isUniqueConstraintViolation(e)) {
                    throw new NonUniqueStreamIdException(msg("attempt to add a stream with an existing identifier \"{}:{}\"",
                                                             storedAggregateEventStream.aggregateIdClass,
                                                             storedAggregateEventStream.aggregateId),
                                                         e);
                }
                throw new EventStreamStoreException(msg("[{}:{}] Failed to create stream",
                                                        storedAggregateEventStream.aggregateIdClass,
                                                        storedAggregateEventStream.aggregateId),
                                                    e);
            }
            insertEvents(unitOfWork.handle(), storedAggregateEventStream);
            unitOfWork.registerLifecycleCallbackForResource(afterSaveHandler, afterSaveHandlersCallback);
        });
    }

    @Override
    public void appendStream(StoredAggregateEventStream storedAggregateEventStream, Runnable afterSaveHandler) {
        requireNonNull(storedAggregateEventStream, "No storedAggregateEventStream provided");
        requireNonNull(afterSaveHandler, "No afterSaveHandler provided");
        if (storedAggregateEventStream.storedAggregateEvents.isEmpty()) {
            log.trace("[{}:{}] No events to append",
                      storedAggregateEventStream.aggregateIdClass,
                      storedAggregateEventStream.aggregateId);
            return;
        }

        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            log.debug("[{}:{}] Appending {} event(s) to stream",
                      storedAggregateEventStream.aggregateIdClass,
                      storedAggregateEventStream.aggregateId,
                      storedAggregateEventStream.storedAggregateEvents.size());
            var streamExists = loadStreamRow(unitOfWork.handle(),
                                             storedAggregateEventStream.aggregateId,
                                             storedAggregateEventStream.aggregateIdClass).isPresent();
            if (!streamExists) {
                throw new EventStreamStoreException(msg("[{}:{}] Cannot append to a stream that doesn't exist",
                                                        storedAggregateEventStream.aggregateIdClass,
                                                        storedAggregateEventStream.aggregateId));
            }
            insertEvents(unitOfWork.handle(), storedAggregateEventStream);
            unitOfWork.registerLifecycleCallbackForResource(afterSaveHandler, afterSaveHandlersCallback);
        });
    }

    private void insertEvents(Handle handle, StoredAggregateEventStream storedAggregateEventStream) {
        var batch = handle.prepareBatch(bind("INSERT INTO {:eventsTable} (id, stream_id, identifier_class, playhead, event_class, payload, occured_at, recorded_at) " +
                                                     "VALUES (:id, :streamId, :identifierClass, :playhead, :eventClass, :payload, :occurredAt, :recordedAt)",
                                             arg("eventsTable", streamEventsTableName)));
        storedAggregateEventStream.storedAggregateEvents.forEach(storedEvent -> batch.bind("id", storedEvent.eventId.toString())
                                                                                     .bind("streamId", storedAggregateEventStream.aggregateId)
                                                                                     .bind("identifierClass", storedAggregateEventStream.aggregateIdClass)
                                                                                     .bind("playhead", storedEvent.playhead)
                                                                                     .bind("eventClass", storedEvent.eventClass)
                                                                                     .bind("payload", storedEvent.payload)
                                                                                     .bind("occurredAt", storedEvent.occurredAt)
                                                                                     .bind("recordedAt", storedEvent.recordedAt)
                                                                                     .add());
        try {
            batch.execute();
        } catch (RuntimeException e) {
            if (isUniqueConstraintViolation(e)) {
                throw new EventStreamStoreException(msg("[{}:{}] Optimistic concurrency failure: an event with one of the playheads {}-{} has already been persisted",
                                                        storedAggregateEventStream.aggregateIdClass,
                                                        storedAggregateEventStream.aggregateId,
                                                        storedAggregateEventStream.storedAggregateEvents.get(0).playhead,
                                                        storedAggregateEventStream.storedAggregateEvents.get(storedAggregateEventStream.storedAggregateEvents.size() - 1).playhead),
                                                    e);
            }
            throw new EventStreamStoreException(msg("[{}:{}] Failed to persist {} event(s)",
                                                    storedAggregateEventStream.aggregateIdClass,
                                                    storedAggregateEventStream.aggregateId,
                                                    storedAggregateEventStream.storedAggregateEvents.size()),
                                                e);
        }
    }

    @Override
    public Optional<StoredAggregateEventStream> loadStream(AggregateId id, long fromVersion, Optional<Long> toVersion) {
        requireNonNull(id, "No id provided");
        requireNonNull(toVersion, "No toVersion option provided");
        var identifierClass = id.getClass().getName();
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle    = unitOfWork.handle();
            var streamRow = loadStreamRow(handle, id.value(), identifierClass);
            if (streamRow.isEmpty()) {
                log.trace("[{}:{}] No stream found", identifierClass, id);
                return Optional.<StoredAggregateEventStream>empty();
            }

            var sql = "SELECT * FROM {:eventsTable} WHERE stream_id = :streamId AND identifier_class = :identifierClass AND playhead >= :fromVersion";
            if (toVersion.isPresent()) {
                sql += " AND playhead <= :toVersion";
            }
            sql += " ORDER BY playhead ASC";

            var query = handle.createQuery(bind(sql, arg("eventsTable", streamEventsTableName)))
                              .bind("streamId", id.value())
                              .bind("identifierClass", identifierClass)
                              .bind("fromVersion", fromVersion);
            toVersion.ifPresent(version -> query.bind("toVersion", version));
            var storedEvents = query.map(row -> new StoredAggregateEvent(UUID.fromString(row.getColumn("id", String.class)),
                                                                         row.getColumn("playhead", Long.class),
                                                                         row.getColumn("event_class", String.class),
                                                                         row.getColumn("payload", String.class),
                                                                         toUTC(row.getColumn("occured_at", OffsetDateTime.class)),
                                                                         toUTC(row.getColumn("recorded_at", OffsetDateTime.class))))
                                    .list();
            log.trace("[{}:{}] Loaded {} event(s) from playhead {}", identifierClass, id, storedEvents.size(), fromVersion);
            return Optional.of(new StoredAggregateEventStream(id.value(),
                                                              identifierClass,
                                                              streamRow.get(),
                                                              storedEvents));
        });
    }

    @Override
    public boolean closeStream(AggregateId id) {
        requireNonNull(id, "No id provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var rowsUpdated = unitOfWork.handle()
                                        .createUpdate(bind("UPDATE {:streamTable} SET closed_at = :closedAt " +
                                                                   "WHERE id = :id AND identifier_class = :identifierClass AND closed_at IS NULL",
                                                           arg("streamTable", streamTableName)))
                                        .bind("closedAt", OffsetDateTime.now(ZoneOffset.UTC))
                                        .bind("id", id.value())
                                        .bind("identifierClass", id.getClass().getName())
                                        .execute();
            log.debug("[{}:{}] Stream {}", id.getClass().getName(), id, rowsUpdated == 1 ? "closed" : "was already closed or doesn't exist");
            return rowsUpdated == 1;
        });
    }

    /**
     * @return the aggregate class of the stream, if the stream exists
     */
    private Optional<String> loadStreamRow(Handle handle, String id, String identifierClass) {
        return handle.createQuery(bind("SELECT aggregate_class FROM {:streamTable} WHERE id = :id AND identifier_class = :identifierClass",
                                       arg("streamTable", streamTableName)))
                     .bind("id", id)
                     .bind("identifierClass", identifierClass)
                     .mapTo(String.class)
                     .findOne();
    }

    static boolean isUniqueConstraintViolation(Exception e) {
        var rootCause = Exceptions.getRootCause(e);
        return rootCause instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) rootCause).getSQLState());
    }

    private static OffsetDateTime toUTC(OffsetDateTime timestamp) {
        return timestamp != null ? timestamp.withOffsetSameInstant(ZoneOffset.UTC) : null;
    }

    public String getStreamTableName() {
        return streamTableName;
    }

    public String getStreamEventsTableName() {
        return streamEventsTableName;
    }

    /**
     * Runs the after save handlers registered with a {@link UnitOfWork}, once it has been committed
     */
    private static class AfterSaveHandlersCallback implements UnitOfWorkLifecycleCallback<Runnable> {
        @Override
        public void afterCommit(UnitOfWork unitOfWork, List<Runnable> associatedResources) {
            log.trace("Running {} after save handler(s)", associatedResources.size());
            for (var afterSaveHandler : associatedResources) {
                try {
                    afterSaveHandler.run();
                } catch (RuntimeException e) {
                    log.error("After save handler failed", e);
                }
            }
        }

        @Override
        public void afterRollback(UnitOfWork unitOfWork, List<Runnable> associatedResources, Exception causeOfTheRollback) {
            log.debug("Skipping {} after save handler(s) as the UnitOfWork was rolled back", associatedResources.size());
        }
    }
}
