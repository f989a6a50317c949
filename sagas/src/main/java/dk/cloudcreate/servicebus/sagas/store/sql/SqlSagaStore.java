package dk.cloudcreate.servicebus.sagas.store.sql;

import dk.cloudcreate.essentials.shared.Exceptions;
import dk.cloudcreate.servicebus.common.transaction.*;
import dk.cloudcreate.servicebus.sagas.SagaId;
import dk.cloudcreate.servicebus.sagas.store.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * SQL based {@link SagaStore} that keeps one row per saga.<br>
 * The SQL is compatible with PostgreSQL (and H2 in PostgreSQL mode).
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class SqlSagaStore implements SagaStore {
    private static final Logger log = LoggerFactory.getLogger(SqlSagaStore.class);

    public static final String DEFAULT_SAGAS_TABLE_NAME   = "sagas_store";
    static final        String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final String                                                        sagasTableName;
    private final AfterSaveHandlersCallback                                     afterSaveHandlersCallback = new AfterSaveHandlersCallback();

    public SqlSagaStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory) {
        this(unitOfWorkFactory, Optional.empty());
    }

    /**
     * @param unitOfWorkFactory the unit of work factory
     * @param sagasTableName    the optional name of the sagas table (default {@value #DEFAULT_SAGAS_TABLE_NAME})
     */
    public SqlSagaStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                        Optional<String> sagasTableName) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.sagasTableName = requireNonNull(sagasTableName, "No sagasTableName option provided").orElse(DEFAULT_SAGAS_TABLE_NAME);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute(bind("CREATE TABLE IF NOT EXISTS {:sagasTable} (\n" +
                                                     "  id VARCHAR(255) NOT NULL,\n" +
                                                     "  identifier_class VARCHAR(255) NOT NULL,\n" +
                                                     "  saga_class VARCHAR(255) NOT NULL,\n" +
                                                     "  payload TEXT NOT NULL,\n" +
                                                     "  state_id VARCHAR(50) NOT NULL,\n" +
                                                     "  created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                     "  closed_at TIMESTAMP WITH TIME ZONE,\n" +
                                                     "  PRIMARY KEY (id, identifier_class)\n" +
                                                     ")",
                                             arg("sagasTable", this.sagasTableName)));
            log.info("Initialized sagas table '{}'", this.sagasTableName);
        });
    }

    @Override
    public void save(SerializedSaga serializedSaga, Runnable afterSaveHandler) {
        requireNonNull(serializedSaga, "No serializedSaga provided");
        requireNonNull(afterSaveHandler, "No afterSaveHandler provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            try {
                unitOfWork.handle()
                          .createUpdate(bind("INSERT INTO {:sagasTable} (id, identifier_class, saga_class, payload, state_id, created_at, closed_at) " +
                                                     "VALUES (:id, :identifierClass, :sagaClass, :payload, :stateId, :createdAt, :closedAt)",
                                             arg("sagasTable", sagasTableName)))
                          .bind("id", serializedSaga.id)
                          .bind("identifierClass", serializedSaga.idClass)
                          .bind("sagaClass", serializedSaga.sagaClass)
                          .bind("payload", serializedSaga.payload)
                          .bind("stateId", serializedSaga.stateId)
                          .bind("createdAt", serializedSaga.createdAt)
                          .bindByType("closedAt", serializedSaga.closedAt, OffsetDateTime.class)
                          .execute();
            } catch (RuntimeException e) {
                var rootCause = Exceptions.getRootCause(e);
                if (rootCause instanceof SQLException && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) rootCause).getSQLState())) {
                    throw new DuplicateSagaIdException(msg("Saga with identifier \"{}:{}\" already exists",
                                                           serializedSaga.sagaClass,
                                                           serializedSaga.id),
                                                       e);
                }
                throw new SagaStoreException(msg("[{}:{}] Failed to insert saga", serializedSaga.sagaClass, serializedSaga.id), e);
            }
            log.debug("[{}:{}] Inserted saga with state '{}'", serializedSaga.sagaClass, serializedSaga.id, serializedSaga.stateId);
            unitOfWork.registerLifecycleCallbackForResource(afterSaveHandler, afterSaveHandlersCallback);
        });
    }

    @Override
    public void update(SerializedSaga serializedSaga, Runnable afterSaveHandler) {
        requireNonNull(serializedSaga, "No serializedSaga provided");
        requireNonNull(afterSaveHandler, "No afterSaveHandler provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var rowsUpdated = unitOfWork.handle()
                                        .createUpdate(bind("UPDATE {:sagasTable} SET payload = :payload, state_id = :stateId, closed_at = :closedAt " +
                                                                   "WHERE id = :id AND identifier_class = :identifierClass",
                                                           arg("sagasTable", sagasTableName)))
                                        .bind("payload", serializedSaga.payload)
                                        .bind("stateId", serializedSaga.stateId)
                                        .bindByType("closedAt", serializedSaga.closedAt, OffsetDateTime.class)
                                        .bind("id", serializedSaga.id)
                                        .bind("identifierClass", serializedSaga.idClass)
                                        .execute();
            if (rowsUpdated != 1) {
                throw new SagaStoreException(msg("[{}:{}] Cannot update a saga that doesn't exist", serializedSaga.sagaClass, serializedSaga.id));
            }
            log.debug("[{}:{}] Updated saga with state '{}'", serializedSaga.sagaClass, serializedSaga.id, serializedSaga.stateId);
            unitOfWork.registerLifecycleCallbackForResource(afterSaveHandler, afterSaveHandlersCallback);
        });
    }

    @Override
    public Optional<SerializedSaga> load(SagaId id) {
        requireNonNull(id, "No id provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                       .createQuery(bind("SELECT * FROM {:sagasTable} WHERE id = :id AND identifier_class = :identifierClass",
                                                                                         arg("sagasTable", sagasTableName)))
                                                                       .bind("id", id.id())
                                                                       .bind("identifierClass", id.getClass().getName())
                                                                       .map(row -> new SerializedSaga(row.getColumn("id", String.class),
                                                                                                      row.getColumn("identifier_class", String.class),
                                                                                                      row.getColumn("saga_class", String.class),
                                                                                                      row.getColumn("payload", String.class),
                                                                                                      row.getColumn("state_id", String.class),
                                                                                                      toUTC(row.getColumn("created_at", OffsetDateTime.class)),
                                                                                                      toUTC(row.getColumn("closed_at", OffsetDateTime.class))))
                                                                       .findOne());
    }

    private static OffsetDateTime toUTC(OffsetDateTime timestamp) {
        return timestamp != null ? timestamp.withOffsetSameInstant(ZoneOffset.UTC) : null;
    }

    public String getSagasTableName() {
        return sagasTableName;
    }

    private static class AfterSaveHandlersCallback implements UnitOfWorkLifecycleCallback<Runnable> {
        @Override
        public void afterCommit(UnitOfWork unitOfWork, List<Runnable> associatedResources) {
            for (var afterSaveHandler : associatedResources) {
                try {
                    afterSaveHandler.run();
                } catch (RuntimeException e) {
                    log.error("After save handler failed", e);
                }
            }
        }
    }
}
