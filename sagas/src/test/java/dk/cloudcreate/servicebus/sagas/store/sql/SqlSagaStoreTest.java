package dk.cloudcreate.servicebus.sagas.store.sql;

import dk.cloudcreate.servicebus.common.transaction.JdbiUnitOfWorkFactory;
import dk.cloudcreate.servicebus.sagas.*;
import dk.cloudcreate.servicebus.sagas.store.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class SqlSagaStoreTest {
    private JdbiUnitOfWorkFactory unitOfWorkFactory;
    private SqlSagaStore          sagaStore;

    @BeforeEach
    void setup() {
        var jdbi = Jdbi.create("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
        sagaStore = new SqlSagaStore(unitOfWorkFactory, Optional.of("order_sagas"));
    }

    @Test
    void verify_the_table_can_be_initialized_more_than_once() {
        var secondStore = new SqlSagaStore(unitOfWorkFactory, Optional.of("order_sagas"));

        assertThat(secondStore.getSagasTableName()).isEqualTo("order_sagas");
        assertThat(new SqlSagaStore(unitOfWorkFactory).getSagasTableName()).isEqualTo(SqlSagaStore.DEFAULT_SAGAS_TABLE_NAME);
    }

    @Test
    void verify_loading_an_unknown_saga_returns_empty() {
        assertThat(sagaStore.load(SagaId.random(OrderFulfillmentSaga.class))).isEmpty();
    }

    @Test
    void verify_a_saved_saga_can_be_loaded_and_updated() {
        // Given
        var sagaId         = SagaId.random(OrderFulfillmentSaga.class);
        var createdAt      = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        var afterSaveCalls = new AtomicInteger();
        sagaStore.save(serializedSaga(sagaId, "{\"version\":1}", "IN_PROGRESS", createdAt, null), afterSaveCalls::incrementAndGet);

        // When
        var loaded = sagaStore.load(sagaId);

        // Then
        assertThat(afterSaveCalls.get()).isEqualTo(1);
        assertThat(loaded).isPresent();
        assertThat(loaded.get().id).isEqualTo(sagaId.id());
        assertThat(loaded.get().idClass).isEqualTo(SagaId.class.getName());
        assertThat(loaded.get().sagaClass).isEqualTo(OrderFulfillmentSaga.class.getName());
        assertThat(loaded.get().payload).isEqualTo("{\"version\":1}");
        assertThat(loaded.get().stateId).isEqualTo("IN_PROGRESS");
        assertThat(loaded.get().createdAt).isEqualTo(createdAt);
        assertThat(loaded.get().closedAt()).isEmpty();

        // When
        var closedAt = createdAt.plusMinutes(5);
        sagaStore.update(serializedSaga(sagaId, "{\"version\":2}", "COMPLETED", createdAt, closedAt), afterSaveCalls::incrementAndGet);

        // Then
        assertThat(afterSaveCalls.get()).isEqualTo(2);
        var updated = sagaStore.load(sagaId).orElseThrow();
        assertThat(updated.payload).isEqualTo("{\"version\":2}");
        assertThat(updated.stateId).isEqualTo("COMPLETED");
        assertThat(updated.createdAt).isEqualTo(createdAt);
        assertThat(updated.closedAt()).hasValue(closedAt);
    }

    @Test
    void verify_saving_an_existing_saga_fails_and_skips_the_after_save_handler() {
        // Given
        var sagaId         = SagaId.random(OrderFulfillmentSaga.class);
        var createdAt      = OffsetDateTime.now(ZoneOffset.UTC);
        var afterSaveCalls = new AtomicInteger();
        sagaStore.save(serializedSaga(sagaId, "{}", "IN_PROGRESS", createdAt, null), afterSaveCalls::incrementAndGet);

        // When / Then
        assertThatThrownBy(() -> sagaStore.save(serializedSaga(sagaId, "{}", "IN_PROGRESS", createdAt, null), afterSaveCalls::incrementAndGet))
                .isInstanceOf(DuplicateSagaIdException.class)
                .isInstanceOf(SagaStoreException.class);
        assertThat(afterSaveCalls.get()).isEqualTo(1);
    }

    @Test
    void verify_updating_an_unknown_saga_fails() {
        var afterSaveCalls = new AtomicInteger();

        assertThatThrownBy(() -> sagaStore.update(serializedSaga(SagaId.random(OrderFulfillmentSaga.class), "{}", "COMPLETED", OffsetDateTime.now(ZoneOffset.UTC), null),
                                                  afterSaveCalls::incrementAndGet))
                .isExactlyInstanceOf(SagaStoreException.class);
        assertThat(afterSaveCalls.get()).isEqualTo(0);
    }

    @Test
    void verify_the_after_save_handler_is_called_when_the_outer_unit_of_work_commits() {
        // Given
        var sagaId         = SagaId.random(OrderFulfillmentSaga.class);
        var afterSaveCalls = new AtomicInteger();

        // When
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            sagaStore.save(serializedSaga(sagaId, "{}", "IN_PROGRESS", OffsetDateTime.now(ZoneOffset.UTC), null), afterSaveCalls::incrementAndGet);
            // Then
            assertThat(afterSaveCalls.get()).isEqualTo(0);
        });

        // And
        assertThat(afterSaveCalls.get()).isEqualTo(1);
    }

    @Test
    void verify_a_failing_after_save_handler_does_not_stop_the_following_handlers() {
        // Given
        var firstSagaId    = SagaId.random(OrderFulfillmentSaga.class);
        var secondSagaId   = SagaId.random(OrderFulfillmentSaga.class);
        var afterSaveCalls = new AtomicInteger();

        // When
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            sagaStore.save(serializedSaga(firstSagaId, "{}", "IN_PROGRESS", OffsetDateTime.now(ZoneOffset.UTC), null), () -> {
                throw new IllegalStateException("Delivery failed");
            });
            sagaStore.save(serializedSaga(secondSagaId, "{}", "IN_PROGRESS", OffsetDateTime.now(ZoneOffset.UTC), null), afterSaveCalls::incrementAndGet);
        });

        // Then
        assertThat(afterSaveCalls.get()).isEqualTo(1);
        assertThat(sagaStore.load(firstSagaId)).isPresent();
        assertThat(sagaStore.load(secondSagaId)).isPresent();
    }

    private static SerializedSaga serializedSaga(SagaId sagaId, String payload, String stateId, OffsetDateTime createdAt, OffsetDateTime closedAt) {
        return new SerializedSaga(sagaId.id(),
                                  sagaId.getClass().getName(),
                                  sagaId.sagaClass().getName(),
                                  payload,
                                  stateId,
                                  createdAt,
                                  closedAt);
    }
}
