package dk.cloudcreate.servicebus.sagas;

import dk.cloudcreate.servicebus.common.transaction.JdbiUnitOfWorkFactory;
import dk.cloudcreate.servicebus.sagas.OrderFulfillmentMessages.*;
import dk.cloudcreate.servicebus.sagas.contract.*;
import dk.cloudcreate.servicebus.sagas.store.*;
import dk.cloudcreate.servicebus.sagas.store.sql.SqlSagaStore;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class SagaProviderTest {
    private JdbiUnitOfWorkFactory           unitOfWorkFactory;
    private SagaProvider                    sagaProvider;
    private RecordingMessageDeliveryContext messageDeliveryContext;

    @BeforeEach
    void setup() {
        var jdbi = Jdbi.create("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
        sagaProvider = new SagaProvider(new SqlSagaStore(unitOfWorkFactory));
        messageDeliveryContext = new RecordingMessageDeliveryContext();
    }

    @Test
    void verify_obtaining_an_unknown_saga_returns_empty() {
        Optional<OrderFulfillmentSaga> saga = sagaProvider.obtain(SagaId.random(OrderFulfillmentSaga.class));
        assertThat(saga).isEmpty();
    }

    @Test
    void verify_starting_a_saga_stores_it_and_delivers_commands_before_events() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);

        // When
        OrderFulfillmentSaga saga = sagaProvider.start(sagaId, new StartOrderFulfillment("order-1"), messageDeliveryContext);

        // Then
        assertThat(saga.status()).isEqualTo(SagaStatus.IN_PROGRESS);
        assertThat(messageDeliveryContext.deliveredMessages).hasSize(2);
        assertThat(messageDeliveryContext.deliveredMessages.get(0)).isInstanceOf(ReserveStock.class);
        assertThat(messageDeliveryContext.deliveredMessages.get(1)).isInstanceOf(SagaCreated.class);

        Optional<OrderFulfillmentSaga> obtainedSaga = sagaProvider.obtain(sagaId);
        assertThat(obtainedSaga).isPresent();
        assertThat(obtainedSaga.get()).isExactlyInstanceOf(OrderFulfillmentSaga.class);
        assertThat(obtainedSaga.get().id()).isEqualTo(sagaId);
        assertThat(obtainedSaga.get().status()).isEqualTo(SagaStatus.IN_PROGRESS);
        assertThat(obtainedSaga.get().createdAt()).isEqualTo(saga.createdAt());
        assertThat(obtainedSaga.get().orderId).isEqualTo("order-1");
        assertThat(obtainedSaga.get().history).containsExactly("created");
        assertThat(obtainedSaga.get().raisedEvents()).isEmpty();
        assertThat(obtainedSaga.get().firedCommands()).isEmpty();
    }

    @Test
    void verify_saving_a_saga_stores_the_changes_and_delivers_the_new_messages() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);
        sagaProvider.start(sagaId, new StartOrderFulfillment("order-1"), messageDeliveryContext);
        messageDeliveryContext.deliveredMessages.clear();
        OrderFulfillmentSaga saga = sagaProvider.<OrderFulfillmentSaga>obtain(sagaId).orElseThrow();

        // When
        saga.stockWasReserved();
        sagaProvider.save(saga, messageDeliveryContext);

        // Then
        assertThat(messageDeliveryContext.deliveredMessages).hasSize(3);
        assertThat(messageDeliveryContext.deliveredMessages.get(0)).isInstanceOf(ShipOrder.class);
        assertThat(messageDeliveryContext.deliveredMessages.get(1)).isInstanceOf(StockReserved.class);
        assertThat(messageDeliveryContext.deliveredMessages.get(2)).isInstanceOf(SagaStatusChanged.class);
        assertThat(saga.raisedEvents()).isEmpty();
        assertThat(saga.firedCommands()).isEmpty();

        OrderFulfillmentSaga obtainedSaga = sagaProvider.<OrderFulfillmentSaga>obtain(sagaId).orElseThrow();
        assertThat(obtainedSaga.status()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(obtainedSaga.closedAt()).isEqualTo(saga.closedAt());
        assertThat(obtainedSaga.stockReserved).isTrue();
        assertThat(obtainedSaga.history).containsExactly("created", "stock-reserved", "COMPLETED");
    }

    @Test
    void verify_saving_a_saga_without_new_messages_delivers_nothing() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);
        sagaProvider.start(sagaId, new StartOrderFulfillment("order-1"), messageDeliveryContext);
        messageDeliveryContext.deliveredMessages.clear();
        OrderFulfillmentSaga saga = sagaProvider.<OrderFulfillmentSaga>obtain(sagaId).orElseThrow();

        // When
        sagaProvider.save(saga, messageDeliveryContext);

        // Then
        assertThat(messageDeliveryContext.deliveredMessages).isEmpty();
    }

    @Test
    void verify_starting_a_saga_twice_fails_with_DuplicateSagaIdException() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);
        sagaProvider.start(sagaId, new StartOrderFulfillment("order-1"), messageDeliveryContext);
        messageDeliveryContext.deliveredMessages.clear();

        // When
        assertThatThrownBy(() -> sagaProvider.start(sagaId, new StartOrderFulfillment("order-2"), messageDeliveryContext))
                .isInstanceOf(DuplicateSagaIdException.class)
                .hasMessage("Saga with identifier \"" + OrderFulfillmentSaga.class.getName() + ":" + sagaId.id() + "\" already exists");

        // Then
        assertThat(messageDeliveryContext.deliveredMessages).isEmpty();
        OrderFulfillmentSaga obtainedSaga = sagaProvider.<OrderFulfillmentSaga>obtain(sagaId).orElseThrow();
        assertThat(obtainedSaga.orderId).isEqualTo("order-1");
    }

    @Test
    void verify_saving_a_saga_that_was_never_started_fails() {
        // Given
        var saga = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));

        // When / Then
        assertThatThrownBy(() -> sagaProvider.save(saga, messageDeliveryContext))
                .isExactlyInstanceOf(SagaStoreException.class);
        assertThat(messageDeliveryContext.deliveredMessages).isEmpty();
        // The buffered messages survive the failed write
        var raisedEvents = saga.raisedEvents();
        assertThat(raisedEvents).hasSize(1);
        assertThat(raisedEvents.get(0)).isInstanceOf(SagaCreated.class);
    }

    @Test
    void verify_messages_are_only_delivered_after_the_unit_of_work_has_been_committed() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);

        // When
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            sagaProvider.start(sagaId, new StartOrderFulfillment("order-1"), messageDeliveryContext);
            // Then
            assertThat(messageDeliveryContext.deliveredMessages).isEmpty();
        });

        // And
        assertThat(messageDeliveryContext.deliveredMessages).hasSize(2);
    }

    @Test
    void verify_messages_are_not_delivered_when_the_unit_of_work_is_rolled_back() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            sagaProvider.start(sagaId, new StartOrderFulfillment("order-1"), messageDeliveryContext);
            throw new IllegalStateException("Use case failed");
        })).isExactlyInstanceOf(IllegalStateException.class)
           .hasMessage("Use case failed");

        // Then
        assertThat(messageDeliveryContext.deliveredMessages).isEmpty();
        assertThat(sagaProvider.<OrderFulfillmentSaga>obtain(sagaId)).isEmpty();
    }
}
