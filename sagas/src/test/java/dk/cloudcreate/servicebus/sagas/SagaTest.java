package dk.cloudcreate.servicebus.sagas;

import dk.cloudcreate.servicebus.common.messages.*;
import dk.cloudcreate.servicebus.sagas.OrderFulfillmentMessages.*;
import dk.cloudcreate.servicebus.sagas.contract.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SagaTest {
    @Test
    void verify_a_new_saga_is_created_and_raises_SagaCreated() {
        // Given
        var sagaId = SagaId.random(OrderFulfillmentSaga.class);

        // When
        var saga = new OrderFulfillmentSaga(sagaId);

        // Then
        assertThat(saga.id()).isEqualTo(sagaId);
        assertThat(saga.status()).isEqualTo(SagaStatus.CREATED);
        assertThat(saga.createdAt()).isNotNull();
        assertThat(saga.closedAt()).isEmpty();
        assertThat(saga.history).containsExactly("created");

        var raisedEvents = saga.raisedEvents();
        assertThat(raisedEvents).hasSize(1);
        var sagaCreated = (SagaCreated) raisedEvents.get(0);
        assertThat(sagaCreated.id).isEqualTo(sagaId.id());
        assertThat(sagaCreated.sagaClass).isEqualTo(OrderFulfillmentSaga.class.getName());
        assertThat(sagaCreated.datetime).isEqualTo(saga.createdAt());
        assertThat(saga.firedCommands()).isEmpty();
    }

    @Test
    void verify_a_saga_cannot_be_created_with_an_identifier_for_another_saga_type() {
        var sagaId = SagaId.random(OtherSaga.class);

        assertThatThrownBy(() -> new OrderFulfillmentSaga(sagaId))
                .isInstanceOf(InvalidSagaIdentifierException.class)
                .hasMessage("The class of the saga in the identifier (\"" + OtherSaga.class.getName() +
                                    "\") differs from the saga to which it was transmitted (\"" + OrderFulfillmentSaga.class.getName() + "\")");
    }

    @Test
    void verify_raised_events_and_fired_commands_are_cleared_when_read() {
        // Given
        var saga = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));
        saga.start(new StartOrderFulfillment("order-1"));

        // When
        var firedCommands = saga.firedCommands();
        var raisedEvents  = saga.raisedEvents();

        // Then
        assertThat(firedCommands).hasSize(1);
        assertThat(firedCommands.get(0)).isInstanceOf(ReserveStock.class);
        assertThat(((ReserveStock) firedCommands.get(0)).orderId).isEqualTo("order-1");
        assertThat(raisedEvents).hasSize(1);
        assertThat(saga.firedCommands()).isEmpty();
        assertThat(saga.raisedEvents()).isEmpty();
    }

    @Test
    void verify_raised_events_are_applied_using_the_handler_for_the_exact_event_type() {
        // Given
        var saga = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));
        saga.start(new StartOrderFulfillment("order-1"));
        saga.clear();

        // When
        saga.notifyCustomer();

        // Then no handler exists for CustomerNotified, so only the event is buffered
        assertThat(saga.history).containsExactly("created");
        assertThat(saga.stockReserved).isFalse();
        List<Event> raisedEvents = saga.raisedEvents();
        assertThat(raisedEvents).hasSize(1);
        assertThat(raisedEvents.get(0)).isInstanceOf(CustomerNotified.class);
    }

    @Test
    void verify_completing_a_saga() {
        // Given
        var saga = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));
        saga.start(new StartOrderFulfillment("order-1"));
        saga.markAsStarted();
        saga.clear();

        // When
        saga.stockWasReserved();

        // Then
        assertThat(saga.status()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(saga.stockReserved).isTrue();
        assertThat(saga.history).containsExactly("created", "stock-reserved", "COMPLETED");

        var raisedEvents = saga.raisedEvents();
        assertThat(raisedEvents).hasSize(2);
        assertThat(raisedEvents.get(0)).isInstanceOf(StockReserved.class);
        var statusChanged = (SagaStatusChanged) raisedEvents.get(1);
        assertThat(statusChanged.previousStatus).isEqualTo(SagaStatus.IN_PROGRESS);
        assertThat(statusChanged.newStatus).isEqualTo(SagaStatus.COMPLETED);
        assertThat(statusChanged.withReason()).hasValue("Order shipped");
        assertThat(saga.closedAt()).hasValue(statusChanged.datetime);

        var firedCommands = saga.firedCommands();
        assertThat(firedCommands).hasSize(1);
        assertThat(firedCommands.get(0)).isInstanceOf(ShipOrder.class);
    }

    @Test
    void verify_failing_a_saga() {
        // Given
        var saga = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));
        saga.clear();

        // When
        saga.stockReservationFailed("Out of stock");

        // Then
        assertThat(saga.status()).isEqualTo(SagaStatus.FAILED);
        assertThat(saga.closedAt()).isPresent();
        assertThat(saga.history).containsExactly("created", "FAILED");
        var raisedEvents = saga.raisedEvents();
        assertThat(raisedEvents).hasSize(1);
        var statusChanged = (SagaStatusChanged) raisedEvents.get(0);
        assertThat(statusChanged.previousStatus).isEqualTo(SagaStatus.CREATED);
        assertThat(statusChanged.newStatus).isEqualTo(SagaStatus.FAILED);
        assertThat(statusChanged.withReason()).hasValue("Out of stock");
    }

    @Test
    void verify_the_state_of_a_closed_saga_cannot_be_changed() {
        // Given
        var saga = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));
        saga.start(new StartOrderFulfillment("order-1"));
        saga.stockReservationFailed("Out of stock");
        saga.clear();
        var closedAt = saga.closedAt();

        // When / Then
        var expectedMessage = "Changing the state of the saga is impossible: the saga is complete";
        assertThatThrownBy(saga::notifyCustomer)
                .isInstanceOf(ChangeSagaStateFailedException.class)
                .hasMessage(expectedMessage);
        assertThatThrownBy(saga::reserveStockAgain)
                .isInstanceOf(ChangeSagaStateFailedException.class)
                .hasMessage(expectedMessage);
        assertThatThrownBy(saga::stockWasReserved)
                .isInstanceOf(ChangeSagaStateFailedException.class)
                .hasMessage(expectedMessage);
        assertThatThrownBy(() -> saga.stockReservationFailed("Again"))
                .isInstanceOf(ChangeSagaStateFailedException.class)
                .hasMessage(expectedMessage);

        assertThat(saga.status()).isEqualTo(SagaStatus.FAILED);
        assertThat(saga.closedAt()).isEqualTo(closedAt);
        assertThat(saga.raisedEvents()).isEmpty();
        assertThat(saga.firedCommands()).isEmpty();
    }

    @Test
    void verify_an_event_type_can_only_be_registered_once() {
        var builder = SagaEventHandlers.<OrderFulfillmentSaga>builder()
                                       .on(StockReserved.class, (saga, event) -> {});

        assertThatThrownBy(() -> builder.on(StockReserved.class, (saga, event) -> {}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_handlers_are_looked_up_by_exact_event_type() {
        var handlers = SagaEventHandlers.<OrderFulfillmentSaga>builder()
                                        .on(StockReserved.class, (saga, event) -> {})
                                        .build();

        assertThat(handlers.hasHandlerFor(StockReserved.class)).isTrue();
        assertThat(handlers.hasHandlerFor(CustomerNotified.class)).isFalse();
        assertThat(SagaEventHandlers.none().hasHandlerFor(StockReserved.class)).isFalse();
    }

    @Test
    void verify_a_deserialized_saga_has_the_same_state_but_no_buffered_messages() {
        // Given
        var serializer = new SagaSerializer();
        var saga       = new OrderFulfillmentSaga(SagaId.random(OrderFulfillmentSaga.class));
        saga.start(new StartOrderFulfillment("order-1"));
        saga.markAsStarted();

        // When
        var serializedSaga   = serializer.serialize(saga);
        var deserializedSaga = (OrderFulfillmentSaga) serializer.deserialize(serializedSaga);

        // Then
        assertThat(serializedSaga.id).isEqualTo(saga.id().id());
        assertThat(serializedSaga.idClass).isEqualTo(SagaId.class.getName());
        assertThat(serializedSaga.sagaClass).isEqualTo(OrderFulfillmentSaga.class.getName());
        assertThat(serializedSaga.stateId).isEqualTo("IN_PROGRESS");
        assertThat(serializedSaga.closedAt()).isEmpty();

        assertThat(deserializedSaga.id()).isEqualTo(saga.id());
        assertThat(deserializedSaga.status()).isEqualTo(SagaStatus.IN_PROGRESS);
        assertThat(deserializedSaga.createdAt()).isEqualTo(saga.createdAt());
        assertThat(deserializedSaga.orderId).isEqualTo("order-1");
        assertThat(deserializedSaga.history).containsExactly("created");
        assertThat(deserializedSaga.raisedEvents()).isEmpty();
        assertThat(deserializedSaga.firedCommands()).isEmpty();
    }

    @Test
    void verify_a_failing_status_change_handler_leaves_the_saga_open() {
        // Given
        var saga = new RejectingSaga(SagaId.random(RejectingSaga.class));
        saga.clear();

        // When
        assertThatThrownBy(saga::complete)
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Status change rejected");

        // Then
        assertThat(saga.status()).isEqualTo(SagaStatus.CREATED);
        assertThat(saga.closedAt()).isEmpty();
        assertThat(saga.raisedEvents()).isEmpty();
    }

    public static class RejectingSaga extends Saga {
        private static final SagaEventHandlers<RejectingSaga> EVENT_HANDLERS =
                SagaEventHandlers.<RejectingSaga>builder()
                                 .on(SagaStatusChanged.class, (saga, event) -> {
                                     throw new IllegalStateException("Status change rejected");
                                 })
                                 .build();

        public RejectingSaga(SagaId id) {
            super(id);
        }

        @Override
        public void start(Command command) {
        }

        void complete() {
            makeCompleted();
        }

        @Override
        protected SagaEventHandlers<RejectingSaga> eventHandlers() {
            return EVENT_HANDLERS;
        }
    }

    public static class OtherSaga extends Saga {
        public OtherSaga(SagaId id) {
            super(id);
        }

        @Override
        public void start(Command command) {
        }

        @Override
        protected SagaEventHandlers<OtherSaga> eventHandlers() {
            return SagaEventHandlers.none();
        }
    }
}
