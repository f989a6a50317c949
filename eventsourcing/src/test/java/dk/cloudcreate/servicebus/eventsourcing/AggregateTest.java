package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.servicebus.eventsourcing.OrderEvents.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AggregateTest {

    @Test
    void verify_a_new_aggregate_raises_AggregateCreated_as_the_first_event() {
        // Given
        var orderId = OrderId.random();

        // When
        var order = new Order(orderId, "customer-1");

        // Then
        assertThat(order.id()).isEqualTo(orderId);
        assertThat(order.version()).isEqualTo(2);
        assertThat(order.uncommittedEvents()).hasSize(2);

        var firstEvent = order.uncommittedEvents().get(0);
        assertThat(firstEvent.playhead()).isEqualTo(Aggregate.START_PLAYHEAD_INDEX + 1);
        assertThat(firstEvent.event()).isInstanceOf(AggregateCreated.class);
        var aggregateCreated = (AggregateCreated) firstEvent.event();
        assertThat(aggregateCreated.id).isEqualTo(orderId.value());
        assertThat(aggregateCreated.idClass).isEqualTo(OrderId.class.getName());
        assertThat(aggregateCreated.aggregateClass).isEqualTo(Order.class.getName());
        assertThat(aggregateCreated.datetime).isNotNull();

        assertThat(order.uncommittedEvents().get(1).event()).isInstanceOf(OrderPlaced.class);
        assertThat(order.uncommittedEvents().get(1).playhead()).isEqualTo(2);
        assertThat(order.customerId).isEqualTo("customer-1");
        assertThat(order.productAndQuantity).isEmpty();
    }

    @Test
    void verify_each_raised_event_increments_the_version_by_one() {
        // Given
        var order = new Order(OrderId.random(), "customer-1");

        // When
        order.addProduct("product-1", 2);
        order.addProduct("product-1", 3);
        order.accept();

        // Then
        assertThat(order.version()).isEqualTo(5);
        assertThat(order.uncommittedEvents()).extracting(AggregateEvent::playhead).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(order.productAndQuantity).containsEntry("product-1", 5);
        assertThat(order.accepted).isTrue();

        var stream = order.makeStream();
        assertThat(stream.containsAggregateCreated()).isTrue();
        assertThat(stream.fromPlayhead()).hasValue(1L);
        assertThat(stream.toPlayhead()).hasValue(5L);
        assertThat(stream.aggregateClass()).isEqualTo(Order.class);
    }

    @Test
    void verify_markChangesAsCommitted_resets_the_uncommitted_events() {
        // Given
        var order = new Order(OrderId.random(), "customer-1");

        // When
        order.markChangesAsCommitted();

        // Then
        assertThat(order.uncommittedEvents()).isEmpty();
        assertThat(order.makeStream().isEmpty()).isTrue();
        assertThat(order.version()).isEqualTo(2);

        // And the next event isn't a creation event
        order.addProduct("product-1", 1);
        assertThat(order.makeStream().containsAggregateCreated()).isFalse();
        assertThat(order.makeStream().fromPlayhead()).hasValue(3L);
    }

    @Test
    void verify_an_identifier_belonging_to_another_aggregate_type_is_rejected() {
        assertThatThrownBy(() -> new Invoice(new InvoiceId("invoice-1", Order.class)))
                .isExactlyInstanceOf(InvalidAggregateIdentifierException.class)
                .hasMessageContaining(Order.class.getName())
                .hasMessageContaining(Invoice.class.getName());
    }

    @Test
    void verify_rehydrating_a_blank_instance_reproduces_the_aggregate_state() {
        // Given
        var order = new Order(OrderId.random(), "customer-1");
        order.addProduct("product-1", 2);
        order.addProduct("product-2", 7);
        order.accept();
        var stream = order.makeStream();

        // When
        var rehydrated = AggregateInstanceFactory.objenesisInstanceFactory().create(Order.class);
        rehydrated.rehydrate(stream);

        // Then
        assertThat(rehydrated.id()).isEqualTo(order.id());
        assertThat(rehydrated.version()).isEqualTo(order.version());
        assertThat(rehydrated.customerId).isEqualTo(order.customerId);
        assertThat(rehydrated.productAndQuantity).isEqualTo(order.productAndQuantity);
        assertThat(rehydrated.accepted).isTrue();
        assertThat(rehydrated.uncommittedEvents()).isEmpty();
    }

    @Test
    void verify_rehydrating_events_out_of_order_fails() {
        // Given
        var order = new Order(OrderId.random(), "customer-1");
        order.addProduct("product-1", 2);
        var events = order.uncommittedEvents();
        var outOfOrderStream = new AggregateEventStream(order.id(),
                                                        Order.class,
                                                        List.of(events.get(0), events.get(2)));

        // When
        var rehydrated = AggregateInstanceFactory.objenesisInstanceFactory().create(Order.class);

        // Then
        assertThatThrownBy(() -> rehydrated.rehydrate(outOfOrderStream))
                .isExactlyInstanceOf(AggregateStreamOutOfOrderException.class);
    }

    @Test
    void verify_rehydrating_the_events_of_another_aggregate_fails() {
        // Given
        var order      = new Order(OrderId.random(), "customer-1");
        var otherOrder = new Order(OrderId.random(), "customer-2");
        otherOrder.markChangesAsCommitted();
        otherOrder.addProduct("product-1", 1);

        // Then
        assertThatThrownBy(() -> order.rehydrate(otherOrder.makeStream()))
                .isExactlyInstanceOf(InvalidAggregateIdentifierException.class);
    }

    @Test
    void verify_restored_identifiers_are_equal_to_the_original_identifier() {
        // Given
        var orderId = OrderId.random();

        // When
        var restored = AggregateId.restore(OrderId.class.getName(), orderId.value(), Order.class.getName());

        // Then
        assertThat(restored).isExactlyInstanceOf(OrderId.class);
        assertThat(restored).isEqualTo(orderId);
        assertThat(restored.hashCode()).isEqualTo(orderId.hashCode());
        assertThat(restored.aggregateClass()).isEqualTo(Order.class);
    }

    @Test
    void verify_restoring_an_identifier_of_an_unknown_type_fails() {
        assertThatThrownBy(() -> AggregateId.restore("com.example.UnknownId", "id-1", Order.class.getName()))
                .isExactlyInstanceOf(InvalidAggregateIdentifierException.class)
                .hasCauseExactlyInstanceOf(ClassNotFoundException.class);
    }

    static class Invoice extends Aggregate<InvoiceId> {
        Invoice(InvoiceId invoiceId) {
            super(invoiceId);
        }
    }

    static class InvoiceId extends AggregateId {
        InvoiceId(CharSequence value, Class<? extends Aggregate<?>> aggregateClass) {
            super(value, aggregateClass);
        }
    }
}
