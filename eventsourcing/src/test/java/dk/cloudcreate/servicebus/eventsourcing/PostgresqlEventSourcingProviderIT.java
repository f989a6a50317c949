package dk.cloudcreate.servicebus.eventsourcing;

import dk.cloudcreate.servicebus.common.transaction.GenericHandleAwareUnitOfWorkFactory;
import dk.cloudcreate.servicebus.eventsourcing.eventstream.*;
import dk.cloudcreate.servicebus.eventsourcing.eventstream.sql.SqlEventStreamStore;
import dk.cloudcreate.servicebus.eventsourcing.snapshots.*;
import dk.cloudcreate.servicebus.eventsourcing.snapshots.sql.SqlSnapshotStore;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlEventSourcingProviderIT {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> unitOfWorkFactory;
    private EventSourcingProvider                                                                                 eventSourcingProvider;
    private SqlSnapshotStore                                                                                      snapshotStore;

    @BeforeEach
    void setup() {
        unitOfWorkFactory = new GenericHandleAwareUnitOfWorkFactory<>(Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                                                                                  postgreSQLContainer.getUsername(),
                                                                                  postgreSQLContainer.getPassword())) {
            @Override
            protected GenericHandleAwareUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWork> unitOfWorkFactory) {
                return new GenericHandleAwareUnitOfWork(unitOfWorkFactory);
            }
        };
        snapshotStore = new SqlSnapshotStore(unitOfWorkFactory);
        eventSourcingProvider = new EventSourcingProvider(new SqlEventStreamStore(unitOfWorkFactory),
                                                          new AggregateEventStreamDataTransformer(new JSONAggregateEventSerializer()),
                                                          new Snapshotter(snapshotStore, new SnapshotVersionStrategy(3)));
    }

    @Test
    void verify_save_load_and_snapshotting_against_postgresql() {
        // Given
        var messageDeliveryContext = new RecordingMessageDeliveryContext();
        var orderId                = OrderId.random();
        var order                  = new Order(orderId, "customer-1");
        order.addProduct("product-1", 2);

        // When
        eventSourcingProvider.save(order, messageDeliveryContext);

        // Then
        assertThat(messageDeliveryContext.deliveredMessages).hasSize(3);
        assertThat(snapshotStore.load(orderId)).isPresent();

        // When
        Order loadedOrder = eventSourcingProvider.<OrderId, Order>load(orderId).orElseThrow();
        loadedOrder.addProduct("product-2", 5);
        eventSourcingProvider.save(loadedOrder, messageDeliveryContext);

        // Then
        Order reloadedOrder = eventSourcingProvider.<OrderId, Order>load(orderId).orElseThrow();
        assertThat(reloadedOrder.version()).isEqualTo(4);
        assertThat(reloadedOrder.productAndQuantity).isEqualTo(Map.of("product-1", 2, "product-2", 5));
    }

    @Test
    void verify_a_duplicate_stream_is_rejected_by_postgresql() {
        // Given
        var orderId = OrderId.random();
        eventSourcingProvider.save(new Order(orderId, "customer-1"), new RecordingMessageDeliveryContext());

        // Then
        assertThatThrownBy(() -> eventSourcingProvider.save(new Order(orderId, "customer-2"), new RecordingMessageDeliveryContext()))
                .isExactlyInstanceOf(NonUniqueStreamIdException.class);
        assertThat(eventSourcingProvider.<OrderId, Order>load(orderId).orElseThrow().customerId).isEqualTo("customer-1");
    }
}
