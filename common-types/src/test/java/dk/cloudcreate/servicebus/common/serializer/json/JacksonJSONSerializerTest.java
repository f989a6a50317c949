package dk.cloudcreate.servicebus.common.serializer.json;

import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class JacksonJSONSerializerTest {
    private final JacksonJSONSerializer serializer = new JacksonJSONSerializer();

    @Test
    void an_immutable_type_without_a_default_constructor_can_be_deserialized() {
        // Given
        var occurredAt = OffsetDateTime.of(2023, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC);
        var shipment = new ShipmentScheduled("shipment-1", List.of("item-1", "item-2"), occurredAt);

        // When
        var json = serializer.serialize(shipment);
        ShipmentScheduled deserialized = serializer.deserialize(json, ShipmentScheduled.class.getName());

        // Then
        assertThat(json).contains("\"shipmentId\":\"shipment-1\"")
                        .contains("2023-01-15T10:30:00Z")
                        .doesNotContain("cachedDescription");
        assertThat(deserialized.shipmentId).isEqualTo("shipment-1");
        assertThat(deserialized.items).containsExactly("item-1", "item-2");
        assertThat(deserialized.occurredAt).isEqualTo(occurredAt);
        assertThat(deserialized.cachedDescription).isNull();
    }

    @Test
    void deserializing_into_an_unknown_java_type_fails() {
        assertThatThrownBy(() -> serializer.deserialize("{}", "dk.cloudcreate.servicebus.UnknownType"))
                .isInstanceOf(JSONDeserializationException.class)
                .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void deserializing_invalid_json_fails() {
        assertThatThrownBy(() -> serializer.deserialize("{\"shipmentId\":", ShipmentScheduled.class))
                .isInstanceOf(JSONDeserializationException.class);
    }

    static class ShipmentScheduled {
        final String         shipmentId;
        final List<String>   items;
        final OffsetDateTime occurredAt;
        transient String     cachedDescription;

        ShipmentScheduled(String shipmentId, List<String> items, OffsetDateTime occurredAt) {
            this.shipmentId = Objects.requireNonNull(shipmentId);
            this.items = items;
            this.occurredAt = occurredAt;
            this.cachedDescription = shipmentId + " with " + items.size() + " items";
        }
    }
}
