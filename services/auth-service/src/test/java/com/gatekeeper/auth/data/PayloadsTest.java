package com.gatekeeper.auth.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Payloads")
class PayloadsTest {

    @Test
    @DisplayName("keeps only populated fields, in declaration order")
    void populatedOnly() {
        Widget widget = Widget.builder().name("bolt").quantity(3).build();

        assertThat(Payloads.of(widget)).containsExactly(Map.entry("name", "bolt"), Map.entry("quantity", 3));
    }

    @Test
    @DisplayName("uses snake_case column names")
    void snakeCase() {
        Widget widget = Widget.builder().unitPrice(12).build();

        assertThat(Payloads.of(widget)).containsOnlyKeys("unit_price");
    }

    @Test
    @DisplayName("never exposes descriptor data as columns")
    void noDescriptorKeys() {
        Widget widget = Widget.builder().id(1).name("bolt").quantity(1).unitPrice(2).tags(List.of("a")).build();

        assertThat(Payloads.of(widget)).doesNotContainKeys("descriptor", "schema", "table_name", "DESCRIPTOR");
    }

    @Test
    @DisplayName("keeps structured values as-is")
    void structured() {
        Widget widget = Widget.builder().tags(List.of("red", "small")).build();

        assertThat(Payloads.of(widget)).containsEntry("tags", List.of("red", "small"));
    }

    @Test
    @DisplayName("keeps scalar values in their Java type")
    void scalarTypes() {
        UUID trackingId = UUID.fromString("3f2b8c1e-6d7a-4e2f-9b1c-0a5d4e3f2b1c");
        LocalDateTime shippedAt = LocalDateTime.of(2024, 1, 2, 3, 4, 5);
        byte[] label = {1, 2, 3};
        Shipment shipment = Shipment.builder()
                .trackingId(trackingId)
                .shippedAt(shippedAt)
                .weight(new BigDecimal("12.500"))
                .label(label)
                .build();

        Map<String, Object> payload = Payloads.of(shipment);

        assertThat(payload).containsOnlyKeys("tracking_id", "shipped_at", "weight", "label");
        assertThat(payload.get("tracking_id")).isSameAs(trackingId);
        assertThat(payload.get("shipped_at")).isSameAs(shippedAt);
        assertThat(payload.get("weight")).isEqualTo(new BigDecimal("12.500"));
        assertThat(payload.get("label")).isSameAs(label);
    }

    @Test
    @DisplayName("maps a row back onto the entity, ignoring unknown columns")
    void toEntity() {
        Map<String, Object> row = Map.of("id", 7, "name", "nut", "unit_price", 5, "exist", true);

        Widget widget = Payloads.toEntity(row, Widget.class);

        assertThat(widget.getId()).isEqualTo(7);
        assertThat(widget.getName()).isEqualTo("nut");
        assertThat(widget.getUnitPrice()).isEqualTo(5);
    }
}
