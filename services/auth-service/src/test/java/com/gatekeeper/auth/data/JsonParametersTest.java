package com.gatekeeper.auth.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonParameters")
class JsonParametersTest {

    @Test
    @DisplayName("wraps maps and lists as json objects, leaves scalars")
    void wrap() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", "bolt");
        params.put("tags", List.of("red", "small"));
        params.put("attributes", Map.of("size", 3));
        params.put("missing", null);

        Map<String, Object> wrapped = JsonParameters.wrap(params);

        assertThat(wrapped.get("name")).isEqualTo("bolt");
        assertThat(wrapped.get("missing")).isNull();
        assertThat(wrapped.get("tags")).isInstanceOfSatisfying(PGobject.class, json -> {
            assertThat(json.getType()).isEqualTo("json");
            assertThat(json.getValue()).isEqualTo("[\"red\",\"small\"]");
        });
        assertThat(wrapped.get("attributes")).isInstanceOfSatisfying(PGobject.class,
                json -> assertThat(json.getValue()).isEqualTo("{\"size\":3}"));
    }

    @Test
    @DisplayName("wraps every payload of a batch")
    void wrapAll() {
        List<Map<String, Object>> wrapped = JsonParameters.wrapAll(List.of(
                Map.of("tags", List.of("a")),
                Map.of("tags", List.of("b"))));

        assertThat(wrapped).hasSize(2);
        assertThat(wrapped).allSatisfy(params -> assertThat(params.get("tags")).isInstanceOf(PGobject.class));
    }

    @Test
    @DisplayName("null params stay null")
    void nullParams() {
        assertThat(JsonParameters.wrap(null)).isNull();
    }
}
