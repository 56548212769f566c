package com.gatekeeper.auth.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.postgresql.util.PGobject;
import org.springframework.dao.InvalidDataAccessApiUsageException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps structured parameter values so the PostgreSQL driver binds them as
 * {@code json} instead of rejecting an unsupported Java type.
 * <p>
 * Maps and collections are serialized with Jackson; scalars pass through.
 */
final class JsonParameters {

    static final String JSON_TYPE = "json";

    private JsonParameters() {
        // utility class
    }

    static Map<String, Object> wrap(Map<String, ?> params) {
        if (params == null) {
            return null;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        params.forEach((name, value) -> wrapped.put(name, wrapValue(value)));
        return wrapped;
    }

    static List<Map<String, Object>> wrapAll(List<? extends Map<String, ?>> batch) {
        List<Map<String, Object>> wrapped = new ArrayList<>(batch.size());
        for (Map<String, ?> params : batch) {
            wrapped.add(wrap(params));
        }
        return wrapped;
    }

    static Object wrapValue(Object value) {
        if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>)) {
            return value;
        }
        try {
            PGobject json = new PGobject();
            json.setType(JSON_TYPE);
            json.setValue(Payloads.mapper().writeValueAsString(value));
            return json;
        } catch (JsonProcessingException | SQLException e) {
            throw new InvalidDataAccessApiUsageException("Cannot bind value as JSON: " + e.getMessage(), e);
        }
    }
}
