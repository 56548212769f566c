package com.gatekeeper.auth.data;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts entities to column payloads and result rows back to entities.
 * <p>
 * Property names map to snake_case columns ({@code externalIdentityId} to
 * {@code external_identity_id}). Unset ({@code null}) properties are dropped
 * from the payload, so an insert or update only names populated columns.
 * <p>
 * Jackson only discovers the properties and their column names. Values are
 * read through the accessors and keep their Java type ({@code LocalDateTime},
 * {@code UUID}, {@code BigDecimal}, {@code byte[]}) so the driver binds them
 * natively.
 */
public final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private static final Map<Class<?>, List<BeanPropertyDefinition>> READABLE_PROPERTIES = new ConcurrentHashMap<>();

    private Payloads() {
        // utility class
    }

    /**
     * Column payload of an entity, in property declaration order.
     *
     * @param entity populated entity
     * @return mutable map of column name to value, without null entries
     */
    public static Map<String, Object> of(Entity entity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : readableProperties(entity.getClass())) {
            Object value = property.getAccessor().getValue(entity);
            if (value != null) {
                payload.put(property.getName(), value);
            }
        }
        return payload;
    }

    /**
     * Maps a result row (column name to value) onto an entity type. Columns
     * without a matching property are ignored.
     */
    public static <T extends Entity> T toEntity(Map<String, Object> row, Class<T> type) {
        return MAPPER.convertValue(row, type);
    }

    private static List<BeanPropertyDefinition> readableProperties(Class<?> type) {
        return READABLE_PROPERTIES.computeIfAbsent(type, key -> {
            BeanDescription description = MAPPER.getSerializationConfig().introspect(MAPPER.constructType(key));
            List<BeanPropertyDefinition> readable = new ArrayList<>();
            for (BeanPropertyDefinition property : description.findProperties()) {
                AnnotatedMember accessor = property.getAccessor();
                if (accessor != null) {
                    accessor.fixAccess(true);
                    readable.add(property);
                }
            }
            return List.copyOf(readable);
        });
    }

    /** Shared mapper, also used to serialize structured (JSON) column values. */
    static ObjectMapper mapper() {
        return MAPPER;
    }
}
