package com.gatekeeper.auth.data;

import java.util.Objects;

/**
 * EntityDescriptor - Storage location of a persisted record type.
 *
 * Every {@link Entity} type declares one as a constant, e.g.
 * <pre>
 * public static final EntityDescriptor DESCRIPTOR =
 *         EntityDescriptor.of(Customer.class, "users", "customer");
 * </pre>
 *
 * @param schema    database schema, empty for the default search path
 * @param tableName unqualified table name
 */
public record EntityDescriptor(String schema, String tableName) {

    public EntityDescriptor {
        schema = schema == null ? "" : schema;
        Objects.requireNonNull(tableName, "tableName");
        if (tableName.isBlank()) {
            throw new IllegalArgumentException("tableName must not be blank");
        }
    }

    /**
     * Descriptor with an explicit table name. A {@code null} or blank table
     * name falls back to the snake_case form of the type's simple name.
     */
    public static EntityDescriptor of(Class<?> type, String schema, String tableName) {
        String table = tableName == null || tableName.isBlank()
                ? Names.toSnakeCase(type.getSimpleName())
                : tableName;
        return new EntityDescriptor(schema, table);
    }

    /** Descriptor whose table name is derived from the type name. */
    public static EntityDescriptor of(Class<?> type, String schema) {
        return of(type, schema, null);
    }

    /** Descriptor in the default schema whose table name is derived from the type name. */
    public static EntityDescriptor of(Class<?> type) {
        return of(type, "", null);
    }

    /** Table reference used in SQL text: {@code schema.table} or just {@code table}. */
    public String fullName() {
        return schema.isEmpty() ? tableName : schema + "." + tableName;
    }

    /**
     * Resolves a plain table name the same way: qualified with {@code schema}
     * when one is given.
     */
    public static String qualify(String schema, String table) {
        return schema == null || schema.isEmpty() ? table : schema + "." + table;
    }
}
