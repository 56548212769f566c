package com.gatekeeper.auth.data;

import com.gatekeeper.auth.exception.ServiceException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * StatementBuilder - Turns entity descriptors and payloads into SQL statements.
 *
 * All methods are pure: no I/O, no state. The output is consumed by
 * {@link TransactionalExecutor}.
 *
 * Dialect:
 * - Named placeholders of the form {@code %(name)s}
 * - {@code RETURNING <cols>} appended when a returning list is given
 * - Soft delete sets the {@code exist} flag column to FALSE
 *
 * Trust boundary: table names, field lists, {@code orderBy} and
 * {@code returning} are written into the SQL text as given and must come from
 * code, never from request input. The same holds for {@link Condition#raw}.
 *
 * Example:
 * <pre>
 * Statement insert = StatementBuilder.insert(customer, "*");
 * // INSERT INTO users.customer (username, password) VALUES (%(username)s, %(password)s) RETURNING *
 * </pre>
 */
public final class StatementBuilder {

    /** Flag column every soft-deletable table carries. */
    public static final String SOFT_DELETE_COLUMN = "exist";

    private StatementBuilder() {
        // utility class
    }

    /**
     * SELECT against an entity's table.
     *
     * @param target    entity descriptor
     * @param fields    columns to select, {@code *} when empty
     * @param condition WHERE predicate, {@link Condition#none()} for all rows
     * @param orderBy   ORDER BY text, omitted when blank
     * @param limit     LIMIT, omitted when 0
     * @param offset    OFFSET, omitted when 0
     */
    public static Statement select(EntityDescriptor target, List<String> fields, Condition condition,
                                   String orderBy, int limit, int offset) {
        return select(target.fullName(), fields, condition, orderBy, limit, offset);
    }

    /**
     * SELECT against a table given by name, qualified with {@code schema}
     * when one is given.
     */
    public static Statement select(String schema, String table, List<String> fields, Condition condition,
                                   String orderBy, int limit, int offset) {
        return select(EntityDescriptor.qualify(schema, table), fields, condition, orderBy, limit, offset);
    }

    /** {@code SELECT * FROM <target> WHERE <condition>}. */
    public static Statement select(EntityDescriptor target, Condition condition) {
        return select(target, List.of(), condition, "", 0, 0);
    }

    private static Statement select(String table, List<String> fields, Condition condition,
                                    String orderBy, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw ServiceException.validation("limit and offset must not be negative");
        }
        String columns = fields == null || fields.isEmpty() ? "*" : String.join(", ", fields);
        StringBuilder sql = new StringBuilder("SELECT ").append(columns).append(" FROM ").append(table);
        Condition where = condition == null ? Condition.none() : condition;
        appendWhere(sql, where);
        if (orderBy != null && !orderBy.isBlank()) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        if (limit > 0) {
            sql.append(" LIMIT ").append(limit);
        }
        if (offset > 0) {
            sql.append(" OFFSET ").append(offset);
        }
        return new Statement(sql.toString(), where.parameters());
    }

    /**
     * Single-row INSERT. Columns and placeholders follow the payload's key
     * order, so position <i>i</i> of both lists names the same key.
     */
    public static Statement insert(Entity entity, String returning) {
        Map<String, Object> payload = Payloads.of(entity);
        requireColumns(payload);
        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(entity.descriptor().fullName())
                .append(" (").append(String.join(", ", payload.keySet())).append(")")
                .append(" VALUES (").append(placeholders(payload.keySet())).append(")");
        appendReturning(sql, returning);
        return new Statement(sql.toString(), payload);
    }

    /**
     * Multi-row INSERT with one placeholder group per entity.
     * <p>
     * Table and column list are taken from the first entity only. All
     * entities must populate the same columns; a divergent batch is not
     * detected here.
     *
     * @throws ServiceException VALIDATION when {@code entities} is empty
     */
    public static BatchStatement bulkInsert(List<? extends Entity> entities, String returning) {
        if (entities == null || entities.isEmpty()) {
            throw ServiceException.validation("Bulk insert needs at least one entity");
        }
        Entity first = entities.get(0);
        Map<String, Object> firstPayload = Payloads.of(first);
        requireColumns(firstPayload);
        String group = "(" + placeholders(firstPayload.keySet()) + ")";
        String values = entities.stream().map(e -> group).collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(first.descriptor().fullName())
                .append(" (").append(String.join(", ", firstPayload.keySet())).append(")")
                .append(" VALUES ").append(values);
        appendReturning(sql, returning);

        List<Map<String, Object>> params = new ArrayList<>(entities.size());
        params.add(firstPayload);
        for (int i = 1; i < entities.size(); i++) {
            params.add(Payloads.of(entities.get(i)));
        }
        return new BatchStatement(sql.toString(), params);
    }

    /** UPDATE of the entity's populated columns on the rows matching {@code condition}. */
    public static Statement update(Entity entity, Condition condition, String returning) {
        requireCondition(condition, "update");
        Map<String, Object> payload = Payloads.of(entity);
        requireColumns(payload);
        String assignments = payload.keySet().stream()
                .map(column -> column + " = %(" + column + ")s")
                .collect(Collectors.joining(", "));
        StringBuilder sql = new StringBuilder("UPDATE ")
                .append(entity.descriptor().fullName())
                .append(" SET ").append(assignments);
        appendWhere(sql, condition);
        appendReturning(sql, returning);
        return new Statement(sql.toString(), merge(payload, condition.parameters()));
    }

    /** {@code UPDATE <table> SET exist = FALSE WHERE <condition>}. */
    public static Statement softDelete(EntityDescriptor target, Condition condition, String returning) {
        requireCondition(condition, "soft delete");
        StringBuilder sql = new StringBuilder("UPDATE ")
                .append(target.fullName())
                .append(" SET ").append(SOFT_DELETE_COLUMN).append(" = FALSE");
        appendWhere(sql, condition);
        appendReturning(sql, returning);
        return new Statement(sql.toString(), condition.parameters());
    }

    /** {@code DELETE FROM <table> WHERE <condition>}. */
    public static Statement delete(EntityDescriptor target, Condition condition, String returning) {
        requireCondition(condition, "delete");
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(target.fullName());
        appendWhere(sql, condition);
        appendReturning(sql, returning);
        return new Statement(sql.toString(), condition.parameters());
    }

    private static String placeholders(Iterable<String> keys) {
        List<String> out = new ArrayList<>();
        for (String key : keys) {
            out.add("%(" + key + ")s");
        }
        return String.join(", ", out);
    }

    private static void appendWhere(StringBuilder sql, Condition condition) {
        if (!condition.isEmpty()) {
            sql.append(" WHERE ").append(condition.toSql());
        }
    }

    private static void appendReturning(StringBuilder sql, String returning) {
        if (returning != null && !returning.isBlank()) {
            sql.append(" RETURNING ").append(returning);
        }
    }

    private static void requireColumns(Map<String, Object> payload) {
        if (payload.isEmpty()) {
            throw ServiceException.validation("Entity has no populated columns");
        }
    }

    // A missing predicate would rewrite or remove every row of the table.
    private static void requireCondition(Condition condition, String operation) {
        if (condition == null || condition.isEmpty()) {
            throw ServiceException.validation("A condition is required for " + operation);
        }
    }

    private static Map<String, Object> merge(Map<String, Object> payload, Map<String, Object> conditionParams) {
        Map<String, Object> params = new LinkedHashMap<>(payload);
        conditionParams.forEach((name, value) -> {
            if (params.containsKey(name)) {
                throw ServiceException.validation("Column name clashes with condition placeholder: " + name);
            }
            params.put(name, value);
        });
        return params;
    }
}
