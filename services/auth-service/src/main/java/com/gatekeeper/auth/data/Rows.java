package com.gatekeeper.auth.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rows fetched by a statement, with column names normalized to lower case.
 * <p>
 * Callers branch on {@link #shape()}: no row, exactly one row, or several.
 */
public final class Rows {

    public enum Shape { NONE, ONE, MANY }

    private static final Rows EMPTY = new Rows(List.of());

    private final List<Map<String, Object>> rows;

    private Rows(List<Map<String, Object>> rows) {
        this.rows = rows;
    }

    public static Rows none() {
        return EMPTY;
    }

    public static Rows of(List<Map<String, Object>> raw) {
        if (raw.isEmpty()) {
            return EMPTY;
        }
        List<Map<String, Object>> normalized = new ArrayList<>(raw.size());
        for (Map<String, Object> row : raw) {
            Map<String, Object> copy = new LinkedHashMap<>();
            row.forEach((column, value) -> copy.put(column.toLowerCase(Locale.ROOT), value));
            normalized.add(Collections.unmodifiableMap(copy));
        }
        return new Rows(Collections.unmodifiableList(normalized));
    }

    public Shape shape() {
        return switch (rows.size()) {
            case 0 -> Shape.NONE;
            case 1 -> Shape.ONE;
            default -> Shape.MANY;
        };
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * The only row, or empty when there is none.
     *
     * @throws IllegalStateException when more than one row was fetched
     */
    public Optional<Map<String, Object>> single() {
        if (rows.size() > 1) {
            throw new IllegalStateException("Expected at most one row but got " + rows.size());
        }
        return rows.stream().findFirst();
    }

    public Optional<Map<String, Object>> first() {
        return rows.stream().findFirst();
    }

    public List<Map<String, Object>> all() {
        return rows;
    }

    @Override
    public String toString() {
        return "Rows[" + shape() + ", " + rows.size() + "]";
    }
}
