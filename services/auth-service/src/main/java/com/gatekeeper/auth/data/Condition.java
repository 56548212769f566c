package com.gatekeeper.auth.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Condition - WHERE predicate for select, update and delete statements.
 *
 * Two forms:
 * - Structured (default): field/operator/value triples joined with AND.
 *   Values are bound as named placeholders ({@code %(w0)s}, {@code %(w1)s}, ...)
 *   and travel with the statement as parameters.
 * - Raw: {@link #raw(String)} appends caller text verbatim after WHERE.
 *   Nothing is escaped. Callers that interpolate user input into a raw
 *   condition open an SQL injection hole; use it only with trusted text or
 *   with {@code %(name)s} placeholders whose values are passed separately.
 *
 * Instances are immutable; {@link #and} returns a new condition.
 */
public final class Condition {

    /** Placeholder prefix, kept apart from payload column names used by SET clauses. */
    static final String PARAM_PREFIX = "w";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final Condition NONE = new Condition(List.of(), null);

    private final List<Term> terms;
    private final String raw;

    private Condition(List<Term> terms, String raw) {
        this.terms = terms;
        this.raw = raw;
    }

    /** No predicate; the statement gets no WHERE clause. */
    public static Condition none() {
        return NONE;
    }

    /** {@code field = value}. */
    public static Condition eq(String field, Object value) {
        return where(field, Operator.EQ, value);
    }

    /**
     * Structured predicate {@code field <op> value}.
     *
     * @throws IllegalArgumentException if {@code field} is not a plain (optionally qualified) identifier
     */
    public static Condition where(String field, Operator operator, Object value) {
        return NONE.and(field, operator, value);
    }

    /** Predicate without a bound value, for {@link Operator#IS_NULL} and {@link Operator#IS_NOT_NULL}. */
    public static Condition where(String field, Operator operator) {
        return NONE.and(field, operator, null);
    }

    /**
     * Raw predicate text, appended after WHERE without any escaping.
     * See the class documentation for the injection risk.
     */
    public static Condition raw(String predicate) {
        if (predicate == null || predicate.isBlank()) {
            return NONE;
        }
        return new Condition(List.of(), predicate);
    }

    /** Adds {@code field <op> value} joined with AND. */
    public Condition and(String field, Operator operator, Object value) {
        Objects.requireNonNull(operator, "operator");
        if (field == null || !IDENTIFIER.matcher(field).matches()) {
            throw new IllegalArgumentException("Invalid field name: " + field);
        }
        if (raw != null) {
            throw new IllegalStateException("Structured terms cannot be combined with a raw condition");
        }
        List<Term> next = new ArrayList<>(terms);
        next.add(new Term(field, operator, value));
        return new Condition(Collections.unmodifiableList(next), null);
    }

    /** Adds {@code field = value} joined with AND. */
    public Condition and(String field, Object value) {
        return and(field, Operator.EQ, value);
    }

    public boolean isEmpty() {
        return raw == null && terms.isEmpty();
    }

    public boolean isRaw() {
        return raw != null;
    }

    /** Predicate text without the WHERE keyword. */
    public String toSql() {
        if (raw != null) {
            return raw;
        }
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < terms.size(); i++) {
            Term term = terms.get(i);
            if (i > 0) {
                sql.append(" AND ");
            }
            sql.append(term.field()).append(' ').append(term.operator().sql());
            if (term.operator().takesValue()) {
                sql.append(" %(").append(PARAM_PREFIX).append(i).append(")s");
            }
        }
        return sql.toString();
    }

    /** Bound values keyed by placeholder name; empty for raw conditions. */
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < terms.size(); i++) {
            Term term = terms.get(i);
            if (term.operator().takesValue()) {
                params.put(PARAM_PREFIX + i, term.value());
            }
        }
        return params;
    }

    @Override
    public String toString() {
        return isEmpty() ? "Condition[none]" : "Condition[" + toSql() + "]";
    }

    private record Term(String field, Operator operator, Object value) {
    }
}
