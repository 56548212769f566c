package com.gatekeeper.auth.data;

/**
 * Comparison operators available to structured {@link Condition}s.
 */
public enum Operator {

    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LIKE("LIKE"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String sql;

    Operator(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /** Whether the operator is followed by a bound value. */
    public boolean takesValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }
}
