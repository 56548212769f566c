package com.gatekeeper.auth.data;

import java.util.Map;

/**
 * A parameterized statement and the payload bound to its {@code %(name)s}
 * placeholders. Built per call and handed straight to the executor.
 *
 * @param text   SQL text
 * @param params placeholder values, empty when the statement has none
 */
public record Statement(String text, Map<String, Object> params) {

    public Statement {
        params = params == null ? Map.of() : params;
    }

    public static Statement of(String text) {
        return new Statement(text, Map.of());
    }
}
