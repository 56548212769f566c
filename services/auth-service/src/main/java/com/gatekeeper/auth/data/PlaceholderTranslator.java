package com.gatekeeper.auth.data;

import org.springframework.dao.InvalidDataAccessApiUsageException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rewrites {@code %(name)s} placeholders into JDBC {@code ?} markers.
 * <p>
 * {@code %%} is read as a literal {@code %} wherever it appears. Placeholders
 * inside single-quoted literals, double-quoted identifiers and {@code --}
 * line comments are copied unchanged. The resulting {@link Translated} keeps
 * the placeholder names in order of appearance so values can be bound
 * positionally.
 */
final class PlaceholderTranslator {

    private PlaceholderTranslator() {
        // utility class
    }

    static Translated translate(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        char quote = 0;
        boolean inComment = false;
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            char next = i + 1 < sql.length() ? sql.charAt(i + 1) : 0;
            if (c == '%' && next == '%') {
                out.append('%');
                i += 2;
                continue;
            }
            if (inComment) {
                inComment = c != '\n';
            } else if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '-' && next == '-') {
                inComment = true;
            } else if (c == '%' && next == '(') {
                int close = sql.indexOf(")s", i + 2);
                if (close > i + 2) {
                    names.add(sql.substring(i + 2, close));
                    out.append('?');
                    i = close + 2;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return new Translated(out.toString(), Collections.unmodifiableList(names));
    }

    /**
     * JDBC text plus placeholder names in positional order.
     */
    record Translated(String sql, List<String> names) {

        /** Positional arguments for a single payload. */
        Object[] bind(Map<String, ?> params) {
            Object[] args = new Object[names.size()];
            for (int i = 0; i < names.size(); i++) {
                args[i] = valueOf(params, names.get(i));
            }
            return args;
        }

        /**
         * Positional arguments for a multi-row statement: placeholder group
         * <i>g</i> is bound to {@code batch.get(g)}.
         */
        Object[] bindGroups(List<? extends Map<String, ?>> batch) {
            if (batch.isEmpty() || names.size() % batch.size() != 0) {
                throw new InvalidDataAccessApiUsageException(
                        "Statement has " + names.size() + " placeholders, not divisible into "
                                + batch.size() + " row groups");
            }
            int groupSize = names.size() / batch.size();
            Object[] args = new Object[names.size()];
            for (int i = 0; i < names.size(); i++) {
                args[i] = valueOf(batch.get(i / groupSize), names.get(i));
            }
            return args;
        }

        private static Object valueOf(Map<String, ?> params, String name) {
            if (params == null || !params.containsKey(name)) {
                throw new InvalidDataAccessApiUsageException("No value supplied for placeholder %(" + name + ")s");
            }
            return params.get(name);
        }
    }
}
