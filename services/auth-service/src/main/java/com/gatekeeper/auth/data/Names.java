package com.gatekeeper.auth.data;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming helpers shared by every place an entity type is introspected.
 */
public final class Names {

    /** Zero-width match before every uppercase letter that is not at index 0. */
    private static final Pattern UPPERCASE_BOUNDARY = Pattern.compile("(?<!^)(?=[A-Z])");

    private Names() {
        // utility class
    }

    /**
     * Converts a mixed/camel case type name to snake_case.
     * <p>
     * Every uppercase letter gets its own separator, so {@code ABCWidget}
     * becomes {@code a_b_c_widget}. Applying it to its own output returns the
     * same string.
     *
     * @param name type name, e.g. {@code CustomerPermission}
     * @return snake_case form, e.g. {@code customer_permission}
     */
    public static String toSnakeCase(String name) {
        return UPPERCASE_BOUNDARY.matcher(name).replaceAll("_").toLowerCase(Locale.ROOT);
    }
}
