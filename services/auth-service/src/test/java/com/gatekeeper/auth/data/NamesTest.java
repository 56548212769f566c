package com.gatekeeper.auth.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Names")
class NamesTest {

    @Test
    @DisplayName("separates camel case words")
    void camelCase() {
        assertThat(Names.toSnakeCase("CustomerPermission")).isEqualTo("customer_permission");
        assertThat(Names.toSnakeCase("unitPrice")).isEqualTo("unit_price");
    }

    @Test
    @DisplayName("gives every consecutive uppercase letter its own separator")
    void consecutiveUppercase() {
        assertThat(Names.toSnakeCase("ABCWidget")).isEqualTo("a_b_c_widget");
    }

    @Test
    @DisplayName("leading uppercase letter gets no separator")
    void leadingUppercase() {
        assertThat(Names.toSnakeCase("Customer")).isEqualTo("customer");
    }

    @Test
    @DisplayName("is idempotent")
    void idempotent() {
        for (String name : new String[]{"Customer", "ABCWidget", "PermissionCustomerPermission", "x"}) {
            String once = Names.toSnakeCase(name);
            assertThat(Names.toSnakeCase(once)).isEqualTo(once);
            assertThat(Names.toSnakeCase(name)).isEqualTo(once);
        }
    }
}
