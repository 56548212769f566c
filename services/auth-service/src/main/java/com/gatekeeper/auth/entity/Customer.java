package com.gatekeeper.auth.entity;

import com.gatekeeper.auth.data.Entity;
import com.gatekeeper.auth.data.EntityDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Customer - Credential record of a user account.
 *
 * Maps to {@code users.customer}. Columns are the snake_case form of the
 * properties; unset properties are left out of inserts and updates.
 *
 * Table Schema (see {@code schema.sql}):
 * - id: BIGSERIAL primary key, assigned by the database
 * - username: unique login name (an email address for Google accounts)
 * - password: password hash, never plaintext
 * - full_name: display name, set for accounts provisioned from Google
 * - external_identity_id: stable Google subject id, null for local accounts
 *
 * Lifecycle:
 * - Created by registration or first Google login
 * - Read on every login
 * - Never modified by the authentication flows
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Customer implements Entity {

    public static final EntityDescriptor DESCRIPTOR = EntityDescriptor.of(Customer.class, "users", "customer");

    private Long id;

    private String username;

    /** Stored hash; excluded from toString so it never reaches a log line. */
    @ToString.Exclude
    private String password;

    private String fullName;

    private String externalIdentityId;

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }
}
