package com.gatekeeper.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AuthServiceApplication - Entry point of the Gatekeeper authentication service.
 *
 * This service is responsible for:
 * - Local username/password registration and login
 * - Accounts for users signing in with an already-verified Google identity
 * - JWT issuance carrying the user's permission set
 * - Permission checks on tokens presented to protected operations
 *
 * Architecture Context:
 * - PostgreSQL for credential records, accessed through the statement
 *   builder and transactional executor in {@code com.gatekeeper.auth.data}
 * - Stateless sessions: all session state lives in the signed token
 *
 * @see com.gatekeeper.auth.service.AuthService for the authentication flows
 * @see com.gatekeeper.auth.security.TokenCodec for token operations
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
