package com.gatekeeper.auth.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.DelegatingPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * CredentialHasher - One-way password hashing for stored credentials.
 *
 * New hashes use bcrypt with a random salt and carry a scheme prefix,
 * e.g. {@code {bcrypt}$2a$10$...}. Verification also accepts:
 * - {@code {pbkdf2}} hashes
 * - Un-prefixed bcrypt hashes ({@code $2a$}, {@code $2b$}, {@code $2y$}) written by earlier deployments
 *
 * A malformed or unrecognized stored hash verifies as false; it never throws.
 */
@Component
@Slf4j
public class CredentialHasher {

    public static final String CURRENT_SCHEME = "bcrypt";

    private final PasswordEncoder encoder;

    public CredentialHasher() {
        BCryptPasswordEncoder bcrypt = new BCryptPasswordEncoder();
        Map<String, PasswordEncoder> encoders = new HashMap<>();
        encoders.put(CURRENT_SCHEME, bcrypt);
        encoders.put("pbkdf2", Pbkdf2PasswordEncoder.defaultsForSpringSecurity_v5_8());
        DelegatingPasswordEncoder delegating = new DelegatingPasswordEncoder(CURRENT_SCHEME, encoders);
        delegating.setDefaultPasswordEncoderForMatches(bcrypt);
        this.encoder = delegating;
    }

    /**
     * @param plaintext password as entered
     * @return prefixed bcrypt hash, different on every call
     */
    public String hash(String plaintext) {
        return encoder.encode(plaintext);
    }

    /**
     * @return true iff {@code hash} was produced from {@code plaintext}
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return encoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password hash could not be checked: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Whether {@code hash} should be re-hashed with the current scheme after a
     * successful verification.
     */
    public boolean needsUpgrade(String hash) {
        try {
            return encoder.upgradeEncoding(hash);
        } catch (IllegalArgumentException e) {
            return true;
        }
    }
}
