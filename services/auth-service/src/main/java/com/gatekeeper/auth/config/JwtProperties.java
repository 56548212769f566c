package com.gatekeeper.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Token signing settings, bound from the {@code jwt.*} properties.
 *
 * @param secret     HMAC-SHA256 signing key, at least 32 bytes
 * @param expiration TTL used when a caller does not give one (15 minutes when unset)
 */
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(String secret, Duration expiration) {

    public static final Duration DEFAULT_EXPIRATION = Duration.ofMinutes(15);

    public JwtProperties {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("jwt.secret must be set");
        }
        expiration = expiration == null ? DEFAULT_EXPIRATION : expiration;
    }
}
