package com.gatekeeper.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Grant and session settings for issued tokens, bound from {@code gatekeeper.auth.*}.
 *
 * @param defaultPermissions permissions granted to every registered, logged-in
 *                           or provisioned account
 * @param sessionTtl         lifetime of tokens issued by the login flows
 */
@ConfigurationProperties(prefix = "gatekeeper.auth")
public record AuthProperties(List<Integer> defaultPermissions, Duration sessionTtl) {

    public static final List<Integer> DEFAULT_PERMISSIONS = List.of(1, 2, 4);
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofMinutes(60);

    public AuthProperties {
        defaultPermissions = defaultPermissions == null || defaultPermissions.isEmpty()
                ? DEFAULT_PERMISSIONS
                : List.copyOf(defaultPermissions);
        sessionTtl = sessionTtl == null ? DEFAULT_SESSION_TTL : sessionTtl;
    }

    public static AuthProperties defaults() {
        return new AuthProperties(null, null);
    }
}
