package com.gatekeeper.auth.security;

import java.time.Instant;

/**
 * A freshly signed token and the expiry written into it.
 *
 * @param token     compact JWS string
 * @param expiresAt value of the {@code exp} claim
 */
public record IssuedToken(String token, Instant expiresAt) {
}
