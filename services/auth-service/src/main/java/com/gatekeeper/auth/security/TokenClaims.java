package com.gatekeeper.auth.security;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Typed view of a verified token payload.
 *
 * @param subject     {@code sub}: the username the token was issued to
 * @param permissions {@code permissions}: granted permission ids, in issued order
 * @param expiresAt   {@code exp}
 */
public record TokenClaims(String subject, List<Integer> permissions, Instant expiresAt) {

    public static final String SUBJECT = "sub";
    public static final String PERMISSIONS = "permissions";
    public static final String EXPIRATION = "exp";

    public TokenClaims {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    /**
     * Reads the standard fields from a verified claims map. Non-numeric
     * permission entries are skipped.
     */
    public static TokenClaims from(Map<String, Object> claims) {
        List<Integer> permissions = new ArrayList<>();
        if (claims.get(PERMISSIONS) instanceof List<?> granted) {
            for (Object entry : granted) {
                if (entry instanceof Number number) {
                    permissions.add(number.intValue());
                }
            }
        }
        return new TokenClaims((String) claims.get(SUBJECT), permissions, toInstant(claims.get(EXPIRATION)));
    }

    private static Instant toInstant(Object exp) {
        if (exp instanceof Date date) {
            return date.toInstant();
        }
        if (exp instanceof Number seconds) {
            return Instant.ofEpochSecond(seconds.longValue());
        }
        return null;
    }
}
