package com.gatekeeper.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * TokenResponse - Result of a successful register, login or external login.
 *
 * Example:
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer",
 *   "expires_at": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * The client sends {@code access_token} back as {@code Authorization: Bearer <token>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    public static final String BEARER = "bearer";

    @JsonProperty("access_token")
    @ToString.Exclude
    private String accessToken;

    @JsonProperty("token_type")
    private String tokenType;

    /** Matches the token's {@code exp} claim. */
    @JsonProperty("expires_at")
    private Instant expiresAt;
}
