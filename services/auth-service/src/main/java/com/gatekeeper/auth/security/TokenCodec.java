package com.gatekeeper.auth.security;

import com.gatekeeper.auth.config.JwtProperties;
import com.gatekeeper.auth.exception.ServiceException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TokenCodec - Signs and verifies the bearer tokens issued by this service.
 *
 * JWT Structure (RFC 7519):
 * - Header: HS256
 * - Payload: caller claims (at least {@code sub} and {@code permissions}) plus {@code exp}
 * - Signature: HMAC-SHA256 with the server-held {@code jwt.secret}
 *
 * Verification Outcomes:
 * - Bad signature, malformed or expired token: UNAUTHENTICATED
 * - {@code permissions} present but not a list: MALFORMED_CLAIMS
 * - A required permission missing from the token: FORBIDDEN (all-of check)
 *
 * There is no revocation list: a token is valid until its {@code exp}.
 *
 * @see TokenClaims for the typed view of a payload
 */
@Component
@Slf4j
public class TokenCodec {

    /** Signing key derived from the configured secret via {@link Keys#hmacShaKeyFor}. */
    private final Key signingKey;

    /** TTL applied by {@link #issue(Map)}. */
    private final Duration defaultTtl;

    private final Clock clock;

    /**
     * @throws io.jsonwebtoken.security.WeakKeyException if the secret is shorter than 256 bits
     */
    public TokenCodec(JwtProperties properties, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.defaultTtl = properties.expiration();
        this.clock = clock;
    }

    /**
     * Issue a token with the configured default TTL.
     *
     * @param claims payload claims, e.g. {@code sub} and {@code permissions}
     * @return compact JWS string (header.payload.signature)
     */
    public String issue(Map<String, Object> claims) {
        return issue(claims, defaultTtl);
    }

    /**
     * Issue a token expiring at {@code now + ttl}.
     * <p>
     * The caller's map is copied; an {@code exp} entry in it is replaced.
     *
     * @param claims payload claims
     * @param ttl    lifetime, the default TTL when null
     * @return compact JWS string
     */
    public String issue(Map<String, Object> claims, Duration ttl) {
        return issueToken(claims, ttl).token();
    }

    /**
     * Same as {@link #issue(Map, Duration)}, also returning the expiry that
     * was signed into the token.
     */
    public IssuedToken issueToken(Map<String, Object> claims, Duration ttl) {
        Duration lifetime = ttl == null ? defaultTtl : ttl;
        // exp is carried in whole seconds
        Instant expiresAt = clock.instant().plus(lifetime).truncatedTo(ChronoUnit.SECONDS);
        String token = Jwts.builder()
                .setClaims(new LinkedHashMap<>(claims))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * Verify signature and expiry, returning the full claims map.
     */
    public Map<String, Object> verify(String token) {
        return verify(token, List.of());
    }

    /**
     * Verify signature and expiry, then check that every permission in
     * {@code requiredPermissions} is granted.
     *
     * @param token               compact JWS string (without "Bearer " prefix)
     * @param requiredPermissions permissions that must all be present; null or empty skips the check
     * @return the decoded claims, {@code exp} included
     * @throws ServiceException UNAUTHENTICATED, MALFORMED_CLAIMS or FORBIDDEN
     */
    public Map<String, Object> verify(String token, Collection<Integer> requiredPermissions) {
        Claims claims = parse(token);
        if (requiredPermissions != null && !requiredPermissions.isEmpty()) {
            checkPermissions(claims, requiredPermissions);
        }
        return new LinkedHashMap<>(claims);
    }

    /** {@link #verify(String, Collection)} returning the typed view. */
    public TokenClaims verifyClaims(String token, Collection<Integer> requiredPermissions) {
        return TokenClaims.from(verify(token, requiredPermissions));
    }

    private Claims parse(String token) {
        try {
            return Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException e) {
            log.warn("Rejected expired token for subject: {}", e.getClaims().getSubject());
            throw ServiceException.unauthenticated("Invalid or expired token");
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected token: {}", e.getClass().getSimpleName());
            throw ServiceException.unauthenticated("Invalid or expired token");
        }
    }

    private static void checkPermissions(Claims claims, Collection<Integer> required) {
        Object granted = claims.getOrDefault(TokenClaims.PERMISSIONS, List.of());
        if (!(granted instanceof Collection<?> grantedList)) {
            throw ServiceException.malformedClaims("The token's 'permissions' claim is not a list");
        }
        Set<Long> grantedIds = new HashSet<>();
        for (Object entry : grantedList) {
            if (entry instanceof Number number) {
                grantedIds.add(number.longValue());
            }
        }
        // A null requirement can never be granted.
        for (Integer permission : required) {
            if (permission == null || !grantedIds.contains(permission.longValue())) {
                log.warn("Subject {} lacks permission {}", claims.getSubject(), permission);
                throw ServiceException.forbidden("Insufficient permissions");
            }
        }
    }
}
