package com.gatekeeper.auth.service;

import com.gatekeeper.auth.config.AuthProperties;
import com.gatekeeper.auth.dto.ExternalIdentity;
import com.gatekeeper.auth.dto.LoginRequest;
import com.gatekeeper.auth.dto.RegistrationRequest;
import com.gatekeeper.auth.dto.TokenResponse;
import com.gatekeeper.auth.entity.Customer;
import com.gatekeeper.auth.exception.ErrorKind;
import com.gatekeeper.auth.exception.ServiceException;
import com.gatekeeper.auth.repository.CustomerRepository;
import com.gatekeeper.auth.security.CredentialHasher;
import com.gatekeeper.auth.security.IssuedToken;
import com.gatekeeper.auth.security.TokenClaims;
import com.gatekeeper.auth.security.TokenCodec;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AuthService - Authentication flows and permission-gated authorization.
 *
 * Flows:
 * - register: create a local account and issue a token
 * - login: check a local password and issue a token
 * - externalIdentityLogin: issue a token for an already-verified Google identity,
 *   provisioning a placeholder account on first sight
 * - authorize: verify a token against a list of required permissions
 *
 * Every issued token carries {@code sub} = username and the configured
 * default permission set ({@code gatekeeper.auth.default-permissions}).
 *
 * Failures are {@link ServiceException}s whose kind the caller maps to a
 * response: VALIDATION, CONFLICT, UNAUTHENTICATED, FORBIDDEN,
 * MALFORMED_CLAIMS or STORAGE_FAILURE.
 *
 * @see TokenCodec for token signing and verification
 * @see CredentialHasher for password hashing
 * @see CustomerRepository for credential records
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final CustomerRepository customerRepository;
    private final CredentialHasher credentialHasher;
    private final TokenCodec tokenCodec;
    private final AuthProperties authProperties;
    private final Validator validator;

    /**
     * Register a new local account.
     *
     * @param request candidate username and password
     * @return token for the new account
     * @throws ServiceException CONFLICT if the username is taken, VALIDATION on blank input
     */
    public TokenResponse register(RegistrationRequest request) {
        validate(request);
        log.info("Registration attempt for username: {}", request.getUsername());

        if (customerRepository.existsByUsername(request.getUsername())) {
            log.warn("Registration rejected, username already exists: {}", request.getUsername());
            throw ServiceException.conflict("Username already exists");
        }

        Customer saved = customerRepository.save(Customer.builder()
                .username(request.getUsername())
                .password(credentialHasher.hash(request.getPassword()))
                .fullName(request.getFullName())
                .build());
        log.info("Registered new account: {}", saved.getUsername());
        return issueFor(saved);
    }

    /**
     * Log in with a local password.
     * <p>
     * An unknown username and a wrong password fail the same way so the
     * response does not reveal which accounts exist.
     *
     * @throws ServiceException UNAUTHENTICATED on bad credentials
     */
    public TokenResponse login(String username, String password) {
        return login(new LoginRequest(username, password));
    }

    public TokenResponse login(LoginRequest request) {
        validate(request);
        Customer customer = customerRepository.findByUsername(request.getUsername())
                .filter(found -> credentialHasher.verify(request.getPassword(), found.getPassword()))
                .orElseThrow(() -> {
                    log.warn("Login failed for username: {}", request.getUsername());
                    return ServiceException.unauthenticated(INVALID_CREDENTIALS);
                });
        if (credentialHasher.needsUpgrade(customer.getPassword())) {
            log.info("Account {} still uses a legacy password hash", customer.getUsername());
        }
        log.info("User authenticated successfully: {}", customer.getUsername());
        return issueFor(customer);
    }

    /**
     * Log in with a third-party identity the caller has already verified.
     * <p>
     * If no account uses the identity's email as username, one is created.
     * Its password column holds a hash of the external id; that value is
     * never handed out, so the account cannot be used for local login in
     * practice.
     *
     * @param identity verified email, display name and provider subject id
     * @return token for the matching or new account
     */
    public TokenResponse externalIdentityLogin(ExternalIdentity identity) {
        validate(identity);
        log.info("External identity login for email: {}", identity.getEmail());

        Customer customer = customerRepository.findByUsername(identity.getEmail())
                .orElseGet(() -> provision(identity));
        return issueFor(customer);
    }

    /**
     * Gate for protected operations.
     *
     * @param token               bearer token
     * @param requiredPermissions permissions that must all be granted
     * @return verified claims
     * @throws ServiceException UNAUTHENTICATED, MALFORMED_CLAIMS or FORBIDDEN
     */
    public Map<String, Object> authorize(String token, Collection<Integer> requiredPermissions) {
        return tokenCodec.verify(token, requiredPermissions);
    }

    /** {@link #authorize} returning the typed view of the claims. */
    public TokenClaims authorizeClaims(String token, Collection<Integer> requiredPermissions) {
        return TokenClaims.from(authorize(token, requiredPermissions));
    }

    /**
     * Creates the account for a first external login. When a concurrent login
     * for the same email wins the insert, its account is used instead.
     */
    private Customer provision(ExternalIdentity identity) {
        log.info("Provisioning account for external identity: {}", identity.getEmail());
        try {
            return customerRepository.save(Customer.builder()
                    .username(identity.getEmail())
                    .password(credentialHasher.hash(identity.getExternalId()))
                    .fullName(identity.getName())
                    .externalIdentityId(identity.getExternalId())
                    .build());
        } catch (ServiceException e) {
            if (e.kind() != ErrorKind.CONFLICT) {
                throw e;
            }
            log.info("Account for {} was provisioned concurrently, reusing it", identity.getEmail());
            return customerRepository.findByUsername(identity.getEmail()).orElseThrow(() -> e);
        }
    }

    private TokenResponse issueFor(Customer customer) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(TokenClaims.SUBJECT, customer.getUsername());
        claims.put(TokenClaims.PERMISSIONS, authProperties.defaultPermissions());
        IssuedToken issued = tokenCodec.issueToken(claims, authProperties.sessionTtl());
        return TokenResponse.builder()
                .accessToken(issued.token())
                .tokenType(TokenResponse.BEARER)
                .expiresAt(issued.expiresAt())
                .build();
    }

    private <T> void validate(T request) {
        if (request == null) {
            throw ServiceException.validation("Request must not be null");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw ServiceException.validation(message);
        }
    }
}
