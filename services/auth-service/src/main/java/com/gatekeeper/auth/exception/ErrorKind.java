package com.gatekeeper.auth.exception;

/**
 * ErrorKind - Machine-checkable category of a {@link ServiceException}.
 *
 * Each kind carries the HTTP status a transport layer should answer with,
 * so callers can map failures to responses without inspecting messages.
 *
 * Mapping:
 * - VALIDATION: 400, malformed caller input (e.g. empty bulk insert)
 * - CONFLICT: 409, uniqueness violation (e.g. duplicate username)
 * - UNAUTHENTICATED: 401, bad credentials or invalid/expired token
 * - FORBIDDEN: 403, valid token lacking a required permission
 * - MALFORMED_CLAIMS: 400, token payload violates the permissions-list contract
 * - STORAGE_FAILURE: 500, statement failed and was rolled back
 */
public enum ErrorKind {

    VALIDATION(400),
    CONFLICT(409),
    UNAUTHENTICATED(401),
    FORBIDDEN(403),
    MALFORMED_CLAIMS(400),
    STORAGE_FAILURE(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
