package com.gatekeeper.auth.exception;

/**
 * ServiceException - Failure raised at the data access and authorization boundaries.
 *
 * Carries an {@link ErrorKind} alongside the human-readable message so that a
 * caller (HTTP layer, CLI, another service) can branch on the kind and show
 * the message as-is.
 *
 * Unchecked: every kind is terminal for the current request and nothing in
 * this service retries.
 */
public class ServiceException extends RuntimeException {

    private final ErrorKind kind;

    public ServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static ServiceException validation(String message) {
        return new ServiceException(ErrorKind.VALIDATION, message);
    }

    public static ServiceException conflict(String message) {
        return new ServiceException(ErrorKind.CONFLICT, message);
    }

    public static ServiceException unauthenticated(String message) {
        return new ServiceException(ErrorKind.UNAUTHENTICATED, message);
    }

    public static ServiceException forbidden(String message) {
        return new ServiceException(ErrorKind.FORBIDDEN, message);
    }

    public static ServiceException malformedClaims(String message) {
        return new ServiceException(ErrorKind.MALFORMED_CLAIMS, message);
    }

    @Override
    public String toString() {
        return "ServiceException[" + kind + "]: " + getMessage();
    }
}
