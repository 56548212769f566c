package com.gatekeeper.auth.data;

/**
 * A statement that failed at the transactional boundary and was rolled back.
 *
 * @param statement SQL text that failed (parameters are not kept)
 * @param message   driver or framework message
 * @param cause     original exception
 */
public record StorageFailure(String statement, String message, Throwable cause) {
}
