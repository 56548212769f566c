package com.gatekeeper.auth.data;

/**
 * A record type persisted through {@link StatementBuilder}.
 * <p>
 * Implementations return a constant descriptor; the method is not a bean
 * getter, so it never leaks into the record payload.
 */
public interface Entity {

    EntityDescriptor descriptor();
}
