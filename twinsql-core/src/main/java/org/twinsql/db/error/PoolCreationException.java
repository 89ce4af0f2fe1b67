package org.twinsql.db.error;

/**
 * The engine rejected pool construction (bad credentials, unreachable host, unusable file path).
 * Nothing is registered for the identity, so a later call retries from scratch.
 */
public class PoolCreationException extends DatabaseException {
    public PoolCreationException(String message, Throwable cause) { super(message, cause); }
}
