package org.twinsql.db.error;

/**
 * Root of the client's failure hierarchy. All database failures surface as unchecked exceptions.
 */
public class DatabaseException extends RuntimeException {
    public DatabaseException(String message, Throwable cause) { super(message, cause); }
    public DatabaseException(String message) { super(message); }
}
