package org.twinsql.db.error;

/**
 * Wraps the engine's failure for one statement. The in-flight transaction has already been rolled back
 * when this is thrown.
 */
public class QueryExecutionException extends DatabaseException {
    public QueryExecutionException(String message, Throwable cause) { super(message, cause); }
}
