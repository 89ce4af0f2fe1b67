package org.twinsql.db.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.error.QueryExecutionException;
import org.twinsql.db.pool.ConnectionPool;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Borrow, run, commit or roll back, give back. The connection returns to its pool on every path,
 * including when commit or rollback themselves fail.
 */
public final class TransactionScope {
    private static final Logger log = LoggerFactory.getLogger(TransactionScope.class);

    private TransactionScope() {
    }

    public static <T> T run(ConnectionPool pool, SqlWork<T> work) {
        Connection connection = pool.acquire();
        try {
            return inTransaction(connection, work);
        } finally {
            pool.release(connection);
        }
    }

    /**
     * Runs {@code work} on a connection the caller already holds. Commits on success and rolls back on failure;
     * the connection is not released.
     *
     * @throws QueryExecutionException wrapping any {@link SQLException}, engine message included
     */
    public static <T> T inTransaction(Connection connection, SqlWork<T> work) {
        try {
            T result = work.run(connection);
            connection.commit();
            return result;
        } catch (SQLException e) {
            QueryExecutionException failure = new QueryExecutionException("Error executing query: " + e.getMessage(), e);
            rollback(connection, failure);
            throw failure;
        } catch (RuntimeException | Error e) {
            rollback(connection, e);
            throw e;
        }
    }

    private static void rollback(Connection connection, Throwable failure) {
        try {
            connection.rollback();
        } catch (SQLException | RuntimeException e) {
            log.warn("Rollback failed after: {}", failure.getMessage());
            failure.addSuppressed(e);
        }
    }
}
