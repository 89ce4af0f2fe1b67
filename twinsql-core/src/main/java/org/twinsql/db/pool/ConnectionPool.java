package org.twinsql.db.pool;

import org.twinsql.db.ConnectionIdentity;

import java.sql.Connection;

/**
 * Bounded set of reusable connections for one identity, partitioned into available and borrowed.
 *
 * <p>Implementations never block on exhaustion: {@link #acquire()} fails with
 * {@link org.twinsql.db.error.PoolExhaustedException} once {@code borrowed == max}.
 */
public interface ConnectionPool extends AutoCloseable {

    ConnectionIdentity identity();

    /** Borrow a connection. The caller must hand it back through {@link #release(Connection)} exactly once. */
    Connection acquire();

    void release(Connection connection);

    PoolStats stats();

    /** Close every connection, borrowed ones included. Only used at shutdown. */
    @Override
    void close();
}
