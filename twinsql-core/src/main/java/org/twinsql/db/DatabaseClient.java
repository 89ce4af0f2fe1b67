package org.twinsql.db;

import java.util.List;
import java.util.Map;

/**
 * One query API over either engine.
 *
 * <p>Query text uses positional {@code %s} markers ({@code %%} for a literal percent) and engine-neutral DDL;
 * the client translates it for its engine. Every statement is committed on success and rolled back on failure.
 *
 * <p>Two connection modes:
 * <ul>
 *   <li>auto ({@code autoConnection=true}, the default): each call borrows a pooled connection and returns it
 *   before the call completes;</li>
 *   <li>manual: {@link #connect()} pins one connection to this client until {@link #close()}. While a
 *   connection is pinned every call runs on it, whatever {@code autoConnection} says.</li>
 * </ul>
 * A client in manual mode is meant for one thread at a time. Auto mode is safe to share.
 */
public interface DatabaseClient extends AutoCloseable {

    ConnectionIdentity identity();

    /** Pin a pooled connection to this client. No-op when one is already held. */
    void connect();

    boolean isConnected();

    List<Map<String, Object>> executeQuery(String sql, List<?> params, boolean autoConnection);

    default List<Map<String, Object>> executeQuery(String sql, List<?> params) {
        return executeQuery(sql, params, true);
    }

    /** @return affected row count */
    int executeNonQuery(String sql, List<?> params, boolean autoConnection);

    default int executeNonQuery(String sql, List<?> params) {
        return executeNonQuery(sql, params, true);
    }

    /**
     * Runs an insert (usually with a {@code RETURNING id} clause) and returns the generated identifier:
     * the {@code id} column of the first returned row, else its first column, else whatever the engine reports
     * as the last inserted row id. May be null.
     */
    Object executeNonQueryReturning(String sql, List<?> params, boolean autoConnection);

    default Object executeNonQueryReturning(String sql, List<?> params) {
        return executeNonQueryReturning(sql, params, true);
    }

    /** Give the pinned connection back to the pool. No-op when none is held. */
    @Override
    void close();
}
