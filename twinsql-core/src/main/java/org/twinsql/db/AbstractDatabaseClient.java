package org.twinsql.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.dialect.SqlDialect;
import org.twinsql.db.dialect.TranslatedQuery;
import org.twinsql.db.error.NotConnectedException;
import org.twinsql.db.exec.SqlWork;
import org.twinsql.db.exec.StatementExecutor;
import org.twinsql.db.exec.TransactionScope;
import org.twinsql.db.pool.ConnectionPool;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared client behaviour: translate, pick the connection (pinned or pooled), run inside a transaction scope.
 * Subclasses bind an engine to its dialect.
 */
public abstract class AbstractDatabaseClient implements DatabaseClient {
    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseClient.class);

    private final ClientConfig config;
    private final ConnectionPool pool;
    private final SqlDialect dialect;
    private final StatementExecutor executor;

    private volatile Connection connection;

    protected AbstractDatabaseClient(ClientConfig config, ConnectionPool pool, SqlDialect dialect) {
        this.config = Objects.requireNonNull(config, "config");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        if (dialect.engine() != config.engine()) {
            throw new IllegalArgumentException("dialect " + dialect.engine() + " does not match " + config.engine());
        }
        this.executor = new StatementExecutor(dialect, config.queryTimeout(), config.debug());
    }

    @Override
    public ConnectionIdentity identity() {
        return config.identity();
    }

    public ClientConfig config() {
        return config;
    }

    protected ConnectionPool pool() {
        return pool;
    }

    @Override
    public synchronized void connect() {
        if (connection != null) {
            log.debug("Already connected | {}", identity());
            return;
        }
        connection = pool.acquire();
        log.info("Connected (manual mode) | {}", identity());
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sql, List<?> params, boolean autoConnection) {
        ExecutionResult.Rows rows = (ExecutionResult.Rows) execute(sql, params, autoConnection, QueryKind.SELECT);
        return rows.rows();
    }

    @Override
    public int executeNonQuery(String sql, List<?> params, boolean autoConnection) {
        return ((ExecutionResult.UpdateCount) execute(sql, params, autoConnection, QueryKind.NON_QUERY)).count();
    }

    @Override
    public Object executeNonQueryReturning(String sql, List<?> params, boolean autoConnection) {
        return ((ExecutionResult.GeneratedId) execute(sql, params, autoConnection, QueryKind.NON_QUERY_RETURNING)).id();
    }

    protected ExecutionResult execute(String sql, List<?> params, boolean autoConnection, QueryKind kind) {
        Connection held = connection;
        if (held == null && !autoConnection) {
            throw new NotConnectedException();
        }
        TranslatedQuery query = dialect.translate(sql, SqlValue.list(params));
        SqlWork<ExecutionResult> work = c -> executor.execute(c, query, kind);

        if (held != null) {
            return TransactionScope.inTransaction(held, work);
        }
        return TransactionScope.run(pool, work);
    }

    @Override
    public synchronized void close() {
        Connection held = connection;
        if (held == null) {
            return;
        }
        connection = null;
        pool.release(held);
        log.info("Disconnected (manual mode) | {}", identity());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + identity() + ", connected=" + isConnected() + "]";
    }
}
