package org.twinsql.db.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.twinsql.db.ClientConfig;
import org.twinsql.db.ConnectionIdentity;
import org.twinsql.db.Engine;
import org.twinsql.db.error.DatabaseException;
import org.twinsql.db.error.PoolCreationException;
import org.twinsql.db.error.PoolExhaustedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Pool for the embedded engine: explicit available/borrowed sets under one lock.
 *
 * <p>New connections are opened while holding the lock, which keeps {@code available + borrowed <= max}
 * without a reservation step. Opening a file connection is cheap compared to a network handshake.
 */
public final class EmbeddedConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(EmbeddedConnectionPool.class);

    /** Opens one physical connection. */
    @FunctionalInterface
    public interface ConnectionOpener {
        Connection open() throws SQLException;
    }

    private final ConnectionIdentity identity;
    private final int minSize;
    private final int maxSize;
    private final ConnectionOpener opener;

    private final Object lock = new Object();
    private final Deque<Connection> available = new ArrayDeque<>();
    private final Set<Connection> borrowed = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean closed;

    public EmbeddedConnectionPool(ConnectionIdentity identity, int minSize, int maxSize, ConnectionOpener opener) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.opener = Objects.requireNonNull(opener, "opener");
        if (maxSize < 1 || minSize < 0 || minSize > maxSize) {
            throw new IllegalArgumentException("invalid pool bounds min=" + minSize + " max=" + maxSize);
        }
        this.minSize = minSize;
        this.maxSize = maxSize;

        synchronized (lock) {
            try {
                for (int i = 0; i < minSize; i++) {
                    available.push(opener.open());
                }
            } catch (SQLException e) {
                closeQuietly(available);
                available.clear();
                throw new PoolCreationException("Error creating connection pool for '" + identity.key() + "': " + e.getMessage(), e);
            }
        }
    }

    /** Pool over a SQLite file, using the driver's own configuration object for pragmas. */
    public static EmbeddedConnectionPool forSqlite(ClientConfig config) {
        if (config.engine() != Engine.SQLITE) {
            throw new IllegalArgumentException("not an embedded-engine config: " + config.identity());
        }
        String url = config.effectiveJdbcUrl();
        Path parent = Path.of(config.identity().database()).getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new PoolCreationException("Cannot create directory for '" + config.identity().key() + "': " + e.getMessage(), e);
            }
        }

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, config.connectTimeout().toMillis()));
        Properties props = sqlite.toProperties();
        config.properties().forEach(props::setProperty);

        EmbeddedConnectionPool pool = new EmbeddedConnectionPool(config.identity(), config.minPoolSize(), config.maxPoolSize(), () -> {
            Connection c = DriverManager.getConnection(url, props);
            c.setAutoCommit(false);
            return c;
        });
        log.info("[POOL] Created | engine=sqlite | path={} | min={} | max={}",
                config.identity().database(), config.minPoolSize(), config.maxPoolSize());
        return pool;
    }

    @Override
    public ConnectionIdentity identity() {
        return identity;
    }

    @Override
    public Connection acquire() {
        synchronized (lock) {
            if (closed) {
                throw new DatabaseException("Connection pool for '" + identity.key() + "' is closed");
            }
            Connection c = available.poll();
            if (c != null) {
                borrowed.add(c);
                log.debug("[POOL] Reused connection | {} | borrowed={}", identity.key(), borrowed.size());
                return c;
            }
            if (borrowed.size() + available.size() >= maxSize) {
                throw new PoolExhaustedException(identity.key(), maxSize);
            }
            try {
                c = opener.open();
            } catch (SQLException e) {
                throw new DatabaseException("Error opening connection for '" + identity.key() + "': " + e.getMessage(), e);
            }
            borrowed.add(c);
            log.debug("[POOL] New connection | {} | borrowed={}", identity.key(), borrowed.size());
            return c;
        }
    }

    @Override
    public void release(Connection connection) {
        if (connection == null) return;
        synchronized (lock) {
            if (!borrowed.remove(connection)) {
                log.warn("[POOL] Ignoring release of a connection not borrowed from {}", identity.key());
                return;
            }
            if (closed || isBroken(connection)) {
                closeQuietly(List.of(connection));
                return;
            }
            available.push(connection);
        }
    }

    @Override
    public PoolStats stats() {
        synchronized (lock) {
            return new PoolStats(identity.key(), minSize, maxSize, available.size(), borrowed.size());
        }
    }

    @Override
    public void close() {
        List<Connection> all;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            all = new ArrayList<>(available);
            all.addAll(borrowed);
            available.clear();
            borrowed.clear();
        }
        closeQuietly(all);
        log.info("[POOL] Closed | {} | connections={}", identity.key(), all.size());
    }

    private static boolean isBroken(Connection c) {
        try {
            return c.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    private void closeQuietly(Iterable<Connection> connections) {
        for (Connection c : connections) {
            try {
                c.close();
            } catch (SQLException e) {
                log.warn("[POOL] Error closing connection for {}", identity.key(), e);
            }
        }
    }
}
