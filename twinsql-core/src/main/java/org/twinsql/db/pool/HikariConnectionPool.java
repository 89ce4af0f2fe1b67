package org.twinsql.db.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.ClientConfig;
import org.twinsql.db.ConnectionIdentity;
import org.twinsql.db.error.DatabaseException;
import org.twinsql.db.error.PoolCreationException;
import org.twinsql.db.error.PoolExhaustedException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool for the networked engine. HikariCP owns the physical connections; this class keeps its own borrowed
 * set so a caller past {@code max} fails at once instead of waiting out Hikari's connection timeout.
 */
public final class HikariConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(HikariConnectionPool.class);

    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    private final ConnectionIdentity identity;
    private final HikariDataSource dataSource;
    private final int minSize;
    private final int maxSize;

    private final Object lock = new Object();
    private final Set<Connection> borrowed = Collections.newSetFromMap(new IdentityHashMap<>());
    // slots handed out but not yet backed by a connection
    private int reserved;

    private HikariConnectionPool(ConnectionIdentity identity, HikariDataSource dataSource, int minSize, int maxSize) {
        this.identity = identity;
        this.dataSource = dataSource;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    public static HikariConnectionPool create(ClientConfig config) {
        Objects.requireNonNull(config, "config");
        ConnectionIdentity identity = config.identity();

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("twinsql-" + poolIdCounter.incrementAndGet() + "-" + JdbcUrls.shortName(identity.key()));
        cfg.setJdbcUrl(config.effectiveJdbcUrl());
        if (!identity.user().isEmpty()) {
            cfg.setUsername(identity.user());
        }
        if (config.password() != null) {
            cfg.setPassword(config.password());
        }
        cfg.setMaximumPoolSize(config.maxPoolSize());
        cfg.setMinimumIdle(config.minPoolSize());
        cfg.setConnectionTimeout(Math.max(250L, config.connectTimeout().toMillis()));
        cfg.setAutoCommit(false);
        // fail construction on bad credentials/host rather than on first borrow
        cfg.setInitializationFailTimeout(1);
        config.properties().forEach(cfg::addDataSourceProperty);
        if (config.effectiveJdbcUrl().startsWith("jdbc:postgresql:")) {
            cfg.addDataSourceProperty("tcpKeepAlive", "true");
        }

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(cfg);
        } catch (RuntimeException e) {
            throw new PoolCreationException("Error creating connection pool for '" + identity.key() + "': " + e.getMessage(), e);
        }

        log.info("[POOL] Created | engine=postgres | pool={} | url={} | user={} | min={} | max={}",
                cfg.getPoolName(), JdbcUrls.sanitize(config.effectiveJdbcUrl()), identity.user(),
                config.minPoolSize(), config.maxPoolSize());
        return new HikariConnectionPool(identity, ds, config.minPoolSize(), config.maxPoolSize());
    }

    @Override
    public ConnectionIdentity identity() {
        return identity;
    }

    @Override
    public Connection acquire() {
        synchronized (lock) {
            if (dataSource.isClosed()) {
                throw new DatabaseException("Connection pool for '" + identity.key() + "' is closed");
            }
            if (borrowed.size() + reserved >= maxSize) {
                throw new PoolExhaustedException(identity.key(), maxSize);
            }
            reserved++;
        }

        Connection c = null;
        try {
            c = dataSource.getConnection();
            return c;
        } catch (SQLException e) {
            throw new DatabaseException("Error getting connection from pool '" + identity.key() + "': " + e.getMessage(), e);
        } finally {
            synchronized (lock) {
                reserved--;
                if (c != null) {
                    borrowed.add(c);
                }
            }
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
        }
        try {
            // Hikari's proxy returns the physical connection to its bag on close
            connection.close();
        } catch (SQLException e) {
            log.warn("[POOL] Error returning connection to {}", identity.key(), e);
        }
    }

    @Override
    public PoolStats stats() {
        int inUse;
        synchronized (lock) {
            inUse = borrowed.size();
        }
        HikariPoolMXBean mx = dataSource.getHikariPoolMXBean();
        int idle = mx == null ? 0 : mx.getIdleConnections();
        return new PoolStats(identity.key(), minSize, maxSize, idle, inUse);
    }

    @Override
    public void close() {
        synchronized (lock) {
            borrowed.clear();
        }
        dataSource.close();
        log.info("[POOL] Closed | {}", identity.key());
    }
}
