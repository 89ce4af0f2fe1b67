package org.twinsql.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.pool.ConnectionPool;
import org.twinsql.db.pool.ConnectionPoolRegistry;
import org.twinsql.db.pool.EmbeddedConnectionPool;
import org.twinsql.db.pool.HikariConnectionPool;
import org.twinsql.db.pool.PoolFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Hands out one shared client per {@link ConnectionIdentity}, backed by one shared pool per identity.
 *
 * <p>{@code forceNew} gives a caller its own client (its own pinned connection in manual mode) on the same pool.
 */
public final class ClientRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    private final ConnectionPoolRegistry pools;
    private final ConcurrentMap<String, DatabaseClient> clients = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    public ClientRegistry() {
        this(new ConnectionPoolRegistry());
    }

    public ClientRegistry(ConnectionPoolRegistry pools) {
        this.pools = Objects.requireNonNull(pools, "pools");
    }

    public ConnectionPoolRegistry pools() {
        return pools;
    }

    public DatabaseClient getOrCreate(ClientConfig config) {
        return getOrCreate(config, false);
    }

    public DatabaseClient getOrCreate(ClientConfig config, boolean forceNew) {
        Objects.requireNonNull(config, "config");
        String key = config.identity().key();

        if (forceNew) {
            DatabaseClient client = newClient(config);
            log.debug("Created unregistered client | {}", key);
            return client;
        }

        DatabaseClient existing = clients.get(key);
        if (existing != null) {
            return existing;
        }
        synchronized (lock) {
            existing = clients.get(key);
            if (existing != null) {
                return existing;
            }
            DatabaseClient client = newClient(config);
            clients.put(key, client);
            log.info("Registered client | {} | engine={}", key, config.engine());
            return client;
        }
    }

    /**
     * Evicts the cached client for {@code identity}, releasing any connection it pinned.
     *
     * @return false when no client was registered
     */
    public boolean remove(ConnectionIdentity identity, boolean closePool) {
        DatabaseClient removed;
        synchronized (lock) {
            removed = clients.remove(identity.key());
        }
        if (removed != null) {
            removed.close();
        }
        if (closePool) {
            pools.closeAll(identity);
        }
        return removed != null;
    }

    /** Closes the pool for one identity and evicts its client. */
    public void closeAllConnections(ConnectionIdentity identity) {
        remove(identity, true);
        log.info("Closed connections | {}", identity.key());
    }

    /** Closes every pool and evicts every client. Meant for application shutdown. */
    public void closeAllConnections() {
        List<DatabaseClient> toClose;
        synchronized (lock) {
            toClose = new ArrayList<>(clients.values());
            clients.clear();
        }
        for (DatabaseClient client : toClose) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Error closing client {}", client.identity(), e);
            }
        }
        pools.closeAll();
    }

    public RegistryInfo info() {
        List<String> instances = new ArrayList<>(new TreeSet<>(clients.keySet()));
        List<String> poolKeys = new ArrayList<>(pools.keys());
        return new RegistryInfo(instances, poolKeys, instances.size(), poolKeys.size());
    }

    @Override
    public void close() {
        closeAllConnections();
    }

    private DatabaseClient newClient(ClientConfig config) {
        ConnectionPool pool = pools.getOrCreate(config, poolFactory(config.engine()));
        return switch (config.engine()) {
            case POSTGRES -> new PostgresClient(config, pool);
            case SQLITE -> new SqliteClient(config, pool);
        };
    }

    static PoolFactory poolFactory(Engine engine) {
        return switch (engine) {
            case POSTGRES -> HikariConnectionPool::create;
            case SQLITE -> EmbeddedConnectionPool::forSqlite;
        };
    }
}
