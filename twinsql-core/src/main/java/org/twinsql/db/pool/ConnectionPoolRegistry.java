package org.twinsql.db.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.ClientConfig;
import org.twinsql.db.ConnectionIdentity;
import org.twinsql.db.error.DatabaseException;
import org.twinsql.db.error.PoolCreationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One pool per {@link ConnectionIdentity}, created lazily by the first caller.
 *
 * <p>Lookups are lock-free; creation re-checks under the registry lock so concurrent first callers
 * end up with the same pool.
 */
public final class ConnectionPoolRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolRegistry.class);

    private final ConcurrentMap<String, ConnectionPool> pools = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    public ConnectionPool getOrCreate(ClientConfig config, PoolFactory factory) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(factory, "factory");
        String key = config.identity().key();

        ConnectionPool existing = pools.get(key);
        if (existing != null) {
            return existing;
        }
        synchronized (lock) {
            existing = pools.get(key);
            if (existing != null) {
                return existing;
            }
            ConnectionPool created;
            try {
                created = factory.create(config);
            } catch (DatabaseException e) {
                log.error("[POOL] Creation failed | {} | {}", key, e.getMessage());
                throw e instanceof PoolCreationException ? e : new PoolCreationException(e.getMessage(), e);
            } catch (Exception e) {
                log.error("[POOL] Creation failed | {} | {}", key, e.getMessage());
                throw new PoolCreationException("Error creating connection pool for '" + key + "': " + e.getMessage(), e);
            }
            if (created == null) {
                throw new PoolCreationException("Pool factory returned null for '" + key + "'", null);
            }
            pools.put(key, created);
            log.info("[POOL] Registered | {} | total pools={}", key, pools.size());
            return created;
        }
    }

    public ConnectionPool get(ConnectionIdentity identity) {
        return pools.get(identity.key());
    }

    public boolean contains(ConnectionIdentity identity) {
        return pools.containsKey(identity.key());
    }

    /** Sorted keys of the registered pools. */
    public Set<String> keys() {
        return new TreeSet<>(pools.keySet());
    }

    public List<PoolStats> stats() {
        List<PoolStats> out = new ArrayList<>();
        for (String key : keys()) {
            ConnectionPool pool = pools.get(key);
            if (pool != null) {
                out.add(pool.stats());
            }
        }
        return out;
    }

    public int size() {
        return pools.size();
    }

    /** Closes and unregisters the pool for one identity. Returns false when none was registered. */
    public boolean closeAll(ConnectionIdentity identity) {
        ConnectionPool pool;
        synchronized (lock) {
            pool = pools.remove(identity.key());
        }
        if (pool == null) {
            return false;
        }
        closeQuietly(identity.key(), pool);
        return true;
    }

    /** Closes every pool. A failing pool is logged and the rest are still closed. */
    public void closeAll() {
        List<Map.Entry<String, ConnectionPool>> toClose;
        synchronized (lock) {
            toClose = new ArrayList<>(pools.entrySet());
            pools.clear();
        }
        for (Map.Entry<String, ConnectionPool> e : toClose) {
            closeQuietly(e.getKey(), e.getValue());
        }
        log.info("[POOL] All pools closed | count={}", toClose.size());
    }

    @Override
    public void close() {
        closeAll();
    }

    private static void closeQuietly(String key, ConnectionPool pool) {
        try {
            pool.close();
        } catch (RuntimeException e) {
            log.warn("[POOL] Error closing pool {}", key, e);
        }
    }
}
