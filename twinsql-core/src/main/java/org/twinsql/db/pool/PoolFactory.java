package org.twinsql.db.pool;

import org.twinsql.db.ClientConfig;

/**
 * Builds the pool for a configuration the first time its identity is seen.
 */
@FunctionalInterface
public interface PoolFactory {

    ConnectionPool create(ClientConfig config) throws Exception;
}
