package org.twinsql.db;

import org.twinsql.db.dialect.PostgresDialect;
import org.twinsql.db.pool.ConnectionPool;

/**
 * Client for the networked engine. Values bind natively; generated ids come from the {@code RETURNING} row.
 */
public final class PostgresClient extends AbstractDatabaseClient {

    public PostgresClient(ClientConfig config, ConnectionPool pool) {
        super(config, pool, new PostgresDialect());
    }
}
