package org.twinsql.db;

import org.twinsql.db.dialect.SqliteDialect;
import org.twinsql.db.pool.ConnectionPool;

import java.nio.file.Path;

/**
 * Client for the embedded, file-based engine. Accepts the same query text as {@link PostgresClient}.
 */
public final class SqliteClient extends AbstractDatabaseClient {

    public SqliteClient(ClientConfig config, ConnectionPool pool) {
        super(config, pool, new SqliteDialect());
    }

    public Path databaseFile() {
        return Path.of(identity().database());
    }
}
