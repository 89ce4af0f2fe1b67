package org.twinsql.db;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies one logical database target. Equal identities share one pool and, unless bypassed, one client.
 *
 * <p>The password is deliberately not part of the identity so the key is safe to log.
 */
public record ConnectionIdentity(Engine engine, String host, int port, String database, String user) {

    public static final int DEFAULT_POSTGRES_PORT = 5432;

    public ConnectionIdentity {
        Objects.requireNonNull(engine, "engine");
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database is required");
        }
        host = host == null ? "" : host;
        user = user == null ? "" : user;
    }

    public static ConnectionIdentity postgres(String host, int port, String database, String user) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        return new ConnectionIdentity(Engine.POSTGRES, host, port <= 0 ? DEFAULT_POSTGRES_PORT : port, database, user);
    }

    /** Embedded engine identity; the pool is keyed by the normalized absolute file path. */
    public static ConnectionIdentity sqlite(Path databaseFile) {
        Objects.requireNonNull(databaseFile, "databaseFile");
        return new ConnectionIdentity(Engine.SQLITE, "", 0, databaseFile.toAbsolutePath().normalize().toString(), "");
    }

    /** Stable map key, e.g. {@code localhost:5432/app@svc} or {@code sqlite:/var/data/app.db}. */
    public String key() {
        return switch (engine) {
            case POSTGRES -> host + ":" + port + "/" + database + "@" + user;
            case SQLITE -> "sqlite:" + database;
        };
    }

    @Override
    public String toString() {
        return key();
    }
}
