package org.twinsql.db;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for one client and the pool behind it.
 *
 * @param jdbcUrl optional override of the URL derived from the identity (tests, custom driver options)
 * @param properties extra driver properties, passed through untouched
 */
public record ClientConfig(
        ConnectionIdentity identity,
        String password,
        int minPoolSize,
        int maxPoolSize,
        Duration connectTimeout,
        Duration queryTimeout,
        boolean debug,
        String jdbcUrl,
        Map<String, String> properties
) {

    public static final int DEFAULT_POSTGRES_POOL_MIN = 1;
    public static final int DEFAULT_POSTGRES_POOL_MAX = 10;
    public static final int DEFAULT_SQLITE_POOL_MAX = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ClientConfig {
        Objects.requireNonNull(identity, "identity");
        if (maxPoolSize < 1) {
            throw new IllegalArgumentException("maxPoolSize must be >= 1, got " + maxPoolSize);
        }
        if (minPoolSize < 0) {
            throw new IllegalArgumentException("minPoolSize must be >= 0, got " + minPoolSize);
        }
        if (maxPoolSize < minPoolSize) {
            throw new IllegalArgumentException("maxPoolSize (" + maxPoolSize + ") must be >= minPoolSize (" + minPoolSize + ")");
        }
        connectTimeout = connectTimeout == null ? DEFAULT_TIMEOUT : connectTimeout;
        queryTimeout = queryTimeout == null ? Duration.ZERO : queryTimeout;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public Engine engine() {
        return identity.engine();
    }

    /** URL handed to the driver: the explicit override, else one derived from the identity. */
    public String effectiveJdbcUrl() {
        if (jdbcUrl != null && !jdbcUrl.isBlank()) {
            return jdbcUrl;
        }
        return switch (identity.engine()) {
            case POSTGRES -> "jdbc:postgresql://" + identity.host() + ":" + identity.port() + "/" + identity.database();
            case SQLITE -> "jdbc:sqlite:" + identity.database();
        };
    }

    public static Builder postgres(String host, int port, String database, String user) {
        return new Builder(ConnectionIdentity.postgres(host, port, database, user))
                .poolSize(DEFAULT_POSTGRES_POOL_MIN, DEFAULT_POSTGRES_POOL_MAX);
    }

    public static Builder sqlite(Path databaseFile) {
        return new Builder(ConnectionIdentity.sqlite(databaseFile))
                .poolSize(1, DEFAULT_SQLITE_POOL_MAX);
    }

    @Override
    public String toString() {
        return "ClientConfig[" + identity.key()
                + ", pool=" + minPoolSize + ".." + maxPoolSize
                + ", password=" + (password == null || password.isEmpty() ? "(not set)" : "***")
                + ", debug=" + debug + "]";
    }

    public static final class Builder {
        private final ConnectionIdentity identity;
        private String password;
        private int minPoolSize;
        private int maxPoolSize;
        private Duration connectTimeout = DEFAULT_TIMEOUT;
        private Duration queryTimeout = DEFAULT_TIMEOUT;
        private boolean debug;
        private String jdbcUrl;
        private Map<String, String> properties = Map.of();

        private Builder(ConnectionIdentity identity) {
            this.identity = Objects.requireNonNull(identity, "identity");
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder poolSize(int min, int max) {
            this.minPoolSize = min;
            this.maxPoolSize = max;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            this.properties = properties;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(identity, password, minPoolSize, maxPoolSize, connectTimeout, queryTimeout,
                    debug, jdbcUrl, properties);
        }
    }
}
