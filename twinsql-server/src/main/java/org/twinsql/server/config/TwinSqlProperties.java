package org.twinsql.server.config;

import org.twinsql.db.ClientConfig;
import org.twinsql.db.Engine;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Database settings bound from {@code twinsql.*} (or {@code TWINSQL_*} environment variables).
 *
 * <p>Unset values fall back to defaults; out-of-range values fail startup.
 */
@ConfigurationProperties(prefix = "twinsql")
public record TwinSqlProperties(
        Engine engine,
        boolean debug,
        Postgres postgres,
        Sqlite sqlite
) {

    public static final int MAX_POOL_SIZE = 100;
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public TwinSqlProperties {
        engine = engine == null ? Engine.POSTGRES : engine;
        postgres = postgres == null ? new Postgres(null, null, null, null, null, null, null, null, null) : postgres;
        sqlite = sqlite == null ? new Sqlite(null, null, null) : sqlite;
    }

    /** Client settings for the configured engine. */
    public ClientConfig toClientConfig() {
        ClientConfig.Builder b = switch (engine) {
            case POSTGRES -> ClientConfig.postgres(postgres.host(), postgres.port(), postgres.database(), postgres.user())
                    .password(postgres.password())
                    .poolSize(postgres.poolMin(), postgres.poolMax())
                    .connectTimeout(postgres.connectTimeout())
                    .queryTimeout(postgres.queryTimeout());
            case SQLITE -> ClientConfig.sqlite(Path.of(sqlite.path()))
                    .poolSize(1, sqlite.poolMax())
                    .queryTimeout(sqlite.queryTimeout());
        };
        return b.debug(debug).build();
    }

    public record Postgres(
            String host,
            Integer port,
            String database,
            String user,
            String password,
            Integer poolMin,
            Integer poolMax,
            Duration connectTimeout,
            Duration queryTimeout
    ) {
        public Postgres {
            host = host == null || host.isBlank() ? "localhost" : host;
            port = port == null ? 5432 : port;
            database = database == null || database.isBlank() ? "twinsql" : database;
            user = user == null ? "twinsql" : user;
            password = password == null ? "" : password;
            poolMin = poolMin == null ? ClientConfig.DEFAULT_POSTGRES_POOL_MIN : poolMin;
            poolMax = poolMax == null ? ClientConfig.DEFAULT_POSTGRES_POOL_MAX : poolMax;
            connectTimeout = connectTimeout == null ? DEFAULT_TIMEOUT : connectTimeout;
            queryTimeout = queryTimeout == null ? DEFAULT_TIMEOUT : queryTimeout;

            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("twinsql.postgres.port must be in 1..65535, got " + port);
            }
            if (poolMin < 1) {
                throw new IllegalArgumentException("twinsql.postgres.pool-min must be >= 1, got " + poolMin);
            }
            checkPoolMax("twinsql.postgres.pool-max", poolMax, poolMin);
            checkAtLeast("twinsql.postgres.connect-timeout", connectTimeout, Duration.ofSeconds(5));
            checkAtLeast("twinsql.postgres.query-timeout", queryTimeout, Duration.ofSeconds(1));
        }

        @Override
        public String toString() {
            return "Postgres[" + user + "@" + host + ":" + port + "/" + database + ", pool=" + poolMin + ".." + poolMax + "]";
        }
    }

    public record Sqlite(String path, Integer poolMax, Duration queryTimeout) {
        public Sqlite {
            path = path == null || path.isBlank() ? "./data/twinsql.db" : path;
            poolMax = poolMax == null ? ClientConfig.DEFAULT_SQLITE_POOL_MAX : poolMax;
            queryTimeout = queryTimeout == null ? DEFAULT_TIMEOUT : queryTimeout;

            checkPoolMax("twinsql.sqlite.pool-max", poolMax, 1);
            checkAtLeast("twinsql.sqlite.query-timeout", queryTimeout, Duration.ofSeconds(1));
        }
    }

    private static void checkPoolMax(String name, int poolMax, int poolMin) {
        if (poolMax < poolMin || poolMax > MAX_POOL_SIZE) {
            throw new IllegalArgumentException(name + " (" + poolMax + ") must be between pool-min (" + poolMin
                    + ") and " + MAX_POOL_SIZE);
        }
    }

    private static void checkAtLeast(String name, Duration value, Duration min) {
        if (value.compareTo(min) < 0) {
            throw new IllegalArgumentException(name + " must be >= " + min.toSeconds() + "s, got " + value);
        }
    }
}
