package org.twinsql.server.config;

import org.twinsql.db.ConnectionIdentity;
import org.twinsql.db.DatabaseClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs {@code SELECT 1} through the default client. Any failure, including failing to build the pool,
 * reports DOWN. Engine and identity are reported either way.
 */
@Component
public class DatabaseHealthIndicator extends AbstractHealthIndicator {

    private final ObjectProvider<DatabaseClient> client;
    private final ConnectionIdentity identity;

    public DatabaseHealthIndicator(ObjectProvider<DatabaseClient> client, TwinSqlProperties props) {
        super("Database health check failed");
        this.client = Objects.requireNonNull(client);
        this.identity = props.toClientConfig().identity();
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        builder.withDetail("engine", identity.engine().name().toLowerCase(Locale.ROOT))
                .withDetail("identity", identity.key());
        client.getObject().executeQuery("SELECT 1", List.of());
        builder.up();
    }
}
