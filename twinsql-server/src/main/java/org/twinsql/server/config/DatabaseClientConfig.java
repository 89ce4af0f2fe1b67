package org.twinsql.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.ClientConfig;
import org.twinsql.db.ClientRegistry;
import org.twinsql.db.DatabaseClient;
import org.twinsql.db.pool.ConnectionPoolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

@Configuration
public class DatabaseClientConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseClientConfig.class);

    @Bean(destroyMethod = "close")
    public ConnectionPoolRegistry connectionPoolRegistry() {
        return new ConnectionPoolRegistry();
    }

    // closes every client and pool on context shutdown
    @Bean(destroyMethod = "closeAllConnections")
    public ClientRegistry clientRegistry(ConnectionPoolRegistry pools) {
        return new ClientRegistry(pools);
    }

    /**
     * The client for the configured engine. Lazy, so the service starts (and reports DOWN) while the
     * database is unreachable.
     */
    @Bean
    @Lazy
    public DatabaseClient databaseClient(ClientRegistry registry, TwinSqlProperties props) {
        ClientConfig config = props.toClientConfig();
        log.info("Creating default database client | {}", config);
        return registry.getOrCreate(config);
    }
}
