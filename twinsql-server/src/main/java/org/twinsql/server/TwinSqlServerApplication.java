package org.twinsql.server;

import org.twinsql.server.config.TwinSqlProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TwinSqlProperties.class)
public class TwinSqlServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(TwinSqlServerApplication.class, args);
    }
}
