package com.example.videoupload_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Repairs the Flyway schema history before migrating, so an edited migration does not block startup.
 * Switch off with {@code upload.flyway.repair-on-start=false} once the schema is stable.
 */
@Configuration
@ConditionalOnProperty(name = "upload.flyway.repair-on-start", havingValue = "true", matchIfMissing = true)
public class FlywayRepairMigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayRepairMigrationStrategy.class);

    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            flyway.repair();
            var result = flyway.migrate();
            LOGGER.info("Flyway migrated {} script(s), schema version={}", result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
