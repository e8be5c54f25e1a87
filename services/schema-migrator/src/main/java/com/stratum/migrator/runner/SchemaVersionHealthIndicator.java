package com.stratum.migrator.runner;

import com.stratum.schema.MigrationResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the outcome of the startup migration: UP with the schema version after a successful
 * run, DOWN with the status code and message after a failed one, UNKNOWN before any run. A run
 * that could not read the stored version reports {@code schemaVersion: unknown}.
 */
public class SchemaVersionHealthIndicator implements HealthIndicator {

    private final SchemaMigrationRunner runner;

    public SchemaVersionHealthIndicator(SchemaMigrationRunner runner) {
        this.runner = runner;
    }

    @Override
    public Health health() {
        return runner.lastResult()
                .map(SchemaVersionHealthIndicator::toHealth)
                .orElseGet(() -> Health.unknown()
                        .withDetail("reason", "migration has not run")
                        .build());
    }

    private static Health toHealth(MigrationResult result) {
        Health.Builder builder = result.isSuccess() ? Health.up() : Health.down();
        if (result.versionKnown()) {
            builder.withDetail("schemaVersion", result.achievedVersion())
                    .withDetail("fromVersion", result.fromVersion());
        } else {
            builder.withDetail("schemaVersion", "unknown");
        }
        return builder
                .withDetail("statusCode", result.statusCode())
                .withDetail("message", result.message())
                .build();
    }
}
