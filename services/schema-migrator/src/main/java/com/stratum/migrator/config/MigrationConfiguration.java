package com.stratum.migrator.config;

import com.stratum.migrator.runner.SchemaMigrationRunner;
import com.stratum.migrator.runner.SchemaVersionHealthIndicator;
import com.stratum.schema.MigrationDiagnostics;
import com.stratum.schema.MigrationEngine;
import com.stratum.schema.SchemaSpec;
import com.stratum.schema.diagnostics.LoggingMigrationDiagnostics;
import com.stratum.schema.diagnostics.MeteredMigrationDiagnostics;
import com.stratum.schema.spec.SchemaSpecLoader;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the migration engine, its diagnostics, the schema spec and the startup runner.
 *
 * <p>Diagnostics always log through SLF4J; Micrometer meters are added when a
 * {@link MeterRegistry} is available (Actuator provides one).
 */
@Configuration
public class MigrationConfiguration {

    @Bean
    public SchemaSpecLoader schemaSpecLoader() {
        return new SchemaSpecLoader();
    }

    /**
     * Loads the spec named by {@code stratum.migrator.spec-location}.
     *
     * @throws SchemaSpecLoader.SchemaSpecLoadException if the resource is missing or invalid
     */
    @Bean
    public SchemaSpec schemaSpec(
            SchemaMigratorProperties properties,
            SchemaSpecLoader loader,
            ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(properties.specLocation());
        try (InputStream in = resource.getInputStream()) {
            return loader.load(
                    in,
                    SchemaSpecLoader.Format.fromFileName(resource.getFilename()),
                    properties.specLocation());
        } catch (IOException e) {
            throw new SchemaSpecLoader.SchemaSpecLoadException(
                    "Failed to read schema spec " + properties.specLocation(), e);
        }
    }

    @Bean
    public MigrationDiagnostics migrationDiagnostics(
            SchemaMigratorProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        MigrationDiagnostics logging = new LoggingMigrationDiagnostics();
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            return logging;
        }
        return MigrationDiagnostics.composite(
                logging, new MeteredMigrationDiagnostics(registry, properties.serviceName()));
    }

    @Bean
    public MigrationEngine migrationEngine(MigrationDiagnostics diagnostics) {
        return new MigrationEngine(diagnostics);
    }

    @Bean
    public SchemaMigrationRunner schemaMigrationRunner(
            DataSource dataSource,
            MigrationEngine engine,
            SchemaSpec spec,
            SchemaMigratorProperties properties) {
        return new SchemaMigrationRunner(dataSource, engine, spec, properties);
    }

    @Bean
    public SchemaVersionHealthIndicator schemaVersionHealthIndicator(SchemaMigrationRunner runner) {
        return new SchemaVersionHealthIndicator(runner);
    }
}
