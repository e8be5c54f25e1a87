package com.stratum.migrator.runner;

import com.stratum.migrator.config.SchemaMigratorProperties;
import com.stratum.schema.MigrationEngine;
import com.stratum.schema.MigrationResult;
import com.stratum.schema.SchemaSpec;
import com.stratum.schema.jdbc.JdbcDatabaseCapability;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.OptionalInt;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Runs the schema migration once, at application startup.
 *
 * <p>One connection is borrowed from the pool for the whole run and returned afterwards. The
 * result of the run is kept for {@link SchemaVersionHealthIndicator}.
 */
public class SchemaMigrationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrationRunner.class);

    private final DataSource dataSource;
    private final MigrationEngine engine;
    private final SchemaSpec spec;
    private final SchemaMigratorProperties properties;

    private volatile MigrationResult lastResult;

    public SchemaMigrationRunner(
            DataSource dataSource,
            MigrationEngine engine,
            SchemaSpec spec,
            SchemaMigratorProperties properties) {
        this.dataSource = dataSource;
        this.engine = engine;
        this.spec = spec;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        migrate();
    }

    /**
     * Migrates the database and returns the engine's result.
     *
     * @throws SchemaMigrationFailedException if the migration failed and
     *     {@code fail-on-error} is set, or no connection could be obtained
     */
    public MigrationResult migrate() {
        OptionalInt bootstrap = properties.bootstrapAtVersion() == null
                ? OptionalInt.empty()
                : OptionalInt.of(properties.bootstrapAtVersion());

        MigrationResult result;
        try (Connection connection = dataSource.getConnection()) {
            result = engine.migrate(new JdbcDatabaseCapability(connection), spec, bootstrap);
        } catch (SQLException e) {
            throw new SchemaMigrationFailedException(
                    "Cannot obtain a database connection for schema migration: " + e.getMessage(),
                    e);
        }
        lastResult = result;

        if (!result.isSuccess()) {
            if (properties.failOnError()) {
                throw new SchemaMigrationFailedException(result);
            }
            if (result.versionKnown()) {
                log.warn("Continuing with schema at version {} because fail-on-error is disabled",
                        result.achievedVersion());
            } else {
                log.warn("Continuing with an unknown schema version because fail-on-error is "
                        + "disabled");
            }
        }
        return result;
    }

    /** Result of the last run, empty before the first one. */
    public Optional<MigrationResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }
}
