package com.stratum.migrator;

import com.stratum.migrator.config.SchemaMigratorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Stratum Schema Migrator: brings the configured database to the latest schema version, then
 * exits.
 *
 * <p>The migration runs once at startup, before the context reports itself ready. A failed
 * migration aborts startup (unless {@code stratum.migrator.fail-on-error=false}), so the process
 * exits with a non-zero status and the last committed version stays recorded in the database.
 *
 * <p>Run under an external lock (a deployment job, a leader election) when several instances may
 * start at once: the engine does not coordinate concurrent migrations.
 */
@SpringBootApplication
@EnableConfigurationProperties(SchemaMigratorProperties.class)
public class SchemaMigratorApplication {

    public static void main(String[] args) {
        var context = SpringApplication.run(SchemaMigratorApplication.class, args);
        System.exit(SpringApplication.exit(context));
    }
}
