package com.stratum.schema.diagnostics;

import com.stratum.schema.MigrationDiagnostics;
import com.stratum.schema.MigrationResult;
import com.stratum.schema.MigrationStep;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports migration progress through SLF4J.
 *
 * <p>Steps are logged at INFO, failures at ERROR. A run that finds the database already current
 * logs a single DEBUG line on start and an INFO line on finish.
 */
public final class LoggingMigrationDiagnostics implements MigrationDiagnostics {

    private final Logger log;

    public LoggingMigrationDiagnostics() {
        this(LoggerFactory.getLogger(LoggingMigrationDiagnostics.class));
    }

    /** Creates a sink writing to the given logger. */
    public LoggingMigrationDiagnostics(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log must not be null");
        }
        this.log = log;
    }

    @Override
    public void migrationStarted(int currentVersion, int latestVersion) {
        log.debug("Database schema is at version {}, latest version is {}",
                currentVersion, latestVersion);
    }

    @Override
    public void stepStarted(MigrationStep step) {
        if (step.fromVersion() == 0) {
            log.info("Creating version {} of database schema ...", step.targetVersion());
        } else {
            log.info("Updating database schema from version {} to {} ...",
                    step.fromVersion(), step.targetVersion());
        }
    }

    @Override
    public void stepCommitted(MigrationStep step, Duration elapsed) {
        log.info("Database schema is now at version {} ({} statements, {} ms)",
                step.targetVersion(), step.statements().size(), elapsed.toMillis());
    }

    @Override
    public void stepFailed(MigrationStep step, String error) {
        log.error("Step {} failed and was rolled back: {}", step.describe(), error);
    }

    @Override
    public void migrationFinished(MigrationResult result) {
        if (result.isSuccess()) {
            log.info(result.message());
        } else if (!result.versionKnown()) {
            log.error("[{}] {} (schema version unknown)", result.statusCode(), result.message());
        } else {
            log.error("[{}] {} (schema left at version {})",
                    result.statusCode(), result.message(), result.achievedVersion());
        }
    }
}
