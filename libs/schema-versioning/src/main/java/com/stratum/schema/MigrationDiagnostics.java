package com.stratum.schema;

import java.time.Duration;
import java.util.List;

/**
 * Sink for progress and failure reports from the {@link MigrationEngine}.
 *
 * <p>The engine holds no logger of its own; callers pass the sink they want. All methods default
 * to no-ops so implementations override only what they report.
 *
 * @see com.stratum.schema.diagnostics.LoggingMigrationDiagnostics
 * @see com.stratum.schema.diagnostics.MeteredMigrationDiagnostics
 */
public interface MigrationDiagnostics {

    /** Called once the current and latest versions are known. */
    default void migrationStarted(int currentVersion, int latestVersion) {}

    default void stepStarted(MigrationStep step) {}

    default void stepCommitted(MigrationStep step, Duration elapsed) {}

    default void stepFailed(MigrationStep step, String error) {}

    /** Called exactly once per run, with the result returned to the caller. */
    default void migrationFinished(MigrationResult result) {}

    /** A sink that reports nothing. */
    static MigrationDiagnostics noop() {
        return new MigrationDiagnostics() {};
    }

    /** A sink forwarding every report to each of {@code sinks}, in order. */
    static MigrationDiagnostics composite(MigrationDiagnostics... sinks) {
        List<MigrationDiagnostics> targets = List.of(sinks);
        return new MigrationDiagnostics() {
            @Override
            public void migrationStarted(int currentVersion, int latestVersion) {
                targets.forEach(t -> t.migrationStarted(currentVersion, latestVersion));
            }

            @Override
            public void stepStarted(MigrationStep step) {
                targets.forEach(t -> t.stepStarted(step));
            }

            @Override
            public void stepCommitted(MigrationStep step, Duration elapsed) {
                targets.forEach(t -> t.stepCommitted(step, elapsed));
            }

            @Override
            public void stepFailed(MigrationStep step, String error) {
                targets.forEach(t -> t.stepFailed(step, error));
            }

            @Override
            public void migrationFinished(MigrationResult result) {
                targets.forEach(t -> t.migrationFinished(result));
            }
        };
    }
}
