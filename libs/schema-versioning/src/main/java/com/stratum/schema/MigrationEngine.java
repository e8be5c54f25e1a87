package com.stratum.schema;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Brings a database's schema to the latest version described by a {@link SchemaSpec}.
 *
 * <p>Each call runs a small state machine to completion:
 *
 * <ul>
 *   <li>{@code START}: read the current version and resolve the latest one. A database newer than
 *       the spec fails immediately without further database access; so does one whose version
 *       can't be read, reported with {@link MigrationResult#UNKNOWN_VERSION}.
 *   <li>{@code STEPPING}: resolve the next step and apply it in its own transaction, until the
 *       latest version is reached or something fails.
 *   <li>{@code DONE} / {@code FAILED}: build the {@link MigrationResult}.
 * </ul>
 *
 * <p>A failure never undoes steps that already committed; the result reports the last committed
 * version, and a later call resumes from there. Database and spec errors are reported through the
 * result, never thrown.
 *
 * <p>The engine keeps no per-run state, so one instance can serve successive runs. Concurrent runs
 * against the same database are not coordinated.
 */
public final class MigrationEngine {

    private final VersionReader versionReader;
    private final SpecResolver specResolver;
    private final StepExecutor stepExecutor;
    private final MigrationDiagnostics diagnostics;

    public MigrationEngine() {
        this(MigrationDiagnostics.noop());
    }

    public MigrationEngine(MigrationDiagnostics diagnostics) {
        this(new VersionReader(), new SpecResolver(), new StepExecutor(), diagnostics);
    }

    MigrationEngine(
            VersionReader versionReader,
            SpecResolver specResolver,
            StepExecutor stepExecutor,
            MigrationDiagnostics diagnostics) {
        this.versionReader = Objects.requireNonNull(versionReader, "versionReader");
        this.specResolver = Objects.requireNonNull(specResolver, "specResolver");
        this.stepExecutor = Objects.requireNonNull(stepExecutor, "stepExecutor");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /** Migrates to the latest version, installing a virgin database via its default path. */
    public MigrationResult migrate(DatabaseCapability capability, SchemaSpec spec) {
        return migrate(capability, spec, OptionalInt.empty());
    }

    /**
     * Migrates to the latest version; a virgin database is first installed at
     * {@code bootstrapAtVersion} using {@code installAtVersion[bootstrapAtVersion]}.
     */
    public MigrationResult migrate(
            DatabaseCapability capability, SchemaSpec spec, int bootstrapAtVersion) {
        return migrate(capability, spec, OptionalInt.of(bootstrapAtVersion));
    }

    public MigrationResult migrate(
            DatabaseCapability capability, SchemaSpec spec, OptionalInt bootstrapAtVersion) {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(bootstrapAtVersion, "bootstrapAtVersion");

        MigrationResult result = new Run(capability, spec, bootstrapAtVersion).execute();
        diagnostics.migrationFinished(result);
        return result;
    }

    /** State of a single {@link #migrate} call. */
    private final class Run {

        private final DatabaseCapability capability;
        private final SchemaSpec spec;
        private final OptionalInt bootstrapAtVersion;

        private MigrationState state = MigrationState.START;
        private SchemaState schema = SchemaState.virgin();
        private int fromVersion;
        private int latestVersion;
        private MigrationResult result;

        Run(DatabaseCapability capability, SchemaSpec spec, OptionalInt bootstrapAtVersion) {
            this.capability = capability;
            this.spec = spec;
            this.bootstrapAtVersion = bootstrapAtVersion;
        }

        MigrationResult execute() {
            while (true) {
                switch (state) {
                    case START -> start();
                    case STEPPING -> step();
                    case DONE, FAILED -> {
                        return result;
                    }
                }
            }
        }

        private void start() {
            try {
                schema = versionReader.readCurrentVersion(capability);
            } catch (MigrationExecutionException e) {
                result = MigrationResult.unreadableVersion(e.getMessage());
                state = MigrationState.FAILED;
                return;
            }
            fromVersion = schema.version();
            latestVersion = specResolver.resolveLatestVersion(spec);
            diagnostics.migrationStarted(fromVersion, latestVersion);

            if (fromVersion > latestVersion) {
                failExecution(SpecResolver.versionSkewMessage(fromVersion, latestVersion));
                return;
            }
            if (fromVersion == 0) {
                try {
                    specResolver.validateBootstrapVersion(spec, bootstrapAtVersion);
                } catch (SchemaSpecException e) {
                    failSpec(e.getMessage());
                    return;
                }
            }
            state = MigrationState.STEPPING;
        }

        private void step() {
            Optional<MigrationStep> next;
            try {
                next = specResolver.resolveStep(spec, schema, bootstrapAtVersion);
            } catch (SchemaSpecException e) {
                failSpec(e.getMessage());
                return;
            } catch (MigrationExecutionException e) {
                failExecution(e.getMessage());
                return;
            }

            if (next.isEmpty()) {
                result = MigrationResult.success(fromVersion, latestVersion);
                state = MigrationState.DONE;
                return;
            }

            MigrationStep step = next.get();
            diagnostics.stepStarted(step);
            long startedAt = System.nanoTime();
            try {
                stepExecutor.applyStep(capability, step);
            } catch (MigrationExecutionException e) {
                diagnostics.stepFailed(step, e.getMessage());
                failExecution(e.getMessage());
                return;
            }
            schema = schema.advancedTo(step.targetVersion());
            diagnostics.stepCommitted(step, Duration.ofNanos(System.nanoTime() - startedAt));
        }

        private void failSpec(String cause) {
            result = MigrationResult.specError(fromVersion, schema.version(), cause);
            state = MigrationState.FAILED;
        }

        private void failExecution(String cause) {
            result = MigrationResult.executionError(fromVersion, schema.version(), cause);
            state = MigrationState.FAILED;
        }
    }
}
