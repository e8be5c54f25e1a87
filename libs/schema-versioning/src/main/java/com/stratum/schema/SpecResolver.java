package com.stratum.schema;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decides, from a {@link SchemaSpec} and the database's {@link SchemaState}, which step brings
 * the schema one move closer to the latest version.
 *
 * <p>Policy for a virgin database (version 0), first match wins:
 *
 * <ol>
 *   <li>a requested bootstrap version K runs {@code installAtVersion[K]} and records K
 *   <li>an {@code install} script runs and records the latest version in one step
 *   <li>an {@code upgradeToVersion[1]} script runs as an ordinary upgrade to version 1
 *   <li>otherwise there is no install path
 * </ol>
 *
 * <p>Past version 0 every step is {@code upgradeToVersion[current + 1]}. Stateless and reusable.
 */
public final class SpecResolver {

    /**
     * Returns the declared latest version, or the highest upgrade step, or 1 when the spec has
     * neither.
     */
    public int resolveLatestVersion(SchemaSpec spec) {
        OptionalInt declared = spec.declaredLatestVersion();
        if (declared.isPresent()) {
            return declared.getAsInt();
        }
        return spec.upgradeToVersion().keySet().stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElse(1);
    }

    /**
     * Checks a bootstrap-at-version override against the spec's version range.
     *
     * @throws SchemaSpecException if the requested version is outside {@code [1, latest]}
     */
    public void validateBootstrapVersion(SchemaSpec spec, OptionalInt bootstrapAtVersion) {
        if (bootstrapAtVersion.isEmpty()) {
            return;
        }
        int requested = bootstrapAtVersion.getAsInt();
        int latest = resolveLatestVersion(spec);
        if (requested < 1 || requested > latest) {
            throw new SchemaSpecException(
                    "Can't bootstrap at version %d, it must be between 1 and the latest version %d"
                            .formatted(requested, latest));
        }
    }

    /**
     * Resolves the next step.
     *
     * @param spec the schema spec
     * @param state what the database currently holds
     * @param bootstrapAtVersion intermediate version to install a virgin database at, ignored once
     *     the database holds a version
     * @return the step to apply, or empty when the database is already at the latest version
     * @throws SchemaSpecException if the spec lacks the script this step needs
     * @throws MigrationExecutionException if the database is newer than the spec's latest version
     */
    public Optional<MigrationStep> resolveStep(
            SchemaSpec spec, SchemaState state, OptionalInt bootstrapAtVersion)
            throws MigrationExecutionException {
        int latest = resolveLatestVersion(spec);
        int current = state.version();

        if (current > latest) {
            throw new MigrationExecutionException(latest, versionSkewMessage(current, latest));
        }
        if (current == latest) {
            return Optional.empty();
        }

        boolean createTable = !state.bookkeepingTablePresent();
        if (current == 0) {
            if (bootstrapAtVersion.isPresent()) {
                int version = bootstrapAtVersion.getAsInt();
                List<String> script = spec.installScriptAt(version)
                        .orElseThrow(() -> new SchemaSpecException(
                                "missing install-at-version %d script".formatted(version)));
                return Optional.of(new MigrationStep(
                        StepKind.INSTALL_AT_VERSION, 0, version, script, createTable));
            }
            Optional<List<String>> install = spec.installScript();
            if (install.isPresent()) {
                return Optional.of(new MigrationStep(
                        StepKind.INSTALL, 0, latest, install.get(), createTable));
            }
            if (spec.upgradeScriptTo(1).isEmpty()) {
                throw new SchemaSpecException(
                        "no install path available (neither an install script nor an upgrade to "
                                + "version 1)");
            }
        }

        int next = current + 1;
        List<String> script = spec.upgradeScriptTo(next)
                .orElseThrow(() -> new SchemaSpecException(
                        "missing upgrade step to version %d".formatted(next)));
        return Optional.of(new MigrationStep(StepKind.UPGRADE, current, next, script, createTable));
    }

    static String versionSkewMessage(int current, int latest) {
        return ("Database schema version (%d) is newer than the spec's latest version (%d), "
                        + "the application probably needs to be upgraded first")
                .formatted(current, latest);
    }
}
