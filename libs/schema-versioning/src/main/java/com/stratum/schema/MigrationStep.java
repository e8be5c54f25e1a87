package com.stratum.schema;

import java.util.List;
import java.util.Locale;

/**
 * One unit of work for the {@link StepExecutor}: the statements to run and the version to record
 * once they all succeed, inside a single transaction.
 *
 * @param kind how the step was chosen
 * @param fromVersion version recorded before the step
 * @param targetVersion version recorded when the step commits
 * @param statements statements to run, in order
 * @param createBookkeepingTable whether the {@code meta} table must be created first (virgin
 *     database only)
 */
public record MigrationStep(
        StepKind kind,
        int fromVersion,
        int targetVersion,
        List<String> statements,
        boolean createBookkeepingTable) {

    public MigrationStep {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (targetVersion <= fromVersion) {
            throw new IllegalArgumentException(
                    "targetVersion (%d) must be greater than fromVersion (%d)"
                            .formatted(targetVersion, fromVersion));
        }
        statements = List.copyOf(statements);
    }

    /** Returns a short description such as {@code "upgrade 2 -> 3"}, used in diagnostics. */
    public String describe() {
        return "%s %d -> %d".formatted(kind.name().toLowerCase(Locale.ROOT).replace('_', ' '),
                fromVersion, targetVersion);
    }
}
