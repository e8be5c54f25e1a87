package com.stratum.schema;

/**
 * Thrown when the database side of a migration fails: a rejected statement, a failed version
 * write or commit, inconsistent bookkeeping, or a database newer than the spec.
 *
 * <p>{@link #targetVersion()} is the version the engine was trying to reach when the failure
 * happened.
 */
public class MigrationExecutionException extends Exception {

    private final int targetVersion;

    public MigrationExecutionException(int targetVersion, String message) {
        super(message);
        this.targetVersion = targetVersion;
    }

    public MigrationExecutionException(int targetVersion, String message, Throwable cause) {
        super(message, cause);
        this.targetVersion = targetVersion;
    }

    public int targetVersion() {
        return targetVersion;
    }
}
