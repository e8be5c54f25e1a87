package com.stratum.migrator.runner;

import com.stratum.schema.MigrationResult;

/**
 * Thrown at startup when the database could not be brought to the latest schema version.
 *
 * <p>Carries the engine's result when the engine ran; {@link #result()} is null when the database
 * connection itself could not be obtained.
 */
public class SchemaMigrationFailedException extends RuntimeException {

    private final transient MigrationResult result;

    public SchemaMigrationFailedException(MigrationResult result) {
        super("Cannot run the application: cannot create/upgrade database schema: [%d] %s"
                .formatted(result.statusCode(), result.message()));
        this.result = result;
    }

    public SchemaMigrationFailedException(String message, Throwable cause) {
        super(message, cause);
        this.result = null;
    }

    public MigrationResult result() {
        return result;
    }
}
