package com.stratum.schema;

/** Outcome class of a migration run, with its status code. */
public enum MigrationStatus {

    /** The database is at the latest version (possibly without having changed anything). */
    SUCCESS(200),

    /** The spec cannot express the path the database needs. Nothing past the last commit ran. */
    SPEC_ERROR(400),

    /** The database rejected a step or is in a state the engine refuses to touch. */
    EXECUTION_ERROR(500);

    private final int code;

    MigrationStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
