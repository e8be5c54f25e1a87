package com.stratum.schema;

/**
 * What the {@link VersionReader} found in the database.
 *
 * @param version the recorded schema version, 0 for a virgin database
 * @param bookkeepingTablePresent whether the {@code meta} table exists
 */
public record SchemaState(int version, boolean bookkeepingTablePresent) {

    public SchemaState {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        if (version > 0 && !bookkeepingTablePresent) {
            throw new IllegalArgumentException("a non-zero version requires the bookkeeping table");
        }
    }

    /** State of a database that has never been migrated. */
    public static SchemaState virgin() {
        return new SchemaState(0, false);
    }

    /** Returns the state after a step to {@code newVersion} has committed. */
    public SchemaState advancedTo(int newVersion) {
        return new SchemaState(newVersion, true);
    }
}
