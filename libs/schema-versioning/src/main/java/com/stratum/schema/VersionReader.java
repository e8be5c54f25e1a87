package com.stratum.schema;

import java.util.Optional;

/**
 * Determines the schema version a database currently holds.
 *
 * <p>A missing {@code meta} table means a virgin database (version 0). A present table must hold
 * the {@code schema_version} row with a non-negative integer; anything else is an inconsistency
 * the engine refuses to work around. Only read operations are issued.
 */
public final class VersionReader {

    /**
     * Looks up the bookkeeping table and reads the stored version.
     *
     * @throws MigrationExecutionException if the table lookup or read fails, or the stored row is
     *     missing or malformed
     */
    public SchemaState readCurrentVersion(DatabaseCapability capability)
            throws MigrationExecutionException {
        boolean present;
        try {
            present = !capability.listTables(BookkeepingTable.TABLE_NAME).isEmpty();
        } catch (DatabaseException e) {
            throw new MigrationExecutionException(
                    MigrationResult.UNKNOWN_VERSION, "Can't check for the '%s' table: %s"
                            .formatted(BookkeepingTable.TABLE_NAME, e.getMessage()), e);
        }
        if (!present) {
            return SchemaState.virgin();
        }

        Optional<String> stored;
        try {
            stored = capability.queryScalar(BookkeepingTable.SELECT_VERSION_SQL);
        } catch (DatabaseException e) {
            throw new MigrationExecutionException(
                    MigrationResult.UNKNOWN_VERSION,
                    "Can't read the schema version: " + e.getMessage(),
                    e);
        }

        String value = stored.orElseThrow(() -> new MigrationExecutionException(
                MigrationResult.UNKNOWN_VERSION, "Table '%s' exists but has no '%s' row"
                        .formatted(BookkeepingTable.TABLE_NAME, BookkeepingTable.VERSION_KEY)));
        return new SchemaState(parseVersion(value), true);
    }

    private static int parseVersion(String value) throws MigrationExecutionException {
        int version;
        try {
            version = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MigrationExecutionException(
                    MigrationResult.UNKNOWN_VERSION,
                    "Stored schema version '%s' is not an integer".formatted(value), e);
        }
        if (version < 0) {
            throw new MigrationExecutionException(
                    MigrationResult.UNKNOWN_VERSION,
                    "Stored schema version %d is negative".formatted(version));
        }
        return version;
    }
}
