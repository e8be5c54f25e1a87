package com.stratum.schema;

/**
 * Layout of the reserved table that stores the schema version.
 *
 * <pre>
 * meta
 *   name  VARCHAR(64) NOT NULL PRIMARY KEY
 *   value VARCHAR(255)
 * row: ('schema_version', '&lt;integer&gt;')
 * </pre>
 *
 * <p>The row is created once and afterwards only ever updated.
 */
public final class BookkeepingTable {

    public static final String TABLE_NAME = "meta";

    public static final String VERSION_KEY = "schema_version";

    public static final String CREATE_TABLE_SQL =
            "CREATE TABLE meta (name VARCHAR(64) NOT NULL PRIMARY KEY, value VARCHAR(255))";

    public static final String INSERT_INITIAL_ROW_SQL =
            "INSERT INTO meta (name, value) VALUES ('schema_version', '0')";

    public static final String SELECT_VERSION_SQL =
            "SELECT value FROM meta WHERE name = 'schema_version'";

    private BookkeepingTable() {
        // constants
    }

    /** Statement recording {@code version} as the current schema version. */
    public static String updateVersionSql(int version) {
        return "UPDATE meta SET value = '" + version + "' WHERE name = 'schema_version'";
    }
}
