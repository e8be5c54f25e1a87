package com.stratum.schema;

import java.util.Optional;
import java.util.Set;

/**
 * The narrow set of database operations the migration engine relies on.
 *
 * <p>Implementations are driven by a single migration invocation at a time and are called
 * sequentially. Every operation reports failure through {@link DatabaseException}; there is no
 * silent error flag to check afterwards.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (Connection connection = dataSource.getConnection()) {
 *     MigrationResult result =
 *             new MigrationEngine().migrate(new JdbcDatabaseCapability(connection), spec);
 * }
 * }</pre>
 *
 * @see com.stratum.schema.jdbc.JdbcDatabaseCapability
 * @see com.stratum.schema.testing.InMemoryDatabaseCapability
 */
public interface DatabaseCapability {

    /**
     * Lists the tables of the current schema whose name matches {@code nameFilter}.
     *
     * @param nameFilter exact table name, matched case-insensitively, or {@code null} for all
     *     tables
     * @return lower-cased table names, never {@code null}
     */
    Set<String> listTables(String nameFilter) throws DatabaseException;

    /**
     * Lists the columns of a table of the current schema.
     *
     * @param table table name, matched case-insensitively
     * @return lower-cased column names, empty when the table does not exist
     */
    Set<String> listColumns(String table) throws DatabaseException;

    /**
     * Runs a query and returns the first column of its first row.
     *
     * @return the value, or empty when the query produced no row or a SQL {@code NULL}
     */
    Optional<String> queryScalar(String sql) throws DatabaseException;

    /** Executes a single statement. */
    void execute(String sql) throws DatabaseException;

    void beginTransaction() throws DatabaseException;

    void commit() throws DatabaseException;

    void rollback() throws DatabaseException;
}
