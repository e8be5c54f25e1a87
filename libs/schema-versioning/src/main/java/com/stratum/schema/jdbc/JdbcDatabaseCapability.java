package com.stratum.schema.jdbc;

import com.stratum.schema.DatabaseCapability;
import com.stratum.schema.DatabaseException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DatabaseCapability} over a JDBC {@link Connection}.
 *
 * <p>The connection is borrowed, not owned: it is never closed here, and the caller must not use
 * it elsewhere while a migration runs. A transaction switches auto-commit off and restores the
 * previous auto-commit mode after commit or rollback.
 *
 * <p>Tables and columns are looked up in the connection's current catalog and schema through
 * {@link DatabaseMetaData}, so the lookup works the same on databases that fold unquoted names to
 * upper case (H2) and to lower case (PostgreSQL).
 */
public class JdbcDatabaseCapability implements DatabaseCapability {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseCapability.class);

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    private final Connection connection;
    private Boolean autoCommitBeforeTransaction;

    public JdbcDatabaseCapability(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public Set<String> listTables(String nameFilter) throws DatabaseException {
        Set<String> tables = new TreeSet<>();
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getTables(
                    connection.getCatalog(), connection.getSchema(), "%", TABLE_TYPES)) {
                while (rs.next()) {
                    String name = rs.getString("TABLE_NAME");
                    if (nameFilter == null || name.equalsIgnoreCase(nameFilter)) {
                        tables.add(name.toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (SQLException e) {
            throw translate(e);
        }
        return tables;
    }

    @Override
    public Set<String> listColumns(String table) throws DatabaseException {
        Objects.requireNonNull(table, "table");
        Set<String> columns = new TreeSet<>();
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getColumns(
                    connection.getCatalog(), connection.getSchema(), "%", "%")) {
                while (rs.next()) {
                    if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                        columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (SQLException e) {
            throw translate(e);
        }
        return columns;
    }

    @Override
    public Optional<String> queryScalar(String sql) throws DatabaseException {
        log.debug("Querying: {}", sql);
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(sql)) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.ofNullable(rs.getString(1));
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    @Override
    public void execute(String sql) throws DatabaseException {
        log.debug("Executing: {}", sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    @Override
    public void beginTransaction() throws DatabaseException {
        if (autoCommitBeforeTransaction != null) {
            throw new DatabaseException("A transaction is already in progress");
        }
        try {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            autoCommitBeforeTransaction = autoCommit;
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    @Override
    public void commit() throws DatabaseException {
        requireTransaction();
        try {
            connection.commit();
        } catch (SQLException e) {
            // the transaction stays open so the caller can still roll it back
            throw translate(e);
        }
        endTransaction();
    }

    @Override
    public void rollback() throws DatabaseException {
        requireTransaction();
        try {
            connection.rollback();
        } catch (SQLException e) {
            DatabaseException failure = translate(e);
            try {
                endTransaction();
            } catch (DatabaseException restoreError) {
                failure.addSuppressed(restoreError);
            }
            throw failure;
        }
        endTransaction();
    }

    private void requireTransaction() throws DatabaseException {
        if (autoCommitBeforeTransaction == null) {
            throw new DatabaseException("No transaction in progress");
        }
    }

    private void endTransaction() throws DatabaseException {
        boolean restore = autoCommitBeforeTransaction;
        autoCommitBeforeTransaction = null;
        try {
            connection.setAutoCommit(restore);
        } catch (SQLException e) {
            throw translate(e);
        }
    }

    private static DatabaseException translate(SQLException e) {
        return new DatabaseException(e.getMessage(), e.getSQLState(), e);
    }
}
