package com.stratum.schema;

/**
 * Raised by every {@link DatabaseCapability} operation the database rejects.
 *
 * <p>The message is the database's own error text. {@link #sqlState()} is populated when the
 * underlying driver reports one (JDBC), and is {@code null} otherwise.
 */
public class DatabaseException extends Exception {

    private final String sqlState;

    public DatabaseException(String message) {
        this(message, null, null);
    }

    public DatabaseException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    public String sqlState() {
        return sqlState;
    }
}
