/**
 * Versioned database schema management for Stratum.
 *
 * <p>A {@link com.stratum.schema.SchemaSpec} describes every version of a schema as lists of SQL
 * statements. The {@link com.stratum.schema.MigrationEngine} reads the version recorded in the
 * {@code meta} table and applies one transaction per version step until the database reaches the
 * latest version. The database is reached only through
 * {@link com.stratum.schema.DatabaseCapability}, so the engine runs unchanged over JDBC
 * ({@link com.stratum.schema.jdbc}) or the in-memory fake ({@link com.stratum.schema.testing}).
 *
 * @see com.stratum.schema.MigrationEngine
 * @see com.stratum.schema.SchemaSpec
 */
package com.stratum.schema;
