/**
 * Test support for schema specs.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.stratum.schema.testing.InMemoryDatabaseCapability}: scriptable in-memory
 *       database with a call journal
 *   <li>{@link com.stratum.schema.testing.SchemaSpecVerifier}: checks that a spec's install and
 *       upgrade paths produce the same tables
 * </ul>
 */
package com.stratum.schema.testing;
