package com.stratum.schema;

/**
 * Thrown when a {@link SchemaSpec} cannot take the database where it needs to go: no install path,
 * a missing upgrade step, a missing install-at-version script, or an unusable bootstrap version.
 *
 * <p>Spec errors are authoring mistakes. They never roll back versions that were already committed
 * and are reported with status code 400.
 */
public class SchemaSpecException extends RuntimeException {

    public SchemaSpecException(String message) {
        super(message);
    }
}
