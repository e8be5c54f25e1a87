package com.stratum.schema;

/** How a {@link MigrationStep} moves the schema forward. */
public enum StepKind {

    /** Builds the schema from nothing directly at the latest version. */
    INSTALL,

    /** Builds the schema from nothing at a requested intermediate version. */
    INSTALL_AT_VERSION,

    /** Transforms version K-1 into version K. */
    UPGRADE
}
