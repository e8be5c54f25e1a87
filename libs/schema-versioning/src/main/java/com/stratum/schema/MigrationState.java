package com.stratum.schema;

/** States of the {@link MigrationEngine}. No state is entered twice within a run. */
enum MigrationState {
    START,
    STEPPING,
    DONE,
    FAILED
}
