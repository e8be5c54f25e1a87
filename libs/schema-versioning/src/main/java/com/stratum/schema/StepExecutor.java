package com.stratum.schema;

/**
 * Applies one {@link MigrationStep} inside a single transaction.
 *
 * <p>Order within the transaction: create the bookkeeping table and its initial row (virgin
 * database only), run the step's statements, record the target version, commit. The first
 * failure stops the step and rolls the whole transaction back, so the database keeps the version
 * it held before the step. How much DDL a rollback undoes depends on the database: engines without
 * transactional DDL may keep objects created before the failing statement.
 */
public final class StepExecutor {

    /**
     * Applies the step.
     *
     * @throws MigrationExecutionException tagged with the step's target version, carrying the
     *     database's own error text
     */
    public void applyStep(DatabaseCapability capability, MigrationStep step)
            throws MigrationExecutionException {
        int target = step.targetVersion();
        try {
            capability.beginTransaction();
        } catch (DatabaseException e) {
            throw failure(target, "can't begin transaction: " + e.getMessage(), e);
        }

        try {
            if (step.createBookkeepingTable()) {
                capability.execute(BookkeepingTable.CREATE_TABLE_SQL);
                capability.execute(BookkeepingTable.INSERT_INITIAL_ROW_SQL);
            }
            for (String statement : step.statements()) {
                capability.execute(statement);
            }
            capability.execute(BookkeepingTable.updateVersionSql(target));
            capability.commit();
        } catch (DatabaseException e) {
            MigrationExecutionException failure = failure(target, e.getMessage(), e);
            try {
                capability.rollback();
            } catch (DatabaseException rollbackError) {
                failure.addSuppressed(rollbackError);
            }
            throw failure;
        }
    }

    private static MigrationExecutionException failure(
            int target, String detail, DatabaseException cause) {
        return new MigrationExecutionException(
                target, "Can't upgrade to version %d: %s".formatted(target, detail), cause);
    }
}
