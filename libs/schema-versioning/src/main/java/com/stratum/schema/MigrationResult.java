package com.stratum.schema;

/**
 * Outcome of one {@link MigrationEngine#migrate} call.
 *
 * @param status outcome class
 * @param message human-readable summary; on failure it embeds the cause
 * <p>When the stored version could not be read, both versions are {@link #UNKNOWN_VERSION}, so
 * the failure can't be mistaken for one on a virgin database (version 0); see
 * {@link #versionKnown()}.
 *
 * @param status outcome class
 * @param message human-readable summary; on failure it embeds the cause
 * @param achievedVersion last committed version; the latest version on success
 * @param fromVersion version the database held when the run started
 */
public record MigrationResult(
        MigrationStatus status, String message, int achievedVersion, int fromVersion) {

    /** Version reported when the database's current version could not be determined. */
    public static final int UNKNOWN_VERSION = -1;

    public MigrationResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static MigrationResult success(int fromVersion, int latestVersion) {
        String message = fromVersion == latestVersion
                ? "OK (already at version %d)".formatted(latestVersion)
                : "OK (upgraded from version %d to %d)".formatted(fromVersion, latestVersion);
        return new MigrationResult(MigrationStatus.SUCCESS, message, latestVersion, fromVersion);
    }

    public static MigrationResult specError(int fromVersion, int achievedVersion, String cause) {
        return new MigrationResult(
                MigrationStatus.SPEC_ERROR,
                failureMessage(fromVersion, "Error in spec: " + cause),
                achievedVersion,
                fromVersion);
    }

    public static MigrationResult executionError(
            int fromVersion, int achievedVersion, String cause) {
        return new MigrationResult(
                MigrationStatus.EXECUTION_ERROR,
                failureMessage(fromVersion, cause),
                achievedVersion,
                fromVersion);
    }

    /** Execution error for a run that could not determine the database's current version. */
    public static MigrationResult unreadableVersion(String cause) {
        return new MigrationResult(
                MigrationStatus.EXECUTION_ERROR,
                "Can't upgrade schema (current version unknown): " + cause,
                UNKNOWN_VERSION,
                UNKNOWN_VERSION);
    }

    public int statusCode() {
        return status.code();
    }

    public boolean isSuccess() {
        return status == MigrationStatus.SUCCESS;
    }

    /** False when the run failed before the database's current version was read. */
    public boolean versionKnown() {
        return achievedVersion != UNKNOWN_VERSION;
    }

    private static String failureMessage(int fromVersion, String cause) {
        return "Can't upgrade schema (from version %d): %s".formatted(fromVersion, cause);
    }
}
