package com.appstudio.database.backfill;

import java.util.UUID;

/**
 * Thrown when the store rejects or does not acknowledge an app version update.
 * Not retried; re-running is the job of whoever re-runs the migration.
 */
public class VersionWriteException extends BackfillException {

    private final UUID environmentId;
    private final UUID versionId;

    public VersionWriteException(UUID environmentId, UUID versionId, String reason) {
        super(message(environmentId, versionId, reason));
        this.environmentId = environmentId;
        this.versionId = versionId;
    }

    public VersionWriteException(UUID environmentId, UUID versionId, Throwable cause) {
        super(message(environmentId, versionId, cause.getMessage()), cause);
        this.environmentId = environmentId;
        this.versionId = versionId;
    }

    public UUID environmentId() {
        return environmentId;
    }

    /** The version whose update failed, or null when the store could not tell which one. */
    public UUID versionId() {
        return versionId;
    }

    private static String message(UUID environmentId, UUID versionId, String reason) {
        String target = versionId == null ? "app versions" : "app version '" + versionId + "'";
        return "Failed to set current environment '%s' on %s: %s"
                .formatted(environmentId, target, reason);
    }
}
