package com.appstudio.database.backfill;

import java.util.Objects;
import java.util.UUID;

/**
 * A version snapshot of an app.
 *
 * @param id version id
 * @param appId owning app
 * @param currentEnvironmentId environment the version currently points at, null before the
 *     backfill
 */
public record AppVersion(UUID id, UUID appId, UUID currentEnvironmentId) {

    public AppVersion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(appId, "appId must not be null");
    }

    /** Returns true if this version already references the given environment. */
    public boolean pointsAt(UUID environmentId) {
        return environmentId.equals(currentEnvironmentId);
    }
}
