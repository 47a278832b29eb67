package com.appstudio.database.backfill;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An application with its versions.
 *
 * @param id app id
 * @param organizationId owning organization
 * @param appVersions versions of the app, ascending id
 */
public record App(UUID id, UUID organizationId, List<AppVersion> appVersions) {

    public App {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        appVersions = appVersions == null ? List.of() : List.copyOf(appVersions);
    }
}
