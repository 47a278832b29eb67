package com.appstudio.database.backfill;

import java.util.Objects;
import java.util.UUID;

/**
 * A deployment environment owned by exactly one organization.
 *
 * @param id environment id
 * @param organizationId owning organization
 * @param name display name (e.g., "production", "staging")
 * @param isDefault whether this is the organization's default environment
 */
public record AppEnvironment(UUID id, UUID organizationId, String name, boolean isDefault) {

    public AppEnvironment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(organizationId, "organizationId must not be null");
    }
}
