package com.appstudio.database.backfill;

import java.util.Objects;
import java.util.UUID;

/**
 * One organization's unit of backfill work: the organization and the environment resolved
 * for it. Built once per organization during planning and never shared between passes.
 *
 * @param organizationId organization being processed
 * @param defaultEnvironment environment written onto the organization's versions
 */
public record OrganizationPass(UUID organizationId, AppEnvironment defaultEnvironment) {

    public OrganizationPass {
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        Objects.requireNonNull(defaultEnvironment, "defaultEnvironment must not be null");
        if (!organizationId.equals(defaultEnvironment.organizationId())) {
            throw new IllegalArgumentException(
                    "Environment %s does not belong to organization %s"
                            .formatted(defaultEnvironment.id(), organizationId));
        }
    }

    public UUID environmentId() {
        return defaultEnvironment.id();
    }
}
