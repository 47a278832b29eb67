package com.appstudio.database.backfill;

import java.util.UUID;

/**
 * Thrown when an organization has no environment flagged as default.
 * <p>
 * Raised while planning, before any app version is written.
 */
public class NoDefaultEnvironmentException extends BackfillException {

    private final UUID organizationId;

    public NoDefaultEnvironmentException(UUID organizationId) {
        super("Organization '%s' has no default environment".formatted(organizationId));
        this.organizationId = organizationId;
    }

    public UUID organizationId() {
        return organizationId;
    }
}
