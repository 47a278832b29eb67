package com.appstudio.database.backfill;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A tenant together with its fully loaded environment set.
 *
 * @param id organization id
 * @param appEnvironments every environment of the organization, ascending id
 */
public record Organization(UUID id, List<AppEnvironment> appEnvironments) {

    public Organization {
        Objects.requireNonNull(id, "id must not be null");
        appEnvironments = appEnvironments == null ? List.of() : List.copyOf(appEnvironments);
    }
}
