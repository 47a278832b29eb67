package com.appstudio.database.backfill;

import java.util.List;
import java.util.UUID;

/**
 * Read and write access to organizations, environments, apps and app versions for the
 * backfill. Implementations run inside the caller's transaction and never commit.
 */
public interface EnvironmentBackfillStore {

    /**
     * Loads every organization with its complete environment list, ascending organization id.
     * Organizations without environments are returned with an empty list.
     */
    List<Organization> findOrganizationsWithEnvironments();

    /**
     * Loads apps with their versions, ascending app id.
     *
     * @param organizationId owning organization, or null for every app in the system
     */
    List<App> findAppsWithVersions(UUID organizationId);

    /**
     * Points every given version at the environment. Returns once all updates are
     * acknowledged.
     *
     * @param environmentId environment to reference
     * @param versionIds versions to update
     * @return number of rows updated
     * @throws VersionWriteException if the store rejects an update or a version row is missing
     */
    int updateCurrentEnvironment(UUID environmentId, List<UUID> versionIds);
}
