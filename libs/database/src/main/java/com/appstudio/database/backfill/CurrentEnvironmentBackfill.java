package com.appstudio.database.backfill;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Populates {@code app_versions.current_environment_id} with the default environment of the
 * owning organization.
 *
 * <p>The run has two phases:
 *
 * <ol>
 *   <li><b>Plan</b>: load every organization with its environments and resolve each default
 *       environment into an {@link OrganizationPass}. A missing default aborts the run here,
 *       before anything is written.
 *   <li><b>Apply</b>: for each pass, in ascending organization id, load the in-scope apps and
 *       versions and write the environment reference as one awaited batch.
 * </ol>
 *
 * <p>Not thread-safe and not resumable. Failures propagate unchanged; the enclosing migration
 * transaction discards every write of a failed run.
 */
public class CurrentEnvironmentBackfill {

    private static final Logger log = LoggerFactory.getLogger(CurrentEnvironmentBackfill.class);

    private final EnvironmentBackfillStore store;
    private final DefaultEnvironmentResolver resolver;
    private final BackfillScope scope;

    public CurrentEnvironmentBackfill(EnvironmentBackfillStore store, BackfillScope scope) {
        this(store, new DefaultEnvironmentResolver(), scope);
    }

    public CurrentEnvironmentBackfill(
            EnvironmentBackfillStore store,
            DefaultEnvironmentResolver resolver,
            BackfillScope scope) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /**
     * Runs the backfill.
     *
     * @return per-organization results
     * @throws NoDefaultEnvironmentException if any organization lacks a default environment
     * @throws VersionWriteException if an update fails
     */
    public BackfillSummary run() {
        List<OrganizationPass> passes = plan();
        log.info(
                "Backfilling current environment for {} organizations (scope {})",
                passes.size(),
                scope);

        List<BackfillSummary.PassResult> results = new ArrayList<>(passes.size());
        for (OrganizationPass pass : passes) {
            results.add(apply(pass));
        }

        BackfillSummary summary = new BackfillSummary(scope, results);
        log.info(
                "Backfill complete: {} organizations, {} versions updated, {} unchanged",
                summary.organizationsProcessed(),
                summary.versionsUpdated(),
                summary.versionsUnchanged());
        return summary;
    }

    /** Resolves the default environment of every organization, ascending organization id. */
    List<OrganizationPass> plan() {
        List<OrganizationPass> passes = new ArrayList<>();
        for (Organization organization : store.findOrganizationsWithEnvironments()) {
            AppEnvironment environment = resolver.resolve(organization);
            passes.add(new OrganizationPass(organization.id(), environment));
        }
        return passes;
    }

    BackfillSummary.PassResult apply(OrganizationPass pass) {
        UUID environmentId = pass.environmentId();
        UUID appOwner = scope == BackfillScope.PER_ORGANIZATION ? pass.organizationId() : null;

        List<UUID> pending = new ArrayList<>();
        int unchanged = 0;
        for (App app : store.findAppsWithVersions(appOwner)) {
            for (AppVersion version : app.appVersions()) {
                if (version.pointsAt(environmentId)) {
                    log.info(
                            "App version {} already on environment {}",
                            version.id(),
                            environmentId);
                    unchanged++;
                    continue;
                }
                log.info("Updating app version => {}", version.id());
                pending.add(version.id());
            }
        }

        int updated =
                pending.isEmpty() ? 0 : store.updateCurrentEnvironment(environmentId, pending);
        log.info(
                "Organization {}: {} versions set to environment {}, {} already current",
                pass.organizationId(),
                updated,
                environmentId,
                unchanged);
        return new BackfillSummary.PassResult(
                pass.organizationId(), environmentId, updated, unchanged);
    }
}
