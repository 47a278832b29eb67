package com.appstudio.database.backfill;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a completed backfill run.
 *
 * @param scope scope the run used
 * @param passes per-organization results, in processing order
 */
public record BackfillSummary(BackfillScope scope, List<PassResult> passes) {

    /**
     * Result of one organization pass.
     *
     * @param organizationId organization processed
     * @param environmentId default environment written
     * @param versionsUpdated versions whose reference was written
     * @param versionsUnchanged versions that already referenced the environment
     */
    public record PassResult(
            UUID organizationId, UUID environmentId, int versionsUpdated, int versionsUnchanged) {}

    public BackfillSummary {
        passes = List.copyOf(passes);
    }

    public int organizationsProcessed() {
        return passes.size();
    }

    public int versionsUpdated() {
        return passes.stream().mapToInt(PassResult::versionsUpdated).sum();
    }

    public int versionsUnchanged() {
        return passes.stream().mapToInt(PassResult::versionsUnchanged).sum();
    }
}
