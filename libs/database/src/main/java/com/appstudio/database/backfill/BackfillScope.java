package com.appstudio.database.backfill;

/**
 * Which app versions a single organization pass writes to.
 */
public enum BackfillScope {

    /** Only versions of apps owned by the organization being processed. */
    PER_ORGANIZATION,

    /**
     * Every version of every app, on every pass. The last organization processed (highest id)
     * wins, so all versions end up on that organization's default environment. Only meaningful
     * for single-tenant installations.
     */
    ALL_APPS
}
