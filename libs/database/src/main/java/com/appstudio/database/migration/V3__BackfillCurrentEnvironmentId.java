package com.appstudio.database.migration;

import com.appstudio.database.backfill.BackfillScope;
import com.appstudio.database.backfill.BackfillSummary;
import com.appstudio.database.backfill.CurrentEnvironmentBackfill;
import com.appstudio.database.backfill.JdbcEnvironmentBackfillStore;
import java.util.Objects;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Sets {@code app_versions.current_environment_id} on every existing version to the default
 * environment of the organization that owns the version's app.
 *
 * <p>Runs after {@code V2__add_current_environment_id_to_app_versions.sql} on the connection
 * and transaction Flyway opens for this migration. Any failure rolls the whole backfill back.
 */
public class V3__BackfillCurrentEnvironmentId extends BaseJavaMigration {

    private static final Logger log =
            LoggerFactory.getLogger(V3__BackfillCurrentEnvironmentId.class);

    private final BackfillScope scope;

    public V3__BackfillCurrentEnvironmentId() {
        this(BackfillScope.PER_ORGANIZATION);
    }

    public V3__BackfillCurrentEnvironmentId(BackfillScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    public BackfillScope scope() {
        return scope;
    }

    @Override
    public void migrate(Context context) throws Exception {
        log.info("Running migration: {}", getClass().getSimpleName());

        // Suppress close so Flyway keeps control of the connection and its transaction.
        JdbcTemplate jdbcTemplate =
                new JdbcTemplate(new SingleConnectionDataSource(context.getConnection(), true));
        CurrentEnvironmentBackfill backfill =
                new CurrentEnvironmentBackfill(
                        new JdbcEnvironmentBackfillStore(jdbcTemplate), scope);
        BackfillSummary summary = backfill.run();
        log.info(
                "Migration {} set current environment on {} app versions",
                getClass().getSimpleName(),
                summary.versionsUpdated());
    }

    /**
     * Reverse direction: intentionally does nothing. The previous schema held no explicit
     * environment reference, so there is nothing to restore.
     */
    public void rollback(Context context) {
        log.info("Rollback of {} is a no-op", getClass().getSimpleName());
    }
}
