/**
 * Flyway migration configuration and Java migrations.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.appstudio.database.migration.FlywayConfigProperties}: externalized
 *       configuration, including the backfill scope
 *   <li>{@link com.appstudio.database.migration.FlywayMigrationConfig}: Spring
 *       {@code @Configuration} that builds and runs the Flyway bean
 *   <li>{@link com.appstudio.database.migration.V3__BackfillCurrentEnvironmentId}: Java migration
 *       that backfills {@code app_versions.current_environment_id}
 * </ul>
 */
package com.appstudio.database.migration;
