/**
 * Database schema and data migrations for AppStudio.
 *
 * <p>Schema changes are versioned Flyway SQL files under {@code db/migration/appstudio}; data
 * changes that need per-row logic are Java migrations in {@link
 * com.appstudio.database.migration}, backed by the code in {@link
 * com.appstudio.database.backfill}.
 *
 * <h2>Migration Chain</h2>
 *
 * <ul>
 *   <li>{@code V1__initial_schema.sql}: organizations, environments, apps, app versions
 *   <li>{@code V2__add_current_environment_id_to_app_versions.sql}: explicit environment
 *       reference on app versions
 *   <li>{@code V3__BackfillCurrentEnvironmentId}: populates that reference
 * </ul>
 *
 * @see com.appstudio.database.migration.FlywayMigrationConfig
 */
package com.appstudio.database;
