package com.appstudio.database.backfill;

import java.sql.BatchUpdateException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;

/**
 * {@link EnvironmentBackfillStore} over plain SQL with Spring's {@link JdbcTemplate}.
 *
 * <p>Uses table and column names directly instead of any entity mapping, so the class keeps
 * working against the schema as it stood when the backfill migration was written.
 */
public class JdbcEnvironmentBackfillStore implements EnvironmentBackfillStore {

    /** Rows per JDBC batch when writing version references. */
    static final int BATCH_SIZE = 500;

    private static final String SELECT_ORGANIZATIONS =
            """
            SELECT o.id AS organization_id,
                   e.id AS environment_id,
                   e.name AS environment_name,
                   e.is_default
            FROM organizations o
            LEFT JOIN app_environments e ON e.organization_id = o.id
            ORDER BY o.id, e.id
            """;

    private static final String SELECT_APPS =
            """
            SELECT a.id AS app_id,
                   a.organization_id,
                   v.id AS version_id,
                   v.current_environment_id
            FROM apps a
            LEFT JOIN app_versions v ON v.app_id = a.id
            """;

    private static final String UPDATE_VERSION =
            "UPDATE app_versions SET current_environment_id = ? WHERE id = ?";

    private static final Comparator<UUID> UUID_ORDER = Comparator.comparing(UUID::toString);

    private final JdbcTemplate jdbcTemplate;

    public JdbcEnvironmentBackfillStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    }

    @Override
    public List<Organization> findOrganizationsWithEnvironments() {
        Map<UUID, List<AppEnvironment>> environmentsByOrganization = new LinkedHashMap<>();
        jdbcTemplate.query(
                SELECT_ORGANIZATIONS,
                rs -> {
                    UUID organizationId = uuid(rs, "organization_id");
                    List<AppEnvironment> environments =
                            environmentsByOrganization.computeIfAbsent(
                                    organizationId, id -> new ArrayList<>());
                    UUID environmentId = uuid(rs, "environment_id");
                    if (environmentId != null) {
                        environments.add(
                                new AppEnvironment(
                                        environmentId,
                                        organizationId,
                                        rs.getString("environment_name"),
                                        rs.getBoolean("is_default")));
                    }
                });

        return environmentsByOrganization.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(UUID_ORDER))
                .map(
                        entry -> {
                            List<AppEnvironment> environments = new ArrayList<>(entry.getValue());
                            environments.sort(Comparator.comparing(AppEnvironment::id, UUID_ORDER));
                            return new Organization(entry.getKey(), environments);
                        })
                .toList();
    }

    @Override
    public List<App> findAppsWithVersions(UUID organizationId) {
        Map<UUID, UUID> ownerByApp = new LinkedHashMap<>();
        Map<UUID, List<AppVersion>> versionsByApp = new LinkedHashMap<>();

        String sql =
                organizationId == null
                        ? SELECT_APPS + "ORDER BY a.id, v.id"
                        : SELECT_APPS + "WHERE a.organization_id = ? ORDER BY a.id, v.id";
        Object[] args = organizationId == null ? new Object[0] : new Object[] {organizationId};

        jdbcTemplate.query(
                sql,
                rs -> {
                    UUID appId = uuid(rs, "app_id");
                    ownerByApp.putIfAbsent(appId, uuid(rs, "organization_id"));
                    List<AppVersion> versions =
                            versionsByApp.computeIfAbsent(appId, id -> new ArrayList<>());
                    UUID versionId = uuid(rs, "version_id");
                    if (versionId != null) {
                        versions.add(
                                new AppVersion(
                                        versionId, appId, uuid(rs, "current_environment_id")));
                    }
                },
                args);

        return versionsByApp.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(UUID_ORDER))
                .map(
                        entry -> {
                            List<AppVersion> versions = new ArrayList<>(entry.getValue());
                            versions.sort(Comparator.comparing(AppVersion::id, UUID_ORDER));
                            UUID appId = entry.getKey();
                            return new App(appId, ownerByApp.get(appId), versions);
                        })
                .toList();
    }

    @Override
    public int updateCurrentEnvironment(UUID environmentId, List<UUID> versionIds) {
        Objects.requireNonNull(environmentId, "environmentId must not be null");
        if (versionIds.isEmpty()) {
            return 0;
        }

        try {
            return jdbcTemplate.execute(
                    UPDATE_VERSION,
                    (PreparedStatementCallback<Integer>)
                            ps -> executeBatches(ps, environmentId, versionIds));
        } catch (DataAccessException e) {
            throw new VersionWriteException(environmentId, null, e);
        }
    }

    /**
     * Runs the updates in chunks of {@link #BATCH_SIZE}. A rejected batch is reported against
     * the first version the driver marked as failed, or the first one it did not reach.
     */
    private static int executeBatches(
            PreparedStatement ps, UUID environmentId, List<UUID> versionIds) throws SQLException {
        int updated = 0;
        for (int offset = 0; offset < versionIds.size(); offset += BATCH_SIZE) {
            List<UUID> chunk =
                    versionIds.subList(offset, Math.min(offset + BATCH_SIZE, versionIds.size()));
            for (UUID versionId : chunk) {
                ps.setObject(1, environmentId);
                ps.setObject(2, versionId);
                ps.addBatch();
            }

            int[] counts;
            try {
                counts = ps.executeBatch();
            } catch (BatchUpdateException e) {
                int failed = failedIndex(e.getUpdateCounts(), chunk.size());
                UUID versionId = failed < 0 ? null : chunk.get(failed);
                throw new VersionWriteException(environmentId, versionId, e);
            }

            for (int i = 0; i < counts.length; i++) {
                if (counts[i] == 0) {
                    throw new VersionWriteException(environmentId, chunk.get(i), "row not found");
                }
                updated += counts[i] == Statement.SUCCESS_NO_INFO ? 1 : counts[i];
            }
        }
        return updated;
    }

    /** Index of the failing statement within a batch, or -1 if the counts do not say. */
    static int failedIndex(int[] counts, int batchSize) {
        if (counts == null) {
            return -1;
        }
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == Statement.EXECUTE_FAILED) {
                return i;
            }
        }
        // Drivers that stop at the first error return counts for the statements before it.
        return counts.length < batchSize ? counts.length : -1;
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }
}
