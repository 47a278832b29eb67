package com.appstudio.database.backfill;

import static com.appstudio.database.TestDatabase.uuid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.appstudio.database.TestDatabase;
import java.sql.BatchUpdateException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests {@link JdbcEnvironmentBackfillStore} against H2 migrated up to the new column. */
@DisplayName("JdbcEnvironmentBackfillStore")
class JdbcEnvironmentBackfillStoreTest {

    private static final UUID O1 = uuid("1001");
    private static final UUID O2 = uuid("1002");
    private static final UUID O3 = uuid("1003");
    private static final UUID E1 = uuid("e1");
    private static final UUID E2 = uuid("e2");
    private static final UUID E3 = uuid("e3");
    private static final UUID A1 = uuid("a1");
    private static final UUID A2 = uuid("a2");
    private static final UUID A3 = uuid("a3");
    private static final UUID V1 = uuid("b1");
    private static final UUID V2 = uuid("b2");
    private static final UUID V3 = uuid("b3");

    private TestDatabase db;
    private JdbcEnvironmentBackfillStore store;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create().migrateSchemaOnly();
        // Inserted out of id order on purpose.
        db.organization(O2)
                .organization(O1)
                .organization(O3)
                .environment(E2, O1, "staging", false)
                .environment(E1, O1, "production", true)
                .environment(E3, O2, "production", true)
                .app(A2, O2)
                .app(A1, O1)
                .app(A3, O1)
                .version(V2, A1)
                .version(V1, A1)
                .version(V3, A2);
        store = new JdbcEnvironmentBackfillStore(db.jdbcTemplate());
    }

    @Nested
    @DisplayName("findOrganizationsWithEnvironments")
    class FindOrganizations {

        @Test
        @DisplayName("returns every organization in ascending id with its environments")
        void loadsOrganizations() {
            var organizations = store.findOrganizationsWithEnvironments();

            assertThat(organizations).extracting(Organization::id).containsExactly(O1, O2, O3);
            assertThat(organizations.get(0).appEnvironments())
                    .containsExactly(
                            new AppEnvironment(E1, O1, "production", true),
                            new AppEnvironment(E2, O1, "staging", false));
            assertThat(organizations.get(1).appEnvironments())
                    .containsExactly(new AppEnvironment(E3, O2, "production", true));
        }

        @Test
        @DisplayName("includes organizations without environments")
        void includesEmptyOrganizations() {
            var organizations = store.findOrganizationsWithEnvironments();

            assertThat(organizations.get(2).id()).isEqualTo(O3);
            assertThat(organizations.get(2).appEnvironments()).isEmpty();
        }
    }

    @Nested
    @DisplayName("findAppsWithVersions")
    class FindApps {

        @Test
        @DisplayName("scoped load returns only the organization's apps")
        void scopedToOrganization() {
            var apps = store.findAppsWithVersions(O1);

            assertThat(apps).extracting(App::id).containsExactly(A1, A3);
            assertThat(apps).extracting(App::organizationId).containsOnly(O1);
            assertThat(apps.get(0).appVersions())
                    .containsExactly(new AppVersion(V1, A1, null), new AppVersion(V2, A1, null));
            assertThat(apps.get(1).appVersions()).isEmpty();
        }

        @Test
        @DisplayName("null organization loads every app in the system")
        void unscoped() {
            var apps = store.findAppsWithVersions(null);

            assertThat(apps).extracting(App::id).containsExactly(A1, A2, A3);
        }

        @Test
        @DisplayName("reads the current environment reference")
        void readsCurrentEnvironment() {
            db.jdbcTemplate()
                    .update(
                            "UPDATE app_versions SET current_environment_id = ? WHERE id = ?",
                            E3,
                            V3);

            var apps = store.findAppsWithVersions(O2);

            assertThat(apps.get(0).appVersions()).containsExactly(new AppVersion(V3, A2, E3));
        }
    }

    @Nested
    @DisplayName("updateCurrentEnvironment")
    class Update {

        @Test
        @DisplayName("sets the reference on the given versions only")
        void updatesGivenVersions() {
            int updated = store.updateCurrentEnvironment(E1, List.of(V1, V2));

            assertThat(updated).isEqualTo(2);
            assertThat(db.currentEnvironmentOf(V1)).isEqualTo(E1);
            assertThat(db.currentEnvironmentOf(V2)).isEqualTo(E1);
            assertThat(db.currentEnvironmentOf(V3)).isNull();
        }

        @Test
        @DisplayName("returns zero for an empty list")
        void emptyList() {
            assertThat(store.updateCurrentEnvironment(E1, List.of())).isZero();
        }

        @Test
        @DisplayName("writes across several JDBC batches")
        void multipleBatches() {
            List<UUID> versionIds = new ArrayList<>();
            for (int i = 0; i < JdbcEnvironmentBackfillStore.BATCH_SIZE * 2 + 1; i++) {
                UUID versionId = UUID.randomUUID();
                db.version(versionId, A3);
                versionIds.add(versionId);
            }

            int updated = store.updateCurrentEnvironment(E1, versionIds);

            assertThat(updated).isEqualTo(versionIds.size());
            assertThat(db.currentEnvironmentOf(versionIds.get(versionIds.size() - 1)))
                    .isEqualTo(E1);
        }

        @Test
        @DisplayName("missing version row fails with VersionWriteException")
        void missingRow() {
            UUID ghost = uuid("dead");

            assertThatThrownBy(() -> store.updateCurrentEnvironment(E1, List.of(V1, ghost)))
                    .isInstanceOf(VersionWriteException.class)
                    .hasMessageContaining(ghost.toString())
                    .extracting(e -> ((VersionWriteException) e).versionId())
                    .isEqualTo(ghost);
        }

        @Test
        @DisplayName("constraint violation names the rejected version and keeps its cause")
        void constraintViolation() {
            UUID unknownEnvironment = uuid("ee99");

            assertThatThrownBy(
                            () ->
                                    store.updateCurrentEnvironment(
                                            unknownEnvironment, List.of(V2, V1)))
                    .isInstanceOf(VersionWriteException.class)
                    .hasCauseInstanceOf(BatchUpdateException.class)
                    .hasMessageContaining(V2.toString())
                    .extracting(e -> ((VersionWriteException) e).versionId())
                    .isEqualTo(V2);
            assertThat(db.currentEnvironmentOf(V1)).isNull();
        }
    }

    @Nested
    @DisplayName("failedIndex")
    class FailedIndex {

        @Test
        @DisplayName("finds the statement marked EXECUTE_FAILED")
        void executeFailedMarker() {
            int[] counts = {1, Statement.EXECUTE_FAILED, Statement.EXECUTE_FAILED};

            assertThat(JdbcEnvironmentBackfillStore.failedIndex(counts, 3)).isEqualTo(1);
        }

        @Test
        @DisplayName("points past the last count when the driver stopped early")
        void stoppedEarly() {
            assertThat(JdbcEnvironmentBackfillStore.failedIndex(new int[] {1, 1}, 5)).isEqualTo(2);
        }

        @Test
        @DisplayName("returns -1 when the counts do not identify a row")
        void unknown() {
            assertThat(JdbcEnvironmentBackfillStore.failedIndex(new int[] {1, 1}, 2)).isEqualTo(-1);
            assertThat(JdbcEnvironmentBackfillStore.failedIndex(null, 2)).isEqualTo(-1);
        }
    }
}
