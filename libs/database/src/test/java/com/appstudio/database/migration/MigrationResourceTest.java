package com.appstudio.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests that the SQL migration files are on the classpath where Flyway looks for them. A
 * packaging mistake here would otherwise only surface at deployment time.
 */
@DisplayName("Migration SQL Resource Verification")
class MigrationResourceTest {

    private static final String ROOT = "db/migration/appstudio/";

    @Test
    @DisplayName("V1__initial_schema.sql creates the four backfill tables")
    void initialSchema() throws IOException {
        String sql = readClasspathResource(ROOT + "V1__initial_schema.sql");

        assertThat(sql)
                .containsIgnoringCase("CREATE TABLE organizations")
                .containsIgnoringCase("CREATE TABLE app_environments")
                .containsIgnoringCase("is_default")
                .containsIgnoringCase("CREATE TABLE apps")
                .containsIgnoringCase("CREATE TABLE app_versions");
    }

    @Test
    @DisplayName("V2 adds current_environment_id with a foreign key to app_environments")
    void currentEnvironmentColumn() throws IOException {
        String sql =
                readClasspathResource(
                        ROOT + "V2__add_current_environment_id_to_app_versions.sql");

        assertThat(sql)
                .containsIgnoringCase("ADD COLUMN current_environment_id")
                .containsIgnoringCase("REFERENCES app_environments (id)");
    }

    // ── Helpers ──

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
