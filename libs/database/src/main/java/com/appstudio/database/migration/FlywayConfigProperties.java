package com.appstudio.database.migration;

import com.appstudio.database.backfill.BackfillScope;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the AppStudio database.
 *
 * <p>Bound from {@code application.yml} and validated at startup, so a missing URL fails the
 * application before any migration runs.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * appstudio:
 *   flyway:
 *     url: jdbc:postgresql://localhost:5432/appstudio
 *     username: appstudio
 *     password: appstudio_dev_password
 *     locations: classpath:db/migration/appstudio
 *     enabled: true
 *     backfill-scope: per_organization
 * }</pre>
 *
 * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/appstudio})
 * @param username Database username
 * @param password Database password
 * @param locations Flyway SQL migration locations (default {@link #DEFAULT_LOCATIONS})
 * @param enabled Whether to run migrations on startup
 * @param backfillScope Which app versions each organization pass of the current-environment
 *     backfill writes to (default {@link BackfillScope#PER_ORGANIZATION})
 */
@Validated
@ConfigurationProperties(prefix = "appstudio.flyway")
public record FlywayConfigProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        boolean enabled,
        BackfillScope backfillScope) {

    /** Location of the versioned SQL migrations shipped with this module. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/appstudio";

    /** Compact constructor, applies defaults before Bean Validation runs. */
    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (backfillScope == null) {
            backfillScope = BackfillScope.PER_ORGANIZATION;
        }
    }
}
