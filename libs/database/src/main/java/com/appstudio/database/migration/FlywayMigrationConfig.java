package com.appstudio.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the AppStudio database.
 *
 * <p>Builds a dedicated Flyway instance that runs the SQL migrations from {@link
 * FlywayConfigProperties#locations()} plus the Java migrations registered here, and migrates on
 * bean initialization. Each migration runs in its own transaction, which is the rollback
 * boundary of the current-environment backfill.
 *
 * <h2>Excluding Spring Boot Auto-Configuration</h2>
 *
 * <p>Applications using this module should exclude {@link FlywayAutoConfiguration} so the
 * schema is not migrated twice:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = FlywayAutoConfiguration.class)
 * }</pre>
 *
 * @see FlywayConfigProperties
 * @see V3__BackfillCurrentEnvironmentId
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "appstudio.flyway", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    /** Bean name for the AppStudio Flyway instance. */
    public static final String APPSTUDIO_FLYWAY_BEAN = "appstudioFlyway";

    @Bean(name = APPSTUDIO_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway appstudioFlyway(FlywayConfigProperties properties) {
        return createFlyway(properties);
    }

    /**
     * Creates a configured Flyway instance.
     *
     * <p>Java migrations live outside the SQL locations and are registered explicitly so they
     * can receive configuration.
     */
    static Flyway createFlyway(FlywayConfigProperties properties) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .javaMigrations(new V3__BackfillCurrentEnvironmentId(properties.backfillScope()))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
