package com.appstudio.database.backfill;

import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects an organization's default environment from its already loaded environment set.
 *
 * <p>Pure selection, no store access. When more than one environment is flagged default, the
 * one with the lowest id wins; ids are compared on their canonical text form, which matches
 * PostgreSQL's ordering of {@code uuid} values.
 */
public class DefaultEnvironmentResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultEnvironmentResolver.class);

    static final Comparator<AppEnvironment> BY_ID =
            Comparator.comparing(environment -> environment.id().toString());

    /**
     * Returns the default environment of the given organization.
     *
     * @param organization organization with its complete environment list
     * @return the single default environment
     * @throws NoDefaultEnvironmentException if no environment is flagged default
     */
    public AppEnvironment resolve(Organization organization) {
        List<AppEnvironment> defaults =
                organization.appEnvironments().stream()
                        .filter(AppEnvironment::isDefault)
                        .sorted(BY_ID)
                        .toList();

        if (defaults.isEmpty()) {
            throw new NoDefaultEnvironmentException(organization.id());
        }
        if (defaults.size() > 1) {
            log.warn(
                    "Organization {} has {} default environments, using {}",
                    organization.id(),
                    defaults.size(),
                    defaults.get(0).id());
        }
        return defaults.get(0);
    }
}
