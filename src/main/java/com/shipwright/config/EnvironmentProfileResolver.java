package com.shipwright.config;

import com.shipwright.core.exception.UnknownEnvironmentException;
import com.shipwright.core.model.EnvironmentProfile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Turns the configured environment settings into an immutable
 * {@link EnvironmentProfile} for one attempt.
 */
@Component
public class EnvironmentProfileResolver {

    private final ShipwrightProperties properties;

    public EnvironmentProfileResolver(ShipwrightProperties properties) {
        this.properties = properties;
    }

    /**
     * @param environment environment name
     * @param now         attempt start time; stamps the artifact tag
     * @throws UnknownEnvironmentException if no profile is configured for the name
     */
    public EnvironmentProfile resolve(String environment, Instant now) {
        var env = environment != null ? properties.getEnvironments().get(environment) : null;
        if (env == null) {
            throw new UnknownEnvironmentException(environment, properties.getEnvironments().keySet());
        }

        String tagPrefix = env.getTagPrefix().isBlank() ? environment : env.getTagPrefix();
        String artifactTag = properties.getImage() + ":" + tagPrefix + "-" + now.getEpochSecond();
        String containerName = env.getContainerName().isBlank()
                ? properties.getImage() + "-" + environment
                : env.getContainerName();
        String baseUrl = env.getBaseUrl().isBlank()
                ? "http://localhost:" + env.getPort()
                : stripTrailingSlash(env.getBaseUrl());

        return new EnvironmentProfile(
                environment,
                env.getPort(),
                env.getContainerPort(),
                env.getWorkers(),
                artifactTag,
                containerName,
                Duration.ofSeconds(env.getMonitorWindowSeconds()),
                Duration.ofSeconds(env.getMonitorIntervalSeconds()),
                env.getRollbackThreshold(),
                Duration.ofSeconds(env.getStartupGraceSeconds()),
                baseUrl
        );
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
