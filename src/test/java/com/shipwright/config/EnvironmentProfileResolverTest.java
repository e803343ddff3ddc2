package com.shipwright.config;

import com.shipwright.core.exception.UnknownEnvironmentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentProfileResolverTest {

    private static final Instant NOW = Instant.parse("2025-11-14T10:00:00Z");

    private ShipwrightProperties properties;
    private EnvironmentProfileResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new ShipwrightProperties();
        resolver = new EnvironmentProfileResolver(properties);
    }

    @Test
    @DisplayName("production resolves to port 8000, 4 workers and a 300s window")
    void production() {
        var profile = resolver.resolve("production", NOW);

        assertEquals("production", profile.name());
        assertEquals(8000, profile.port());
        assertEquals(4, profile.workerCount());
        assertEquals("vcp-ml:prod-" + NOW.getEpochSecond(), profile.artifactTag());
        assertEquals("vcp-ml-production", profile.containerName());
        assertEquals(Duration.ofSeconds(300), profile.monitorWindow());
        assertEquals(Duration.ofSeconds(30), profile.monitorInterval());
        assertEquals(0.95, profile.rollbackThreshold());
        assertEquals("http://localhost:8000", profile.smokeBaseUrl());
    }

    @Test
    @DisplayName("staging resolves to port 8001, 2 workers and a 60s window")
    void staging() {
        var profile = resolver.resolve("staging", NOW);

        assertEquals(8001, profile.port());
        assertEquals(2, profile.workerCount());
        assertEquals("vcp-ml:staging-" + NOW.getEpochSecond(), profile.artifactTag());
        assertEquals(Duration.ofSeconds(60), profile.monitorWindow());
    }

    @Test
    @DisplayName("an unknown environment names the configured ones")
    void unknown() {
        var ex = assertThrows(UnknownEnvironmentException.class, () -> resolver.resolve("qa", NOW));
        assertTrue(ex.getMessage().contains("qa"));
        assertTrue(ex.getMessage().contains("staging"));
        assertThrows(UnknownEnvironmentException.class, () -> resolver.resolve(null, NOW));
    }

    @Test
    @DisplayName("blank settings fall back to derived names and an explicit base URL wins")
    void derivedDefaults() {
        var env = properties.getEnvironments().get("staging");
        env.setTagPrefix("");
        env.setContainerName("");
        env.setBaseUrl("http://staging.internal:8001/");

        var profile = resolver.resolve("staging", NOW);

        assertEquals("vcp-ml:staging-" + NOW.getEpochSecond(), profile.artifactTag());
        assertEquals("vcp-ml-staging", profile.containerName());
        assertEquals("http://staging.internal:8001", profile.smokeBaseUrl());
    }

    @Test
    @DisplayName("each resolution stamps its own tag")
    void tagPerAttempt() {
        var first = resolver.resolve("production", NOW);
        var second = resolver.resolve("production", NOW.plusSeconds(60));
        assertNotEquals(first.artifactTag(), second.artifactTag());
    }
}
