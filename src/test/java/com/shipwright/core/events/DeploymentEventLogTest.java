package com.shipwright.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentEventLogTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    @Test
    @DisplayName("appends one JSON line per published event")
    void appendsJsonLines() throws Exception {
        Path file = dir.resolve("logs/deployment_events.jsonl");
        var eventLog = new DeploymentEventLog(bus, mapper, file);
        eventLog.start();

        bus.publish(new DeploymentEvent(DeploymentEvent.ATTEMPT_STARTED, "deploy_staging_1", "staging", null,
                Map.of("mode", "DEPLOY"), Instant.parse("2025-11-14T10:00:00Z")));
        bus.publish(new DeploymentEvent(DeploymentEvent.STAGE_FAILED, "deploy_staging_1", "staging",
                "SMOKE_TESTING", Map.of("message", "batch"), Instant.parse("2025-11-14T10:01:00Z")));

        var lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        var first = mapper.readTree(lines.get(0));
        assertEquals("attempt.started", first.get("eventType").asText());
        assertEquals("2025-11-14T10:00:00Z", first.get("timestamp").asText());
        assertEquals("SMOKE_TESTING", mapper.readTree(lines.get(1)).get("stage").asText());
    }

    @Test
    @DisplayName("stops writing after stop")
    void stop() throws Exception {
        Path file = dir.resolve("events.jsonl");
        var eventLog = new DeploymentEventLog(bus, mapper, file);
        eventLog.start();
        bus.publish(new DeploymentEvent("a", "x", "staging", null, Map.of(), Instant.now()));
        eventLog.stop();
        bus.publish(new DeploymentEvent("b", "x", "staging", null, Map.of(), Instant.now()));

        assertEquals(1, Files.readAllLines(file).size());
    }

    @Test
    @DisplayName("a write failure never reaches the publisher")
    void writeFailure() throws Exception {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
        var eventLog = new DeploymentEventLog(bus, mapper, blocker.resolve("events.jsonl"));
        eventLog.start();

        assertDoesNotThrow(() -> bus.publish(new DeploymentEvent("a", "x", "staging", null, Map.of(), Instant.now())));
    }
}
