package com.shipwright.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipwright.config.ShipwrightProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends every published {@link DeploymentEvent} as one JSON line to the event log file.
 * Write failures are logged and dropped; they never reach the pipeline.
 */
@Component
public class DeploymentEventLog {

    private static final Logger log = LoggerFactory.getLogger(DeploymentEventLog.class);

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final Path logFile;
    private EventBus.Subscription subscription;

    @Autowired
    public DeploymentEventLog(EventBus eventBus, ObjectMapper objectMapper, ShipwrightProperties properties) {
        this(eventBus, objectMapper, Path.of(properties.getProjectRoot()).resolve(properties.getEventLog()));
    }

    DeploymentEventLog(EventBus eventBus, ObjectMapper objectMapper, Path logFile) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.logFile = logFile;
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribeAll(this::append);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    public Path logFile() {
        return logFile;
    }

    synchronized void append(DeploymentEvent event) {
        try {
            if (logFile.getParent() != null) {
                Files.createDirectories(logFile.getParent());
            }
            String line = objectMapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to append event {} to {}: {}", event.eventType(), logFile, e.getMessage());
        }
    }
}
