package com.shipwright.core.rollback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipwright.core.exception.SnapshotPersistenceException;
import com.shipwright.core.model.DeploymentSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStoreTest {

    @TempDir
    Path stateDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new SnapshotStore(stateDir, mapper);
    }

    private static DeploymentSnapshot snapshot(String id, String timestamp) {
        return new DeploymentSnapshot(id, Instant.parse(timestamp), "production", "vcp-ml:prod-1", "c1",
                "vcp-ml-production", 8000, 8000, null);
    }

    @Test
    @DisplayName("writes flat snake_case JSON under state_<id>.json")
    void fileFormat() throws Exception {
        store.save(snapshot("1.0.0", "2025-11-14T10:00:00Z"));

        var node = mapper.readTree(stateDir.resolve("state_1.0.0.json").toFile());
        assertEquals("1.0.0", node.get("version_id").asText());
        assertEquals("vcp-ml:prod-1", node.get("artifact_tag").asText());
        assertEquals("vcp-ml-production", node.get("container_name").asText());
        assertEquals(8000, node.get("port").asInt());
        assertTrue(node.get("data_backup_path").isNull());
        try (var files = Files.list(stateDir)) {
            assertEquals(1, files.count(), "no temp files left behind");
        }
    }

    @Test
    @DisplayName("find reads back what save wrote")
    void find() {
        var saved = snapshot("1.0.0", "2025-11-14T10:00:00Z");
        store.save(saved);

        assertEquals(saved, store.find("1.0.0").orElseThrow());
        assertTrue(store.find("2.0.0").isEmpty());
    }

    @Test
    @DisplayName("list is newest first and skips corrupt files")
    void listOrder() throws Exception {
        store.save(snapshot("a", "2025-11-14T09:00:00Z"));
        store.save(snapshot("b", "2025-11-14T11:00:00Z"));
        store.save(snapshot("c", "2025-11-14T10:00:00Z"));
        Files.writeString(stateDir.resolve("state_broken.json"), "{not json");

        var ids = store.list().stream().map(DeploymentSnapshot::versionId).toList();

        assertEquals(List.of("b", "c", "a"), ids);
    }

    @Test
    @DisplayName("a corrupt snapshot file is a persistence error on find")
    void corruptFind() throws Exception {
        Files.writeString(stateDir.resolve("state_broken.json"), "{not json");
        assertThrows(SnapshotPersistenceException.class, () -> store.find("broken"));
    }

    @Test
    @DisplayName("version ids that could escape the state directory are rejected")
    void invalidIds() {
        assertFalse(SnapshotStore.isValidVersionId("../etc"));
        assertFalse(SnapshotStore.isValidVersionId(""));
        assertTrue(SnapshotStore.isValidVersionId("pre-deploy_production_1731578400"));
        assertTrue(store.find("../etc").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.save(snapshot("a/b", "2025-11-14T10:00:00Z")));
    }

    @Test
    @DisplayName("an empty state directory lists nothing")
    void emptyList() {
        assertTrue(new SnapshotStore(stateDir.resolve("missing"), mapper).list().isEmpty());
    }
}
