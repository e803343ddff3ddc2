package com.shipwright.core.rollback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shipwright.core.exception.SnapshotPersistenceException;
import com.shipwright.core.model.DeploymentSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File-backed snapshot persistence: one flat JSON object per version in
 * {@code <stateDir>/state_<versionId>.json}. Writes go to a temp file that is
 * fsynced and then moved into place, so a reader never sees a partial snapshot.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private static final Pattern VERSION_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String PREFIX = "state_";
    private static final String SUFFIX = ".json";

    private final Path stateDir;
    private final ObjectMapper objectMapper;

    public SnapshotStore(Path stateDir, ObjectMapper objectMapper) {
        this.stateDir = stateDir;
        this.objectMapper = objectMapper;
    }

    public static boolean isValidVersionId(String versionId) {
        return versionId != null && VERSION_ID.matcher(versionId).matches();
    }

    public Path stateDir() {
        return stateDir;
    }

    /**
     * @throws SnapshotPersistenceException if the snapshot cannot be durably written
     */
    public void save(DeploymentSnapshot snapshot) {
        requireValid(snapshot.versionId());
        Path target = fileFor(snapshot.versionId());
        try {
            Files.createDirectories(stateDir);
            Path tmp = Files.createTempFile(stateDir, PREFIX + snapshot.versionId(), ".tmp");
            try {
                byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toJson(snapshot));
                try (var channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    channel.write(ByteBuffer.wrap(json));
                    channel.force(true);
                }
                move(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.info("Saved snapshot {} to {}", snapshot.versionId(), target);
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to save snapshot " + snapshot.versionId(), e);
        }
    }

    /**
     * @throws SnapshotPersistenceException if the file exists but cannot be read
     */
    public Optional<DeploymentSnapshot> find(String versionId) {
        if (!isValidVersionId(versionId)) {
            return Optional.empty();
        }
        Path file = fileFor(versionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(fromJson(objectMapper.readTree(file.toFile())));
        } catch (IOException | RuntimeException e) {
            throw new SnapshotPersistenceException("Failed to read snapshot " + versionId, e);
        }
    }

    /**
     * All readable snapshots, newest first. Unreadable files are logged and skipped.
     */
    public List<DeploymentSnapshot> list() {
        var snapshots = new ArrayList<DeploymentSnapshot>();
        if (!Files.isDirectory(stateDir)) {
            return snapshots;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(stateDir, PREFIX + "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    snapshots.add(fromJson(objectMapper.readTree(file.toFile())));
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable snapshot {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to list snapshots in " + stateDir, e);
        }
        snapshots.sort(Comparator.comparing(DeploymentSnapshot::timestamp).reversed());
        return snapshots;
    }

    Path fileFor(String versionId) {
        return stateDir.resolve(PREFIX + versionId + SUFFIX);
    }

    private static void requireValid(String versionId) {
        if (!isValidVersionId(versionId)) {
            throw new IllegalArgumentException("Invalid version id '" + versionId + "': use letters, digits, '.', '_' or '-'");
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private ObjectNode toJson(DeploymentSnapshot s) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("version_id", s.versionId());
        node.put("timestamp", s.timestamp().toString());
        node.put("environment", s.environment());
        node.put("artifact_tag", s.artifactTag() != null ? s.artifactTag() : "");
        node.put("container_id", s.containerId());
        node.put("container_name", s.containerName());
        node.put("port", s.port());
        node.put("container_port", s.containerPort());
        node.put("data_backup_path", s.dataBackupPath());
        return node;
    }

    private static DeploymentSnapshot fromJson(JsonNode node) {
        return new DeploymentSnapshot(
                node.get("version_id").asText(),
                Instant.parse(node.get("timestamp").asText()),
                node.path("environment").asText(""),
                node.path("artifact_tag").asText(""),
                textOrNull(node, "container_id"),
                node.path("container_name").asText(""),
                node.get("port").asInt(),
                node.path("container_port").asInt(node.get("port").asInt()),
                textOrNull(node, "data_backup_path"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
