package com.shipwright.core.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Copies the service's data directory aside before a deployment and puts it back on rollback.
 */
public class DataBackupManager {

    private static final Logger log = LoggerFactory.getLogger(DataBackupManager.class);

    private final Path dataDir;
    private final Path backupRoot;

    public DataBackupManager(Path dataDir, Path backupRoot) {
        this.dataDir = dataDir;
        this.backupRoot = backupRoot;
    }

    /**
     * @return the backup directory
     */
    public Path backup(String versionId, long epochSeconds) throws IOException {
        Path target = backupRoot.resolve("data_backup_" + versionId + "_" + epochSeconds);
        if (!Files.isDirectory(dataDir)) {
            throw new IOException("Data directory " + dataDir + " does not exist");
        }
        log.info("Backing up {} to {}", dataDir, target);
        copyTree(dataDir, target);
        return target;
    }

    /**
     * Replaces the data directory with the contents of {@code backup}.
     */
    public void restore(Path backup) throws IOException {
        if (!Files.isDirectory(backup)) {
            throw new IOException("Backup " + backup + " does not exist");
        }
        log.info("Restoring {} from {}", dataDir, backup);
        deleteTree(dataDir);
        copyTree(backup, dataDir);
    }

    private static void copyTree(Path source, Path target) throws IOException {
        try (Stream<Path> paths = Files.walk(source)) {
            paths.forEach(p -> {
                Path dest = target.resolve(source.relativize(p).toString());
                try {
                    if (Files.isDirectory(p)) {
                        Files.createDirectories(dest);
                    } else {
                        Files.copy(p, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
