package com.shipwright.core.engine;

import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.exception.DeploymentInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Advisory lock over "the running service for environment E". Held from profile
 * resolution until the attempt is sealed; a second holder fails fast.
 * <p>
 * Guards both other processes (an OS file lock on {@code <stateDir>/locks/<env>.lock})
 * and other threads of this process (an in-memory registry, since file locks are per-JVM).
 */
@Component
public class EnvironmentLock {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentLock.class);

    private final Path lockDir;
    private final ConcurrentMap<String, Handle> held = new ConcurrentHashMap<>();

    public EnvironmentLock(ShipwrightProperties properties) {
        this(Path.of(properties.getProjectRoot()).resolve(properties.getStateDir()).resolve("locks"));
    }

    EnvironmentLock(Path lockDir) {
        this.lockDir = lockDir;
    }

    /**
     * @throws DeploymentInProgressException if the environment is already locked
     */
    public Handle acquire(String environment) {
        var handle = new Handle(environment);
        if (held.putIfAbsent(environment, handle) != null) {
            throw new DeploymentInProgressException(environment);
        }
        try {
            Files.createDirectories(lockDir);
            var channel = FileChannel.open(lockDir.resolve(environment + ".lock"),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            }
            if (lock == null) {
                channel.close();
                held.remove(environment, handle);
                throw new DeploymentInProgressException(environment);
            }
            handle.bind(channel, lock);
            log.debug("Acquired lock for environment {}", environment);
            return handle;
        } catch (IOException e) {
            held.remove(environment, handle);
            throw new DeploymentInProgressException(environment, e);
        }
    }

    public boolean isHeld(String environment) {
        return held.containsKey(environment);
    }

    public final class Handle implements AutoCloseable {

        private final String environment;
        private FileChannel channel;
        private FileLock lock;

        private Handle(String environment) {
            this.environment = environment;
        }

        private void bind(FileChannel channel, FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public void close() {
            try {
                if (lock != null && lock.isValid()) {
                    lock.release();
                }
                if (channel != null) {
                    channel.close();
                }
            } catch (IOException e) {
                log.warn("Failed to release lock for environment {}: {}", environment, e.getMessage());
            } finally {
                held.remove(environment, this);
                log.debug("Released lock for environment {}", environment);
            }
        }
    }
}
