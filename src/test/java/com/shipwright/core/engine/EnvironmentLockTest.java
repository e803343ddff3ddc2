package com.shipwright.core.engine;

import com.shipwright.core.exception.DeploymentInProgressException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentLockTest {

    @TempDir
    Path stateDir;

    @Test
    @DisplayName("a second acquire on the same environment fails fast")
    void secondAcquireFails() {
        var lock = new EnvironmentLock(stateDir.resolve("locks"));

        try (var handle = lock.acquire("staging")) {
            assertTrue(lock.isHeld("staging"));
            var ex = assertThrows(DeploymentInProgressException.class, () -> lock.acquire("staging"));
            assertTrue(ex.getMessage().contains("staging"));
        }
        assertFalse(lock.isHeld("staging"));
    }

    @Test
    @DisplayName("different environments lock independently")
    void independentEnvironments() {
        var lock = new EnvironmentLock(stateDir.resolve("locks"));

        try (var staging = lock.acquire("staging"); var production = lock.acquire("production")) {
            assertTrue(lock.isHeld("staging"));
            assertTrue(lock.isHeld("production"));
        }
    }

    @Test
    @DisplayName("the lock can be reacquired after release and leaves a lock file")
    void reacquire() {
        var lock = new EnvironmentLock(stateDir.resolve("locks"));

        lock.acquire("staging").close();
        try (var again = lock.acquire("staging")) {
            assertTrue(Files.exists(stateDir.resolve("locks/staging.lock")));
        }
    }

    @Test
    @DisplayName("two lock instances over the same directory exclude each other")
    void crossInstance() {
        var first = new EnvironmentLock(stateDir.resolve("locks"));
        var second = new EnvironmentLock(stateDir.resolve("locks"));

        try (var handle = first.acquire("production")) {
            assertThrows(DeploymentInProgressException.class, () -> second.acquire("production"));
            assertFalse(second.isHeld("production"));
        }
        second.acquire("production").close();
    }
}
