package com.shipwright.core.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandRunnerTest {

    @TempDir
    Path workDir;

    private final CommandRunner runner = new CommandRunner();

    @Test
    @DisplayName("captures exit code and combined output")
    void capturesOutput() {
        var result = runner.run(workDir, List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(10));

        assertEquals(3, result.exitCode());
        assertFalse(result.timedOut());
        assertFalse(result.succeeded());
        assertTrue(result.output().contains("out"));
        assertTrue(result.output().contains("err"));
    }

    @Test
    @DisplayName("kills a command that exceeds its timeout")
    void timesOut() {
        var result = runner.run(workDir, List.of("sh", "-c", "sleep 10"), Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
        assertTrue(result.durationMs() < 5000);
    }

    @Test
    @DisplayName("an unknown executable raises")
    void unknownExecutable() {
        assertThrows(UncheckedIOException.class,
                () -> runner.run(workDir, List.of("definitely-not-a-command-xyz"), Duration.ofSeconds(1)));
    }
}
