package com.shipwright.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a bounded wall-clock time, capturing combined output.
 */
@Component
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    /**
     * @throws UncheckedIOException if the process cannot be started
     */
    public CommandResult run(Path workDir, List<String> command, Duration timeout) {
        log.debug("Running: {} (in {})", String.join(" ", command), workDir);
        long start = System.nanoTime();

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start " + command.get(0), e);
        }

        // Drain output on a separate thread so a chatty process cannot block on a full pipe
        var output = new StringBuilder();
        var reader = new Thread(() -> drain(process, output), "cmd-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), String.join(" ", command));
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            String captured;
            synchronized (output) {
                captured = output.toString();
            }
            return finished
                    ? new CommandResult(process.exitValue(), captured, false, durationMs)
                    : new CommandResult(-1, captured, true, durationMs);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            return new CommandResult(-1, "interrupted", true, durationMs);
        }
    }

    private static void drain(Process process, StringBuilder sink) {
        try (var in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                synchronized (sink) {
                    sink.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }
}
