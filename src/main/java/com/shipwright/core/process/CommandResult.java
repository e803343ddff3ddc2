package com.shipwright.core.process;

/**
 * Outcome of an external command.
 *
 * @param exitCode process exit code, or {@code -1} when the command timed out
 * @param output   combined stdout and stderr
 * @param timedOut whether the command was killed after exceeding its timeout
 */
public record CommandResult(int exitCode, String output, boolean timedOut, long durationMs) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
