package com.shipwright.core.validation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts pass/fail counts from Maven/JUnit or pytest console output.
 * The counts are informational; the test gate itself is decided by exit code.
 */
public final class TestOutputParser {

    /** Maven/JUnit style: "Tests run: 10, Failures: 2" */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    private TestOutputParser() {
    }

    public static TestSummary parse(String output) {
        if (output == null || output.isBlank()) {
            return new TestSummary("unknown", 0, 0);
        }

        // Surefire prints per-class lines then a final total; the last match is the total
        Matcher mavenMatcher = MAVEN_PATTERN.matcher(output);
        int total = -1;
        int failed = 0;
        while (mavenMatcher.find()) {
            total = Integer.parseInt(mavenMatcher.group(1));
            failed = Integer.parseInt(mavenMatcher.group(2));
        }
        if (total >= 0) {
            return new TestSummary("maven", total, failed);
        }

        Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(output);
        Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(output);
        boolean foundPassed = passedMatcher.find();
        boolean foundFailed = failedMatcher.find();
        if (foundPassed || foundFailed) {
            int passedCount = foundPassed ? Integer.parseInt(passedMatcher.group(1)) : 0;
            int failedCount = foundFailed ? Integer.parseInt(failedMatcher.group(1)) : 0;
            return new TestSummary("pytest", passedCount + failedCount, failedCount);
        }

        return new TestSummary("unknown", 0, 0);
    }
}
