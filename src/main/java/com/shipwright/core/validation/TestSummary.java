package com.shipwright.core.validation;

/**
 * Test counts parsed from a test runner's console output.
 *
 * @param format which output style was recognised: "maven", "pytest" or "unknown"
 */
public record TestSummary(String format, int totalTests, int failedTests) {

    public int passedTests() {
        return totalTests - failedTests;
    }

    public boolean recognised() {
        return !"unknown".equals(format);
    }
}
