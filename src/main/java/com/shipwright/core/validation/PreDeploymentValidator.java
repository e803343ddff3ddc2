package com.shipwright.core.validation;

import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.model.ValidationCheck;
import com.shipwright.core.model.ValidationReport;
import com.shipwright.core.process.CommandRunner;
import com.shipwright.runtime.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Readiness gate run before anything is built or shipped.
 * <p>
 * Five independent checks are executed in order:
 * <ul>
 *   <li>{@code tests}: the project's test command exits 0</li>
 *   <li>{@code artifact_build}: the Dockerfile builds into a throwaway image (skippable)</li>
 *   <li>{@code environment}: required variables are set; recommended ones are reported</li>
 *   <li>{@code data_stores}: each required SQLite store opens and has at least one table</li>
 *   <li>{@code model_registry}: the registry has a readable latest model entry</li>
 * </ul>
 * A check never throws: internal errors become a failed check with {@code details.error}.
 * Validation never touches the running service, so it is safe to repeat.
 */
@Service
public class PreDeploymentValidator {

    private static final Logger log = LoggerFactory.getLogger(PreDeploymentValidator.class);

    static final String TESTS = "tests";
    static final String ARTIFACT_BUILD = "artifact_build";
    static final String ENVIRONMENT = "environment";
    static final String DATA_STORES = "data_stores";
    static final String MODEL_REGISTRY = "model_registry";

    private static final int OUTPUT_TAIL_CHARS = 2000;

    private final ShipwrightProperties properties;
    private final CommandRunner commandRunner;
    private final ContainerRuntime containerRuntime;
    private final Clock clock;
    private final Function<String, String> envLookup;

    @Autowired
    public PreDeploymentValidator(ShipwrightProperties properties, CommandRunner commandRunner,
                                  ContainerRuntime containerRuntime, Clock clock) {
        this(properties, commandRunner, containerRuntime, clock, System::getenv);
    }

    PreDeploymentValidator(ShipwrightProperties properties, CommandRunner commandRunner,
                           ContainerRuntime containerRuntime, Clock clock, Function<String, String> envLookup) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.containerRuntime = containerRuntime;
        this.clock = clock;
        this.envLookup = envLookup;
    }

    /**
     * Runs every check against {@code projectRoot}.
     *
     * @param skipBuild skip the throwaway artifact build; the check is reported as skipped
     */
    public ValidationReport validate(Path projectRoot, boolean skipBuild) {
        log.info("Running pre-deployment validation in {}", projectRoot);
        long start = System.nanoTime();

        var checks = new ArrayList<ValidationCheck>();
        var skipped = new ArrayList<String>();

        checks.add(timed(TESTS, () -> checkTests(projectRoot)));
        if (skipBuild) {
            log.info("Skipping {} check", ARTIFACT_BUILD);
            skipped.add(ARTIFACT_BUILD);
        } else {
            checks.add(timed(ARTIFACT_BUILD, () -> checkArtifactBuild(projectRoot)));
        }
        checks.add(timed(ENVIRONMENT, this::checkEnvironment));
        checks.add(timed(DATA_STORES, () -> checkDataStores(projectRoot)));
        checks.add(timed(MODEL_REGISTRY, () -> checkModelRegistry(projectRoot)));

        var report = new ValidationReport(checks, skipped, clock.instant(), elapsedMs(start));
        log.info("Validation {}: {}/{} checks passed",
                report.overallPassed() ? "passed" : "failed", report.passedChecks(), report.totalChecks());
        report.failures().forEach(c -> log.warn("Check {} failed: {}", c.name(), c.message()));
        return report;
    }

    private ValidationCheck timed(String name, Supplier<ValidationCheck> check) {
        long start = System.nanoTime();
        ValidationCheck result;
        try {
            result = check.get();
        } catch (Exception e) {
            log.error("Check {} raised an error", name, e);
            result = ValidationCheck.failed(name, "Check error: " + e.getMessage(),
                    Map.of("error", String.valueOf(e.getMessage())), clock.instant());
        }
        return result.withDuration(elapsedMs(start));
    }

    ValidationCheck checkTests(Path projectRoot) {
        var cfg = properties.getValidator();
        var timeout = Duration.ofSeconds(cfg.getTestTimeoutSeconds());
        var result = commandRunner.run(projectRoot, cfg.getTestCommand(), timeout);
        var summary = TestOutputParser.parse(result.output());

        var details = new LinkedHashMap<String, Object>();
        details.put("command", String.join(" ", cfg.getTestCommand()));
        details.put("exitCode", result.exitCode());
        details.put("format", summary.format());
        details.put("totalTests", summary.totalTests());
        details.put("passedTests", summary.passedTests());
        details.put("failedTests", summary.failedTests());
        details.put("outputTail", tail(result.output()));

        if (result.timedOut()) {
            return ValidationCheck.failed(TESTS, "Tests timed out after " + timeout.toSeconds() + "s", details, clock.instant());
        }
        if (result.exitCode() != 0) {
            return ValidationCheck.failed(TESTS, "Tests failed (exit code " + result.exitCode() + ", "
                    + summary.failedTests() + " failed)", details, clock.instant());
        }
        return ValidationCheck.passed(TESTS, "All tests passed (" + summary.totalTests() + " tests)", details, clock.instant());
    }

    ValidationCheck checkArtifactBuild(Path projectRoot) {
        if (!Files.isRegularFile(projectRoot.resolve("Dockerfile"))) {
            return ValidationCheck.failed(ARTIFACT_BUILD, "Dockerfile not found",
                    Map.of("contextDir", projectRoot.toString()), clock.instant());
        }
        String tag = properties.getImage() + ":validation";
        var timeout = Duration.ofSeconds(properties.getValidator().getBuildTimeoutSeconds());
        String imageId = containerRuntime.buildImage(projectRoot, tag, timeout);
        return ValidationCheck.passed(ARTIFACT_BUILD, "Image built successfully",
                Map.of("tag", tag, "imageId", imageId), clock.instant());
    }

    ValidationCheck checkEnvironment() {
        var cfg = properties.getValidator();
        var missingRequired = cfg.getRequiredEnv().stream().filter(this::isUnset).toList();
        var missingRecommended = cfg.getRecommendedEnv().stream().filter(this::isUnset).toList();

        var details = new LinkedHashMap<String, Object>();
        details.put("missingRequired", missingRequired);
        details.put("missingRecommended", missingRecommended);

        if (!missingRequired.isEmpty()) {
            return ValidationCheck.failed(ENVIRONMENT,
                    "Missing required variables: " + String.join(", ", missingRequired), details, clock.instant());
        }
        String message = missingRecommended.isEmpty()
                ? "All environment variables set"
                : "Required variables set; missing recommended: " + String.join(", ", missingRecommended);
        return ValidationCheck.passed(ENVIRONMENT, message, details, clock.instant());
    }

    ValidationCheck checkDataStores(Path projectRoot) {
        Path dataDir = projectRoot.resolve(properties.getValidator().getDataDir());
        var valid = new ArrayList<String>();
        var missing = new ArrayList<String>();
        var invalid = new ArrayList<String>();

        for (String relative : properties.getValidator().getDataFiles()) {
            Path file = dataDir.resolve(relative);
            if (!Files.isRegularFile(file)) {
                missing.add(relative);
                continue;
            }
            try (Connection conn = openReadOnly(file)) {
                if (countTables(conn) > 0) {
                    valid.add(relative);
                } else {
                    invalid.add(relative);
                }
            } catch (SQLException e) {
                log.debug("Data store {} is not readable: {}", file, e.getMessage());
                invalid.add(relative);
            }
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("valid", valid);
        details.put("missing", missing);
        details.put("invalid", invalid);

        if (missing.isEmpty() && invalid.isEmpty()) {
            return ValidationCheck.passed(DATA_STORES, "All " + valid.size() + " data stores valid", details, clock.instant());
        }
        return ValidationCheck.failed(DATA_STORES, "Data stores not ready: " + missing.size() + " missing, "
                + invalid.size() + " invalid", details, clock.instant());
    }

    ValidationCheck checkModelRegistry(Path projectRoot) {
        var cfg = properties.getValidator();
        Path registry = projectRoot.resolve(cfg.getDataDir()).resolve(cfg.getRegistryFile());
        if (!Files.isRegularFile(registry)) {
            return ValidationCheck.failed(MODEL_REGISTRY, "Model registry not found",
                    Map.of("path", registry.toString()), clock.instant());
        }

        try (Connection conn = openReadOnly(registry)) {
            int modelCount;
            try (var stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM models")) {
                modelCount = rs.next() ? rs.getInt(1) : 0;
            }
            if (modelCount == 0) {
                return ValidationCheck.failed(MODEL_REGISTRY, "No models registered",
                        Map.of("path", registry.toString(), "modelCount", 0), clock.instant());
            }

            var details = new LinkedHashMap<String, Object>();
            details.put("modelCount", modelCount);
            try (var stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT model_id, model_type, version, created_at FROM models ORDER BY created_at DESC LIMIT 1")) {
                if (!rs.next()) {
                    return ValidationCheck.failed(MODEL_REGISTRY, "Latest model entry unreadable", details, clock.instant());
                }
                details.put("modelId", String.valueOf(rs.getObject("model_id")));
                details.put("modelType", String.valueOf(rs.getString("model_type")));
                details.put("version", String.valueOf(rs.getString("version")));
                details.put("createdAt", String.valueOf(rs.getString("created_at")));
            }
            return ValidationCheck.passed(MODEL_REGISTRY, "Registry has " + modelCount + " models; latest "
                    + details.get("modelType") + " v" + details.get("version"), details, clock.instant());
        } catch (SQLException e) {
            return ValidationCheck.failed(MODEL_REGISTRY, "Registry unreadable: " + e.getMessage(),
                    Map.of("path", registry.toString(), "error", String.valueOf(e.getMessage())), clock.instant());
        }
    }

    private boolean isUnset(String name) {
        String value = envLookup.apply(name);
        return value == null || value.isBlank();
    }

    private static Connection openReadOnly(Path file) throws SQLException {
        var config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath(), config.toProperties());
    }

    private static int countTables(Connection conn) throws SQLException {
        try (var stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM sqlite_master WHERE type = 'table'")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static String tail(String output) {
        if (output == null) {
            return "";
        }
        return output.length() <= OUTPUT_TAIL_CHARS ? output : output.substring(output.length() - OUTPUT_TAIL_CHARS);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
