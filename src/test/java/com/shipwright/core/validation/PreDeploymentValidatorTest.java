package com.shipwright.core.validation;

import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.exception.ContainerRuntimeException;
import com.shipwright.core.model.ValidationCheck;
import com.shipwright.core.process.CommandResult;
import com.shipwright.core.process.CommandRunner;
import com.shipwright.runtime.ContainerRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.DriverManager;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PreDeploymentValidatorTest {

    @TempDir
    Path projectRoot;

    private ShipwrightProperties properties;
    private CommandRunner commandRunner;
    private ContainerRuntime containerRuntime;
    private Map<String, String> env;
    private PreDeploymentValidator validator;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ShipwrightProperties();
        commandRunner = mock(CommandRunner.class);
        containerRuntime = mock(ContainerRuntime.class);
        env = new HashMap<>(Map.of("ENVIRONMENT", "staging", "API_HOST", "0.0.0.0", "API_PORT", "8000"));
        var clock = Clock.fixed(Instant.parse("2025-11-14T10:00:00Z"), ZoneOffset.UTC);
        validator = new PreDeploymentValidator(properties, commandRunner, containerRuntime, clock, env::get);

        when(commandRunner.run(any(), anyList(), any()))
                .thenReturn(new CommandResult(0, "===== 12 passed in 1.02s =====", false, 1020));
        when(containerRuntime.buildImage(any(), anyString(), any())).thenReturn("sha256:abc");
        Files.writeString(projectRoot.resolve("Dockerfile"), "FROM python:3.11-slim\n");
        createDataStores();
        createRegistry(true);
    }

    private void createDataStores() throws Exception {
        for (String relative : properties.getValidator().getDataFiles()) {
            Path db = projectRoot.resolve("data").resolve(relative);
            Files.createDirectories(db.getParent());
            try (var conn = DriverManager.getConnection("jdbc:sqlite:" + db);
                 var stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE t (id INTEGER PRIMARY KEY)");
            }
        }
    }

    private void createRegistry(boolean withModel) throws Exception {
        Path db = projectRoot.resolve("data/models/registry/model_registry.db");
        Files.createDirectories(db.getParent());
        Files.deleteIfExists(db);
        try (var conn = DriverManager.getConnection("jdbc:sqlite:" + db);
             var stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE models (model_id INTEGER PRIMARY KEY, model_type TEXT, version TEXT, created_at TEXT)");
            if (withModel) {
                stmt.execute("INSERT INTO models (model_type, version, created_at) VALUES ('xgboost', '1.0.0', '2025-11-01T00:00:00')");
                stmt.execute("INSERT INTO models (model_type, version, created_at) VALUES ('xgboost', '1.1.0', '2025-11-10T00:00:00')");
            }
        }
    }

    @Test
    @DisplayName("all checks pass on a ready project")
    void allChecksPass() {
        var report = validator.validate(projectRoot, false);

        assertTrue(report.overallPassed(), () -> "failures: " + report.failures());
        assertEquals(5, report.totalChecks());
        assertEquals("1.1.0", report.check("model_registry").orElseThrow().details().get("version"));
        assertEquals(12, report.check("tests").orElseThrow().details().get("totalTests"));
    }

    @Test
    @DisplayName("a non-zero test exit fails the report")
    void nonZeroTestExitFails() {
        when(commandRunner.run(any(), anyList(), any()))
                .thenReturn(new CommandResult(1, "===== 10 passed, 2 failed in 1.5s =====", false, 1500));

        var report = validator.validate(projectRoot, false);

        assertFalse(report.overallPassed());
        var tests = report.check("tests").orElseThrow();
        assertFalse(tests.passed());
        assertEquals(2, tests.details().get("failedTests"));
    }

    @Test
    @DisplayName("a test command timeout fails the tests check")
    void testTimeoutFails() {
        when(commandRunner.run(any(), anyList(), any())).thenReturn(new CommandResult(-1, "", true, 120_000));
        var tests = validator.validate(projectRoot, true).check("tests").orElseThrow();
        assertFalse(tests.passed());
        assertTrue(tests.message().contains("timed out"));
    }

    @Test
    @DisplayName("skipBuild omits the build check and never builds")
    void skipBuild() {
        var report = validator.validate(projectRoot, true);

        assertEquals(4, report.totalChecks());
        assertEquals(List.of("artifact_build"), report.skippedChecks());
        verify(containerRuntime, never()).buildImage(any(), anyString(), any());
    }

    @Test
    @DisplayName("validation is idempotent")
    void idempotent() {
        var first = validator.validate(projectRoot, false);
        var second = validator.validate(projectRoot, false);

        assertEquals(first.overallPassed(), second.overallPassed());
        assertEquals(first.checks().stream().map(ValidationCheck::passed).toList(),
                second.checks().stream().map(ValidationCheck::passed).toList());
    }

    @Test
    @DisplayName("an internal error becomes a failed check with details.error")
    void internalErrorCaptured() {
        when(commandRunner.run(any(), anyList(), any())).thenThrow(new IllegalStateException("boom"));

        var report = validator.validate(projectRoot, true);

        var tests = report.check("tests").orElseThrow();
        assertFalse(tests.passed());
        assertEquals("boom", tests.details().get("error"));
        assertEquals(4, report.totalChecks(), "other checks still run");
    }

    @Nested
    @DisplayName("artifact build")
    class ArtifactBuild {

        @Test
        @DisplayName("fails without a Dockerfile")
        void missingDockerfile() throws Exception {
            Files.delete(projectRoot.resolve("Dockerfile"));
            var check = validator.validate(projectRoot, false).check("artifact_build").orElseThrow();
            assertFalse(check.passed());
            assertEquals("Dockerfile not found", check.message());
        }

        @Test
        @DisplayName("builds a throwaway validation tag")
        void buildsValidationTag() {
            var check = validator.validate(projectRoot, false).check("artifact_build").orElseThrow();
            assertTrue(check.passed());
            verify(containerRuntime).buildImage(eq(projectRoot), eq("vcp-ml:validation"), any());
        }

        @Test
        @DisplayName("a build error fails the check")
        void buildError() {
            when(containerRuntime.buildImage(any(), anyString(), any()))
                    .thenThrow(new ContainerRuntimeException("Failed to build image: step 3 failed"));
            var check = validator.validate(projectRoot, false).check("artifact_build").orElseThrow();
            assertFalse(check.passed());
            assertTrue(check.details().get("error").toString().contains("step 3"));
        }
    }

    @Nested
    @DisplayName("environment")
    class Environment {

        @Test
        @DisplayName("missing required variable fails")
        void missingRequired() {
            env.remove("API_PORT");
            var check = validator.validate(projectRoot, true).check("environment").orElseThrow();
            assertFalse(check.passed());
            assertEquals(List.of("API_PORT"), check.details().get("missingRequired"));
        }

        @Test
        @DisplayName("missing recommended variables are reported but pass")
        void missingRecommended() {
            var check = validator.validate(projectRoot, true).check("environment").orElseThrow();
            assertTrue(check.passed());
            assertEquals(List.of("LOG_LEVEL", "DATABASE_PATH", "MODEL_REGISTRY_PATH"),
                    check.details().get("missingRecommended"));
        }
    }

    @Nested
    @DisplayName("data stores and registry")
    class DataStores {

        @Test
        @DisplayName("missing and invalid stores are listed")
        void missingAndInvalid() throws Exception {
            Files.delete(projectRoot.resolve("data/price_movements.db"));
            Files.writeString(projectRoot.resolve("data/features/financial_data.db"), "not a database");

            var check = validator.validate(projectRoot, true).check("data_stores").orElseThrow();

            assertFalse(check.passed());
            assertEquals(List.of("price_movements.db"), check.details().get("missing"));
            assertEquals(List.of("features/financial_data.db"), check.details().get("invalid"));
        }

        @Test
        @DisplayName("an empty registry fails")
        void emptyRegistry() throws Exception {
            createRegistry(false);
            var check = validator.validate(projectRoot, true).check("model_registry").orElseThrow();
            assertFalse(check.passed());
            assertEquals("No models registered", check.message());
        }

        @Test
        @DisplayName("a missing registry fails")
        void missingRegistry() throws Exception {
            Files.delete(projectRoot.resolve("data/models/registry/model_registry.db"));
            var check = validator.validate(projectRoot, true).check("model_registry").orElseThrow();
            assertFalse(check.passed());
        }
    }
}
