package com.shipwright.core.smoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.model.SmokeTestReport;
import com.shipwright.core.model.SmokeTestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Black-box checks against a freshly deployed service.
 * <p>
 * The four checks run concurrently and the report waits for all of them.
 * Each request carries its own timeout. A timeout, a connection failure or a
 * request that cannot be built is a failed check, never an exception.
 */
@Service
public class SmokeTestRunner {

    private static final Logger log = LoggerFactory.getLogger(SmokeTestRunner.class);

    static final String HEALTH = "health_endpoint";
    static final String SINGLE_PREDICTION = "single_prediction";
    static final String BATCH_PREDICTION = "batch_prediction";
    static final String METRICS = "metrics_endpoint";

    private static final int POOL_SIZE = 4;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ShipwrightProperties.Smoke config;
    private final Clock clock;

    public SmokeTestRunner(HttpClient httpClient, ObjectMapper objectMapper,
                           ShipwrightProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getSmoke();
        this.clock = clock;
    }

    public SmokeTestReport run(String baseUrl) {
        log.info("Running smoke tests against {}", baseUrl);
        long start = System.nanoTime();

        var pool = Executors.newFixedThreadPool(POOL_SIZE);
        try {
            List<CompletableFuture<SmokeTestResult>> futures = List.of(
                    CompletableFuture.supplyAsync(() -> testHealth(baseUrl), pool),
                    CompletableFuture.supplyAsync(() -> testSinglePrediction(baseUrl), pool),
                    CompletableFuture.supplyAsync(() -> testBatchPrediction(baseUrl), pool),
                    CompletableFuture.supplyAsync(() -> testMetrics(baseUrl), pool));
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            var results = futures.stream().map(CompletableFuture::join).toList();
            var report = new SmokeTestReport(baseUrl, results, clock.instant(), (System.nanoTime() - start) / 1_000_000);
            log.info("Smoke tests {}: {}/{} passed (avg {} ms)", report.overallPassed() ? "passed" : "failed",
                    report.passedTests(), report.totalTests(), String.format("%.1f", report.avgResponseTimeMs()));
            report.failures().forEach(r -> log.warn("Smoke test {} failed: {}", r.testName(), r.message()));
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    SmokeTestResult testHealth(String baseUrl) {
        return call(HEALTH, () -> get(baseUrl, "/health"), (timed) -> {
            if (timed.status() != 200) {
                return fail(HEALTH, "Health endpoint returned " + timed.status(), timed, Map.of());
            }
            JsonNode body = parseJson(timed.body());
            boolean modelLoaded = body != null && body.path("model_loaded").asBoolean(false);
            String status = body != null ? body.path("status").asText("unknown") : "unparseable";
            var details = Map.<String, Object>of("status", status, "modelLoaded", modelLoaded);
            if (!modelLoaded) {
                return fail(HEALTH, "Model not loaded", timed, details);
            }
            return pass(HEALTH, "Service healthy, model loaded", timed, details);
        });
    }

    SmokeTestResult testSinglePrediction(String baseUrl) {
        return call(SINGLE_PREDICTION, () -> post(baseUrl, "/predict", singlePayload()),
                (timed) -> evaluatePrediction(timed.status(), parseJson(timed.body()), timed.elapsedMs()));
    }

    Map<String, Object> singlePayload() {
        if (config.getSampleCodes().isEmpty()) {
            throw new IllegalStateException("No sample codes configured");
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("bse_code", config.getSampleCodes().get(0));
        payload.put("nse_symbol", config.getSampleSymbol());
        payload.put("prediction_date", config.getPredictionDate());
        payload.put("include_features", false);
        return payload;
    }

    Map<String, Object> batchPayload() {
        var items = new ArrayList<Map<String, String>>();
        for (String code : config.getSampleCodes()) {
            items.add(Map.of("bse_code", code, "prediction_date", config.getPredictionDate()));
        }
        return Map.of("predictions", items);
    }

    /**
     * Applies the single-prediction pass rule: a 200 with {@code predicted_label}
     * and {@code probability}, answered within the latency budget.
     */
    SmokeTestResult evaluatePrediction(int status, JsonNode body, double responseTimeMs) {
        var timed = new TimedResponse(status, null, responseTimeMs);
        if (status != 200) {
            return fail(SINGLE_PREDICTION, "Prediction endpoint returned " + status, timed, Map.of());
        }
        if (body == null || !body.has("predicted_label") || !body.has("probability")) {
            return fail(SINGLE_PREDICTION, "Response missing predicted_label or probability", timed, Map.of());
        }
        var details = new LinkedHashMap<String, Object>();
        details.put("predictedLabel", body.get("predicted_label").asText());
        details.put("probability", body.get("probability").asDouble());
        details.put("latencyBudgetMs", config.getLatencyBudgetMs());
        if (responseTimeMs > config.getLatencyBudgetMs()) {
            return fail(SINGLE_PREDICTION, String.format("Response time %.1fms exceeds %dms budget",
                    responseTimeMs, config.getLatencyBudgetMs()), timed, details);
        }
        return pass(SINGLE_PREDICTION, String.format("Prediction returned in %.1fms", responseTimeMs), timed, details);
    }

    SmokeTestResult testBatchPrediction(String baseUrl) {
        int expected = config.getSampleCodes().size();
        return call(BATCH_PREDICTION, () -> post(baseUrl, "/batch_predict", batchPayload()), (timed) -> {
            if (timed.status() != 200) {
                return fail(BATCH_PREDICTION, "Batch endpoint returned " + timed.status(), timed, Map.of());
            }
            JsonNode body = parseJson(timed.body());
            JsonNode array = body != null && body.isObject() ? body.path("predictions") : body;
            if (array == null || !array.isArray()) {
                return fail(BATCH_PREDICTION, "Response is not a JSON array", timed, Map.of());
            }
            var details = Map.<String, Object>of("expected", expected, "received", array.size());
            if (array.size() != expected) {
                return fail(BATCH_PREDICTION, "Expected " + expected + " predictions, got " + array.size(), timed, details);
            }
            return pass(BATCH_PREDICTION, expected + " predictions returned", timed, details);
        });
    }

    SmokeTestResult testMetrics(String baseUrl) {
        String counter = config.getMetricsCounter();
        return call(METRICS, () -> get(baseUrl, "/metrics"), (timed) -> {
            if (timed.status() != 200) {
                return fail(METRICS, "Metrics endpoint returned " + timed.status(), timed, Map.of());
            }
            if (timed.body() == null || !timed.body().contains(counter)) {
                return fail(METRICS, "Counter " + counter + " not exposed", timed, Map.of("counter", counter));
            }
            return pass(METRICS, "Metrics exposed", timed, Map.of("counter", counter));
        });
    }

    private SmokeTestResult call(String testName, Supplier<HttpRequest> request,
                                 Function<TimedResponse, SmokeTestResult> evaluate) {
        HttpRequest built;
        try {
            built = request.get();
        } catch (RuntimeException e) {
            log.warn("Cannot build {} request: {}", testName, e.getMessage());
            return noResponse(testName, "invalid request: " + e.getMessage());
        }
        long start = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(built, HttpResponse.BodyHandlers.ofString());
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            return evaluate.apply(new TimedResponse(response.statusCode(), response.body(), elapsedMs));
        } catch (HttpTimeoutException e) {
            return noResponse(testName, "timed out after " + config.getRequestTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return noResponse(testName, "interrupted");
        } catch (IOException e) {
            return noResponse(testName, "request failed: " + e.getMessage());
        }
    }

    private HttpRequest get(String baseUrl, String path) {
        return HttpRequest.newBuilder(uri(baseUrl, path))
                .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .GET()
                .build();
    }

    private HttpRequest post(String baseUrl, String path, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialise smoke payload", e);
        }
        return HttpRequest.newBuilder(uri(baseUrl, path))
                .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private URI uri(String baseUrl, String path) {
        return URI.create(baseUrl + config.getApiPrefix() + path);
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Unparseable response body: {}", e.getMessage());
            return null;
        }
    }

    private SmokeTestResult pass(String name, String message, TimedResponse timed, Map<String, Object> details) {
        return new SmokeTestResult(name, true, message, timed.elapsedMs(), timed.status(), details, clock.instant());
    }

    private SmokeTestResult fail(String name, String message, TimedResponse timed, Map<String, Object> details) {
        return new SmokeTestResult(name, false, message, timed.elapsedMs(), timed.status(), details, clock.instant());
    }

    private SmokeTestResult noResponse(String name, String message) {
        return new SmokeTestResult(name, false, message, null, null, Map.of(), clock.instant());
    }

    private record TimedResponse(int status, String body, double elapsedMs) {}
}
