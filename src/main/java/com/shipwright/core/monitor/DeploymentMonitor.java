package com.shipwright.core.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipwright.config.ShipwrightProperties;
import com.shipwright.core.engine.CancellationToken;
import com.shipwright.core.model.HealthSample;
import com.shipwright.core.model.MonitoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;

/**
 * Watches a deployment's health for a fixed window.
 * <p>
 * Samples {@code GET /health} once per interval and stops early as soon as the
 * rolling health rate drops below the threshold. Cancellation ends the window
 * with a failed result carrying the reason.
 */
@Service
public class DeploymentMonitor {

    private static final Logger log = LoggerFactory.getLogger(DeploymentMonitor.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ShipwrightProperties properties;
    private final Clock clock;

    public DeploymentMonitor(HttpClient httpClient, ObjectMapper objectMapper,
                             ShipwrightProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public MonitoringResult monitor(String attemptId, String baseUrl, Duration window, Duration interval,
                                    double threshold, CancellationToken cancellation) {
        log.info("Monitoring {} for {}s (interval {}s, threshold {})",
                baseUrl, window.toSeconds(), interval.toSeconds(), threshold);
        long startNanos = System.nanoTime();
        Instant end = clock.instant().plus(window);
        var samples = new ArrayList<HealthSample>();
        String cancellationReason = null;

        while (true) {
            if (cancellation.isCancelled()) {
                cancellationReason = cancellation.reason().orElse("cancelled");
                break;
            }

            HealthSample sample = sample(baseUrl);
            samples.add(sample);
            int failed = (int) samples.stream().filter(s -> !s.healthy()).count();
            double rate = MonitoringResult.healthRate(samples.size(), failed);
            log.debug("Health sample {}: {} (rate {})", samples.size(), sample.status(), rate);

            if (rate < threshold) {
                log.warn("Health rate {} below threshold {} after {} samples; stopping early",
                        String.format("%.3f", rate), threshold, samples.size());
                break;
            }

            Duration remaining = Duration.between(clock.instant(), end);
            if (remaining.isNegative() || remaining.isZero()) {
                break;
            }
            Duration wait = interval.compareTo(remaining) < 0 ? interval : remaining;
            if (!cancellation.await(wait)) {
                cancellationReason = cancellation.reason().orElse("cancelled");
                break;
            }
            if (!clock.instant().isBefore(end)) {
                break;
            }
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        var result = MonitoringResult.from(attemptId, samples, threshold, durationMs, cancellationReason, clock.instant());
        if (result.cancelled()) {
            log.warn("Monitoring cancelled after {} samples: {}", result.sampleCount(), cancellationReason);
        } else {
            log.info("Monitoring {}: {} samples, {} failed, health rate {}",
                    result.passed() ? "passed" : "failed", result.sampleCount(), result.failedCount(),
                    String.format("%.3f", result.healthRate()));
        }
        return result;
    }

    HealthSample sample(String baseUrl) {
        var request = HttpRequest.newBuilder(URI.create(baseUrl + properties.getSmoke().getApiPrefix() + "/health"))
                .timeout(Duration.ofSeconds(properties.getMonitor().getRequestTimeoutSeconds()))
                .GET()
                .build();
        long start = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            JsonNode body = parse(response.body());
            boolean healthy = response.statusCode() == 200 && "healthy".equals(body.path("status").asText(null));
            boolean ready = body.path("model_loaded").asBoolean(false);
            return new HealthSample(clock.instant(),
                    healthy ? HealthSample.Status.HEALTHY : HealthSample.Status.UNHEALTHY,
                    elapsedMs, ready, healthy ? null : "HTTP " + response.statusCode());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthSample(clock.instant(), HealthSample.Status.ERROR, 0, false, "interrupted");
        } catch (IOException e) {
            return new HealthSample(clock.instant(), HealthSample.Status.ERROR, 0, false,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            return objectMapper.missingNode();
        }
    }
}
