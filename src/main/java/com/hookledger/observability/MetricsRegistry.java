package com.hookledger.observability;

import com.hookledger.ingest.WebhookResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.List;

/**
 * Process-wide request and webhook counters. One instance is created at
 * startup and handed to whoever records or exports.
 */
public class MetricsRegistry {

    static final String HTTP_REQUESTS = "http.requests";
    static final String WEBHOOK_REQUESTS = "webhook.requests";
    static final String REQUEST_LATENCY = "request.latency";

    private final PrometheusMeterRegistry registry;
    private final Duration[] latencyBuckets;

    public MetricsRegistry(List<Long> latencyBucketsMs) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.latencyBuckets = latencyBucketsMs.stream()
            .map(Duration::ofMillis)
            .toArray(Duration[]::new);
        for (var result : WebhookResult.values()) {
            webhookCounter(result);
        }
    }

    public MeterRegistry registry() { return registry; }

    public void recordRequest(String endpoint, int statusCode, Duration latency) {
        Counter.builder(HTTP_REQUESTS)
            .description("Total HTTP requests by path and status")
            .tag("path", endpoint)
            .tag("status", String.valueOf(statusCode))
            .register(registry)
            .increment();
        Timer.builder(REQUEST_LATENCY)
            .description("Request latency")
            .tag("endpoint", endpoint)
            .serviceLevelObjectives(latencyBuckets)
            .register(registry)
            .record(latency);
    }

    public void recordWebhookResult(WebhookResult result) {
        webhookCounter(result).increment();
    }

    public double webhookResultCount(WebhookResult result) {
        return webhookCounter(result).count();
    }

    public double requestCount(String endpoint, int statusCode) {
        var counter = registry.find(HTTP_REQUESTS)
            .tag("path", endpoint)
            .tag("status", String.valueOf(statusCode))
            .counter();
        return counter == null ? 0 : counter.count();
    }

    public long latencyCount(String endpoint) {
        var timer = registry.find(REQUEST_LATENCY).tag("endpoint", endpoint).timer();
        return timer == null ? 0 : timer.count();
    }

    /**
     * Prometheus text exposition of every meter.
     */
    public String export() {
        return registry.scrape();
    }

    private Counter webhookCounter(WebhookResult result) {
        return Counter.builder(WEBHOOK_REQUESTS)
            .description("Total webhook requests by result")
            .tag("result", result.label())
            .register(registry);
    }
}
