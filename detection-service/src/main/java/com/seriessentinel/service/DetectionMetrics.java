package com.seriessentinel.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the detection endpoint.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code detection.requests} – counter of detection requests handled</li>
 *   <li>{@code detection.failures} – counter of failed requests, tagged
 *   {@code kind=invalid_input|computation}</li>
 *   <li>{@code detection.segment.anomalies} – counter of anomalous segments</li>
 *   <li>{@code detection.latency} – timer of end-to-end detection time</li>
 * </ul>
 */
public class DetectionMetrics {

    private final Counter requests;
    private final Counter invalidInputs;
    private final Counter computationFailures;
    private final Counter segmentAnomalies;
    private final Timer latency;

    public DetectionMetrics(MeterRegistry registry) {
        this.requests = Counter.builder("detection.requests")
                .description("Detection requests handled")
                .register(registry);
        this.invalidInputs = Counter.builder("detection.failures")
                .tag("kind", "invalid_input")
                .register(registry);
        this.computationFailures = Counter.builder("detection.failures")
                .tag("kind", "computation")
                .register(registry);
        this.segmentAnomalies = Counter.builder("detection.segment.anomalies")
                .description("Segments judged anomalous")
                .register(registry);
        this.latency = Timer.builder("detection.latency")
                .description("End-to-end detection time")
                .register(registry);
    }

    public void incrementRequests() {
        requests.increment();
    }

    public void incrementInvalidInputs() {
        invalidInputs.increment();
    }

    public void incrementComputationFailures() {
        computationFailures.increment();
    }

    public void incrementSegmentAnomalies() {
        segmentAnomalies.increment();
    }

    public void recordLatency(long nanos) {
        latency.record(nanos, TimeUnit.NANOSECONDS);
    }
}
