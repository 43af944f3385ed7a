package com.seriessentinel.service;

import com.seriessentinel.core.config.DetectionSettings;
import com.seriessentinel.core.config.SettingsLoader;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the detection service.
 *
 * <h3>Start-up</h3>
 *
 * <pre>
 *   env vars → ServiceConfig
 *     → DetectionSettings (YAML, validated)
 *     → DetectionHandler + DetectionMetrics (Prometheus registry)
 *     → DetectionServer (blocks until shutdown)
 * </pre>
 *
 * @since 1.0.0
 */
public final class SeriesSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesSentinelApp.class);

    private SeriesSentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Series Sentinel with config: {}", config);

        // 2. Load detection defaults
        DetectionSettings defaults = loadSettings(config);

        // 3. Wire the handler
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        DetectionMetrics metrics = new DetectionMetrics(registry);
        DetectionHandler handler = new DetectionHandler(defaults, metrics);

        // 4. Start the server with shutdown hook
        DetectionServer server = new DetectionServer(
                handler, JsonSupport.newObjectMapper(), registry, config.getWorkerThreads());
        server.start(config.getDetectionPort());

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            shutdown.countDown();
        }, "detection-shutdown"));

        shutdown.await();
    }

    static DetectionSettings loadSettings(ServiceConfig config) {
        String path = config.getDetectionConfigPath();
        if (path != null && !path.isBlank()) {
            return SettingsLoader.fromFile(path);
        }
        return SettingsLoader.load();
    }
}
