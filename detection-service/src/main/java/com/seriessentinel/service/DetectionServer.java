package com.seriessentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seriessentinel.core.detection.ComputationFailureException;
import com.seriessentinel.core.detection.InvalidInputException;
import com.seriessentinel.service.api.DetectRequest;
import com.seriessentinel.service.api.DetectResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP front end of the detection pipeline.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST /api/v1/anomaly/detect} – runs detection; {@code 400} with
 * {@code {"detail": ...}} for invalid input, {@code 500} with a generic
 * detail for internal failures</li>
 * <li>{@code GET /healthz} – returns {@code {"status":"ok"}}</li>
 * <li>{@code GET /metrics} – detection meters in the Prometheus text
 * format</li>
 * </ul>
 *
 * <p>
 * Paths match exactly; anything else under a registered prefix gets
 * {@code 404} with {@code {"detail":"Not Found"}}.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}. Requests run on a fixed worker
 * pool and do not share state, so they never block each other.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionServer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionServer.class);

    public static final String DETECT_PATH = "/api/v1/anomaly/detect";
    public static final String HEALTH_PATH = "/healthz";
    public static final String METRICS_PATH = "/metrics";

    private static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=utf-8";

    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
    private static final String FAILURE_DETAIL = "detection failed";

    private final DetectionHandler handler;
    private final ObjectMapper mapper;
    private final PrometheusMeterRegistry registry;
    private final int workerThreads;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param handler       detection logic behind the detect endpoint
     * @param mapper        JSON mapper for request and response bodies
     * @param registry      registry scraped by the metrics endpoint; the
     *                      handler's meters should be registered on it
     * @param workerThreads size of the request worker pool
     */
    public DetectionServer(DetectionHandler handler, ObjectMapper mapper,
            PrometheusMeterRegistry registry, int workerThreads) {
        this.handler = Objects.requireNonNull(handler, "DetectionHandler must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.registry = Objects.requireNonNull(registry, "PrometheusMeterRegistry must not be null");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.workerThreads = workerThreads;
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to, in [0, 65535]; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Detection port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind detection server on port " + port, e);
        }
        server.createContext(DETECT_PATH, this::handleDetect);
        server.createContext(HEALTH_PATH, this::handleHealth);
        server.createContext(METRICS_PATH, this::handleMetrics);

        executor = HttpExchanges.workerPool("detection-http", workerThreads);
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("Detection server started on port {}", getPort());
    }

    /**
     * Stop the server and its worker pool.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Detection server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful after starting on port 0
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleDetect(HttpExchange exchange) throws IOException {
        try {
            if (!DETECT_PATH.equals(exchange.getRequestURI().getPath())) {
                sendDetail(exchange, 404, "Not Found");
                return;
            }
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                sendDetail(exchange, 405, "Method Not Allowed");
                return;
            }

            DetectRequest request;
            try {
                request = mapper.readValue(HttpExchanges.readBody(exchange), DetectRequest.class);
            } catch (JsonProcessingException e) {
                LOG.warn("Rejected malformed detection request: {}", e.getOriginalMessage());
                sendDetail(exchange, 400, "malformed request body: " + e.getOriginalMessage());
                return;
            }

            try {
                DetectResponse response = handler.detect(request);
                HttpExchanges.send(exchange, 200, HttpExchanges.APPLICATION_JSON, mapper.writeValueAsBytes(response));
            } catch (InvalidInputException e) {
                LOG.warn("Rejected detection request: {}", e.getMessage());
                sendDetail(exchange, 400, e.getMessage());
            } catch (ComputationFailureException e) {
                LOG.error("Detection failed", e);
                sendDetail(exchange, 500, FAILURE_DETAIL);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error while handling detection request", e);
                sendDetail(exchange, 500, FAILURE_DETAIL);
            }
        } finally {
            exchange.close();
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        try {
            if (!HEALTH_PATH.equals(exchange.getRequestURI().getPath())) {
                sendDetail(exchange, 404, "Not Found");
                return;
            }
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            if ("HEAD".equals(method)) {
                exchange.getResponseHeaders().set("Content-Type", HttpExchanges.APPLICATION_JSON);
                exchange.sendResponseHeaders(200, -1);
            } else if ("GET".equals(method)) {
                HttpExchanges.send(exchange, 200, HttpExchanges.APPLICATION_JSON, HEALTH_RESPONSE);
            } else {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                sendDetail(exchange, 405, "Method Not Allowed");
            }
        } finally {
            exchange.close();
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        try {
            if (!METRICS_PATH.equals(exchange.getRequestURI().getPath())) {
                sendDetail(exchange, 404, "Not Found");
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                sendDetail(exchange, 405, "Method Not Allowed");
                return;
            }
            HttpExchanges.send(exchange, 200, PROMETHEUS_TEXT,
                    registry.scrape().getBytes(StandardCharsets.UTF_8));
        } finally {
            exchange.close();
        }
    }

    private void sendDetail(HttpExchange exchange, int status, String detail) throws IOException {
        byte[] body = mapper.writeValueAsBytes(Map.of("detail", detail));
        HttpExchanges.send(exchange, status, HttpExchanges.APPLICATION_JSON, body);
    }
}
