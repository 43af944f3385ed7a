package com.seriessentinel.service.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seriessentinel.service.HttpExchanges;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Capture-and-display sink for Alertmanager-style webhook notifications.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST /v1/integrations/alertmanager/webhook} – stores the JSON
 * payload; {@code 400} when it cannot be parsed</li>
 * <li>{@code GET /alerts} – stored alerts, oldest first</li>
 * <li>{@code GET /health} – plain {@code OK}</li>
 * <li>{@code GET /} – informational HTML page</li>
 * </ul>
 *
 * <p>
 * Unknown paths get {@code 404 Not Found}. A malformed payload is answered
 * and logged; the server keeps serving.
 * </p>
 *
 * @since 1.0.0
 */
public class WebhookRelayServer {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookRelayServer.class);

    public static final String WEBHOOK_PATH = "/v1/integrations/alertmanager/webhook";
    public static final String ALERTS_PATH = "/alerts";
    public static final String HEALTH_PATH = "/health";

    private final AlertBuffer buffer;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int workerThreads;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WebhookRelayServer(AlertBuffer buffer, ObjectMapper mapper, Clock clock, int workerThreads) {
        this.buffer = Objects.requireNonNull(buffer, "AlertBuffer must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.workerThreads = workerThreads;
    }

    /**
     * Start the relay on the given port.
     *
     * @param port TCP port to bind to, in [0, 65535]; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Relay port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind webhook relay on port " + port, e);
        }
        server.createContext("/", this::route);

        executor = HttpExchanges.workerPool("relay-http", workerThreads);
        server.setExecutor(executor);
        server.start();
        running.set(true);

        LOG.info("Webhook relay started on port {}", getPort());
        LOG.info("Webhook endpoint: POST {}", WEBHOOK_PATH);
        LOG.info("View alerts: GET {}", ALERTS_PATH);
        LOG.info("Health check: GET {}", HEALTH_PATH);
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Webhook relay stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------

    private void route(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            String path = exchange.getRequestURI().getPath();

            if ("POST".equals(method) && WEBHOOK_PATH.equals(path)) {
                handleWebhook(exchange);
            } else if ("GET".equals(method) && ALERTS_PATH.equals(path)) {
                handleAlerts(exchange);
            } else if ("GET".equals(method) && HEALTH_PATH.equals(path)) {
                HttpExchanges.sendText(exchange, 200, "OK");
            } else if ("GET".equals(method) && "/".equals(path)) {
                handleIndex(exchange);
            } else {
                HttpExchanges.sendText(exchange, 404, "Not Found");
            }
        } finally {
            exchange.close();
        }
    }

    private void handleWebhook(HttpExchange exchange) throws IOException {
        JsonNode payload;
        try {
            payload = mapper.readTree(HttpExchanges.readBody(exchange));
        } catch (JsonProcessingException e) {
            rejectPayload(exchange, e.getOriginalMessage());
            return;
        }
        if (payload == null || payload.isMissingNode()) {
            rejectPayload(exchange, "empty request body");
            return;
        }

        ReceivedAlert alert = new ReceivedAlert(clock.instant(), payload);
        buffer.add(alert);

        LOG.info("Alert received at {}:\n{}", alert.getReceivedAt(),
                mapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload));
        logSummary(payload);

        sendStatus(exchange, 200, "success", "Alert received");
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        byte[] body = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(buffer.snapshot());
        HttpExchanges.send(exchange, 200, HttpExchanges.APPLICATION_JSON, body);
    }

    private void handleIndex(HttpExchange exchange) throws IOException {
        String html = "<html>\n"
                + "<head><title>Webhook Server</title></head>\n"
                + "<body>\n"
                + "    <h1>Mock Webhook Server</h1>\n"
                + "    <p>Webhook endpoint: POST " + WEBHOOK_PATH + "</p>\n"
                + "    <p>View alerts: <a href=\"" + ALERTS_PATH + "\">GET " + ALERTS_PATH + "</a></p>\n"
                + "    <p>Health check: <a href=\"" + HEALTH_PATH + "\">GET " + HEALTH_PATH + "</a></p>\n"
                + "    <hr>\n"
                + "    <p>Alerts received: " + buffer.size() + "</p>\n"
                + "</body>\n"
                + "</html>\n";
        HttpExchanges.send(exchange, 200, HttpExchanges.TEXT_HTML, html.getBytes(StandardCharsets.UTF_8));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Logs one line per entry of an Alertmanager {@code alerts} array. */
    private static void logSummary(JsonNode payload) {
        JsonNode alerts = payload.path("alerts");
        if (!alerts.isArray()) {
            return;
        }
        for (JsonNode alert : alerts) {
            JsonNode labels = alert.path("labels");
            LOG.info("  - {}: {} (severity: {}, service: {})",
                    labels.path("alertname").asText("Unknown"),
                    alert.path("status").asText("Unknown"),
                    labels.path("severity").asText("Unknown"),
                    labels.path("service").asText("N/A"));
        }
    }

    private void rejectPayload(HttpExchange exchange, String message) throws IOException {
        LOG.warn("Error processing alert: {}", message);
        sendStatus(exchange, 400, "error", message);
    }

    private void sendStatus(HttpExchange exchange, int code, String status, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("status", status);
        body.put("message", message);
        HttpExchanges.send(exchange, code, HttpExchanges.APPLICATION_JSON, mapper.writeValueAsBytes(body));
    }
}
