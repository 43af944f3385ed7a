package com.seriessentinel.service.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seriessentinel.service.JsonSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link WebhookRelayServer}.
 */
class WebhookRelayServerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private static final String ALERTMANAGER_PAYLOAD = "{"
            + "\"status\":\"firing\","
            + "\"alerts\":[{\"status\":\"firing\","
            + "\"labels\":{\"alertname\":\"HighLatency\",\"severity\":\"critical\",\"service\":\"checkout\"}}]"
            + "}";

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private AlertBuffer buffer;
    private WebhookRelayServer server;

    @BeforeEach
    void setUp() {
        buffer = new AlertBuffer(10);
        server = new WebhookRelayServer(buffer, mapper, Clock.fixed(NOW, ZoneOffset.UTC), 2);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should store a webhook payload and list it with its arrival time")
    void shouldStoreAndListAlert() throws Exception {
        HttpResponse<String> posted = post(ALERTMANAGER_PAYLOAD);

        assertThat(posted.statusCode()).isEqualTo(200);
        JsonNode ack = mapper.readTree(posted.body());
        assertThat(ack.path("status").asText()).isEqualTo("success");
        assertThat(ack.path("message").asText()).isEqualTo("Alert received");

        HttpResponse<String> listed = get(WebhookRelayServer.ALERTS_PATH);
        assertThat(listed.statusCode()).isEqualTo(200);
        JsonNode alerts = mapper.readTree(listed.body());
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).path("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(alerts.get(0).path("data").path("alerts").get(0).path("labels").path("alertname").asText())
                .isEqualTo("HighLatency");
    }

    @Test
    @DisplayName("Should answer 400 for a malformed payload and keep serving")
    void shouldRejectMalformedPayload() throws Exception {
        HttpResponse<String> rejected = post("{broken");

        assertThat(rejected.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(rejected.body()).path("status").asText()).isEqualTo("error");
        assertThat(buffer.size()).isZero();

        assertThat(post("{\"alerts\":[]}").statusCode()).isEqualTo(200);
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should answer 400 for an empty body")
    void shouldRejectEmptyBody() throws Exception {
        assertThat(post("").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Health check should answer plain OK")
    void shouldAnswerHealth() throws Exception {
        HttpResponse<String> response = get(WebhookRelayServer.HEALTH_PATH);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }

    @Test
    @DisplayName("Index page should show the number of alerts received")
    void shouldRenderIndex() throws Exception {
        post(ALERTMANAGER_PAYLOAD);
        post(ALERTMANAGER_PAYLOAD);

        HttpResponse<String> response = get("/");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                type -> assertThat(type).startsWith("text/html"));
        assertThat(response.body()).contains("Alerts received: 2");
    }

    @Test
    @DisplayName("Unknown paths and methods should get 404")
    void shouldAnswerNotFound() throws Exception {
        assertThat(get("/nope").statusCode()).isEqualTo(404);
        assertThat(get(WebhookRelayServer.WEBHOOK_PATH).statusCode()).isEqualTo(404);
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(WebhookRelayServer.WEBHOOK_PATH))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }
}
