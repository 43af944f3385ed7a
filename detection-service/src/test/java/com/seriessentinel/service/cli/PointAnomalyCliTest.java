package com.seriessentinel.service.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seriessentinel.core.detection.IsolationForestScorer;
import com.seriessentinel.service.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PointAnomalyCli} against files in a temporary directory.
 */
class PointAnomalyCliTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private PointAnomalyCli cli;
    private Path output;

    @BeforeEach
    void setUp() {
        cli = new PointAnomalyCli(new IsolationForestScorer(), mapper,
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
        output = tempDir.resolve("out.json");
    }

    @Test
    @DisplayName("Should score every point and flag the outlier")
    void shouldScoreSeries() throws IOException {
        Path input = write(series(20, 17));

        int exit = cli.run(new String[] {"--input", input.toString(), "--output", output.toString()});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_OK);
        JsonNode result = mapper.readTree(output.toFile());
        assertThat(result.path("metadata").path("method").asText()).isEqualTo("IsolationForest");
        assertThat(result.path("metadata").path("contamination").asDouble()).isEqualTo(0.05);
        assertThat(result.path("metadata").path("random_state").asLong()).isEqualTo(42L);
        assertThat(result.path("metadata").path("total_points").asInt()).isEqualTo(20);

        JsonNode points = result.path("point_anomalies");
        assertThat(points).hasSize(20);
        assertThat(points.get(17).path("is_anomaly").asBoolean()).isTrue();
        assertThat(points.get(17).path("score").asDouble()).isNegative();
        assertThat(points.get(0).path("is_anomaly").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Should accept --name=value arguments and echo them in metadata")
    void shouldAcceptEqualsSyntax() throws IOException {
        Path input = write(series(20, 3));

        int exit = cli.run(new String[] {
                "--input=" + input, "--output=" + output, "--contamination=0.1", "--random_state=7"});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_OK);
        JsonNode metadata = mapper.readTree(output.toFile()).path("metadata");
        assertThat(metadata.path("contamination").asDouble()).isEqualTo(0.1);
        assertThat(metadata.path("random_state").asLong()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Should drop non-numeric values and sort by timestamp")
    void shouldCleanInput() throws IOException {
        Path input = write("{\"data\":["
                + "{\"timestamp\":\"2024-01-01T00:03:00Z\",\"value\":3.0},"
                + "{\"timestamp\":\"2024-01-01T00:01:00Z\",\"value\":\"1.5\"},"
                + "{\"timestamp\":\"2024-01-01T00:02:00Z\",\"value\":\"n/a\"},"
                + "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":null}"
                + "]}");

        int exit = cli.run(new String[] {"--input", input.toString(), "--output", output.toString()});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_OK);
        JsonNode points = mapper.readTree(output.toFile()).path("point_anomalies");
        assertThat(points).hasSize(2);
        assertThat(points.get(0).path("timestamp").asText()).isEqualTo("2024-01-01T00:01:00Z");
        assertThat(points.get(0).path("value").asDouble()).isEqualTo(1.5);
        assertThat(points.get(1).path("timestamp").asText()).isEqualTo("2024-01-01T00:03:00Z");
    }

    @Test
    @DisplayName("Should fail with invalid input when records lack a value field")
    void shouldRejectMissingFields() throws IOException {
        Path input = write("{\"data\":[{\"timestamp\":\"2024-01-01T00:00:00Z\"}]}");

        int exit = cli.run(new String[] {"--input", input.toString(), "--output", output.toString()});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_INVALID_INPUT);
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("missing timestamp or value");
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("Should fail with invalid input for an empty data array")
    void shouldRejectEmptyData() throws IOException {
        Path input = write("{\"data\":[]}");

        int exit = cli.run(new String[] {"--input", input.toString(), "--output", output.toString()});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_INVALID_INPUT);
    }

    @Test
    @DisplayName("Should fail with invalid input when no record has a numeric value")
    void shouldRejectAllNonNumeric() throws IOException {
        Path input = write("{\"data\":["
                + "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":\"n/a\"},"
                + "{\"timestamp\":\"2024-01-01T00:01:00Z\",\"value\":null}"
                + "]}");

        int exit = cli.run(new String[] {"--input", input.toString(), "--output", output.toString()});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_INVALID_INPUT);
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("no records with a numeric value");
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("Should fail when the input file does not exist")
    void shouldFailOnMissingFile() {
        int exit = cli.run(new String[] {
                "--input", tempDir.resolve("absent.json").toString(), "--output", output.toString()});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_INVALID_INPUT);
    }

    @Test
    @DisplayName("Should print usage when required arguments are missing")
    void shouldPrintUsage() {
        int exit = cli.run(new String[] {"--contamination", "0.1"});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_USAGE);
        assertThat(errBytes.toString(StandardCharsets.UTF_8)).contains("usage:");
    }

    @Test
    @DisplayName("Should print usage for an unparseable contamination")
    void shouldRejectBadContaminationArgument() {
        int exit = cli.run(new String[] {"--input", "a", "--output", "b", "--contamination", "lots"});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_USAGE);
    }

    @Test
    @DisplayName("Should report contamination out of range as invalid input")
    void shouldRejectContaminationOutOfRange() throws IOException {
        Path input = write(series(20, 3));

        int exit = cli.run(new String[] {
                "--input", input.toString(), "--output", output.toString(), "--contamination", "0.8"});

        assertThat(exit).isEqualTo(PointAnomalyCli.EXIT_INVALID_INPUT);
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private Path write(String json) throws IOException {
        Path input = tempDir.resolve("in.json");
        Files.writeString(input, json);
        return input;
    }

    private static String series(int size, int outlierIndex) {
        StringBuilder json = new StringBuilder("{\"data\":[");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                json.append(',');
            }
            double value = i == outlierIndex ? 1000.0 : 10.0 + (i % 3) * 0.1;
            json.append(String.format("{\"timestamp\":\"2024-01-01T00:%02d:00Z\",\"value\":%s}", i, value));
        }
        return json.append("]}").toString();
    }
}
