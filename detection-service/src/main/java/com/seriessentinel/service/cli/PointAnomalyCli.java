package com.seriessentinel.service.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seriessentinel.core.detection.InvalidInputException;
import com.seriessentinel.core.detection.IsolationForestScorer;
import com.seriessentinel.core.detection.PointScorer;
import com.seriessentinel.core.model.Observation;
import com.seriessentinel.core.model.PointResult;
import com.seriessentinel.service.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command-line point scoring of a JSON time series.
 *
 * <pre>
 * point-anomalies --input series.json --output result.json
 *                 [--contamination 0.05] [--random_state 42]
 * </pre>
 *
 * <p>
 * The input must be an object with a {@code data} array of
 * {@code {timestamp, value}} records. Records are sorted by timestamp; records
 * whose value is not numeric are dropped, and a file left with no numeric
 * record is invalid input. The output holds the run metadata
 * and one {@code {timestamp, value, score, is_anomaly}} entry per kept point.
 * </p>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_OK} – results written</li>
 * <li>{@value #EXIT_INVALID_INPUT} – the input file or its content is
 * unusable</li>
 * <li>{@value #EXIT_USAGE} – bad command-line arguments</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PointAnomalyCli {

    private static final Logger LOG = LoggerFactory.getLogger(PointAnomalyCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "usage: point-anomalies --input <file> --output <file>"
            + " [--contamination <0-0.5>] [--random_state <int>]";

    private final PointScorer scorer;
    private final ObjectMapper mapper;
    private final PrintStream err;

    public PointAnomalyCli(PointScorer scorer, ObjectMapper mapper, PrintStream err) {
        this.scorer = Objects.requireNonNull(scorer, "PointScorer must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.err = Objects.requireNonNull(err, "PrintStream must not be null");
    }

    public static void main(String[] args) {
        PointAnomalyCli cli = new PointAnomalyCli(
                new IsolationForestScorer(), JsonSupport.newObjectMapper(), System.err);
        System.exit(cli.run(args));
    }

    /**
     * Run the tool.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    public int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            List<Observation> series = load(arguments.input);
            List<PointResult> results = scorer.score(series, arguments.contamination, arguments.randomState);
            write(arguments, results);
            LOG.info("Wrote {} scored point(s) to {}", results.size(), arguments.output);
            return EXIT_OK;
        } catch (InvalidInputException e) {
            err.println("invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IOException e) {
            LOG.error("I/O failure while scoring {}", arguments.input, e);
            err.println("i/o error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }

    /**
     * Read and clean the series: stable sort by timestamp, non-numeric values
     * dropped.
     */
    List<Observation> load(Path input) throws IOException {
        JsonNode root = mapper.readTree(input.toFile());
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            throw new InvalidInputException("input JSON is missing timestamp or value fields");
        }

        List<Observation> series = new ArrayList<>();
        int dropped = 0;
        for (JsonNode record : data) {
            if (!record.has("timestamp") || !record.has("value")) {
                throw new InvalidInputException("input JSON is missing timestamp or value fields");
            }
            Double value = numericValue(record.get("value"));
            if (value == null) {
                dropped++;
                continue;
            }
            series.add(new Observation(record.get("timestamp").asText(), value));
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} record(s) with non-numeric values", dropped);
        }
        if (series.isEmpty()) {
            throw new InvalidInputException("input JSON has no records with a numeric value");
        }

        series.sort(Comparator.comparing(Observation::getTimestamp));
        return series;
    }

    private static Double numericValue(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                double parsed = Double.parseDouble(node.asText().trim());
                return Double.isNaN(parsed) ? null : parsed;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private void write(Arguments arguments, List<PointResult> results) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("method", "IsolationForest");
        metadata.put("contamination", arguments.contamination);
        metadata.put("random_state", arguments.randomState);
        metadata.put("total_points", results.size());

        ObjectNode out = mapper.createObjectNode();
        out.set("metadata", mapper.valueToTree(metadata));
        out.set("point_anomalies", mapper.valueToTree(results));

        Files.write(arguments.output, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(out));
    }

    // ---------------------------------------------------------------
    // Argument parsing
    // ---------------------------------------------------------------

    static final class Arguments {
        private Path input;
        private Path output;
        private double contamination = 0.05;
        private long randomState = 42;

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            for (int i = 0; i < args.length; i++) {
                String name = args[i];
                String value;
                int eq = name.indexOf('=');
                if (name.startsWith("--") && eq > 0) {
                    value = name.substring(eq + 1);
                    name = name.substring(0, eq);
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    throw new IllegalArgumentException("missing value for " + name);
                }

                switch (name) {
                    case "--input" -> parsed.input = Path.of(value);
                    case "--output" -> parsed.output = Path.of(value);
                    case "--contamination" -> parsed.contamination = parseDouble(name, value);
                    case "--random_state" -> parsed.randomState = parseLong(name, value);
                    default -> throw new IllegalArgumentException("unrecognized argument: " + name);
                }
            }
            if (parsed.input == null || parsed.output == null) {
                throw new IllegalArgumentException("the following arguments are required: --input, --output");
            }
            return parsed;
        }

        private static double parseDouble(String name, String value) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid float value for " + name + ": '" + value + "'", e);
            }
        }

        private static long parseLong(String name, String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid int value for " + name + ": '" + value + "'", e);
            }
        }
    }
}
