package com.seriessentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Per-point output of the point scorer.
 *
 * <p>
 * {@code score} follows the "lower is more anomalous" convention: it is the
 * isolation score shifted by the contamination offset, so a point is flagged
 * exactly when its score is negative. The flag is the scorer's own decision,
 * never a caller-supplied cut on the score.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "value", "score", "is_anomaly" })
public final class PointResult {

    private final String timestamp;
    private final double value;
    private final double score;
    private final boolean anomaly;

    public PointResult(String timestamp, double value, double score, boolean anomaly) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.score = score;
        this.anomaly = anomaly;
    }

    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("is_anomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PointResult that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && anomaly == that.anomaly
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, score, anomaly);
    }

    @Override
    public String toString() {
        return "PointResult{" +
                "timestamp='" + timestamp + '\'' +
                ", value=" + value +
                ", score=" + score +
                ", anomaly=" + anomaly +
                '}';
    }
}
