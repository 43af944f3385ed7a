package com.seriessentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Segment-level decision derived from the ordered point flags.
 *
 * <p>
 * The segment is anomalous when the flagged ratio reaches the ratio threshold
 * <strong>or</strong> the longest flagged run reaches the streak threshold.
 * An empty segment yields {@link #empty(double, int)}: never anomalous, both
 * statistics zero, and {@link #getReason()} set to {@value #REASON_EMPTY}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "is_segment_anomaly", "anomaly_ratio", "max_consecutive_anomaly", "rules", "reason" })
public final class SegmentVerdict {

    /** Reason marker attached to the verdict of an empty segment. */
    public static final String REASON_EMPTY = "empty";

    private final boolean segmentAnomaly;
    private final double anomalyRatio;
    private final int maxConsecutiveAnomaly;
    private final double ratioThreshold;
    private final int streakThreshold;
    private final String reason;

    private SegmentVerdict(boolean segmentAnomaly, double anomalyRatio, int maxConsecutiveAnomaly,
            double ratioThreshold, int streakThreshold, String reason) {
        this.segmentAnomaly = segmentAnomaly;
        this.anomalyRatio = anomalyRatio;
        this.maxConsecutiveAnomaly = maxConsecutiveAnomaly;
        this.ratioThreshold = ratioThreshold;
        this.streakThreshold = streakThreshold;
        this.reason = reason;
    }

    /**
     * Verdict for a non-empty segment.
     *
     * @param segmentAnomaly        combined decision of both rules
     * @param anomalyRatio          flagged / total, in [0, 1]
     * @param maxConsecutiveAnomaly longest run of flagged points
     * @param ratioThreshold        ratio rule threshold that was applied
     * @param streakThreshold       streak rule threshold that was applied
     * @return new verdict
     */
    public static SegmentVerdict of(boolean segmentAnomaly, double anomalyRatio, int maxConsecutiveAnomaly,
            double ratioThreshold, int streakThreshold) {
        return new SegmentVerdict(segmentAnomaly, anomalyRatio, maxConsecutiveAnomaly,
                ratioThreshold, streakThreshold, null);
    }

    /**
     * Fixed verdict for a segment without points.
     *
     * @param ratioThreshold  ratio rule threshold that was requested
     * @param streakThreshold streak rule threshold that was requested
     * @return non-anomalous verdict marked {@value #REASON_EMPTY}
     */
    public static SegmentVerdict empty(double ratioThreshold, int streakThreshold) {
        return new SegmentVerdict(false, 0.0, 0, ratioThreshold, streakThreshold, REASON_EMPTY);
    }

    @JsonProperty("is_segment_anomaly")
    public boolean isSegmentAnomaly() {
        return segmentAnomaly;
    }

    @JsonProperty("anomaly_ratio")
    public double getAnomalyRatio() {
        return anomalyRatio;
    }

    @JsonProperty("max_consecutive_anomaly")
    public int getMaxConsecutiveAnomaly() {
        return maxConsecutiveAnomaly;
    }

    public double getRatioThreshold() {
        return ratioThreshold;
    }

    public int getStreakThreshold() {
        return streakThreshold;
    }

    /**
     * The applied thresholds, keyed by their wire names.
     *
     * @return ordered map of {@code ratio_threshold} and {@code streak_threshold}
     */
    @JsonProperty("rules")
    public Map<String, Object> getRules() {
        Map<String, Object> rules = new LinkedHashMap<>();
        rules.put("ratio_threshold", ratioThreshold);
        rules.put("streak_threshold", streakThreshold);
        return rules;
    }

    /**
     * @return {@value #REASON_EMPTY} for an empty segment, {@code null} otherwise
     */
    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SegmentVerdict that))
            return false;
        return segmentAnomaly == that.segmentAnomaly
                && Double.compare(anomalyRatio, that.anomalyRatio) == 0
                && maxConsecutiveAnomaly == that.maxConsecutiveAnomaly
                && Double.compare(ratioThreshold, that.ratioThreshold) == 0
                && streakThreshold == that.streakThreshold
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentAnomaly, anomalyRatio, maxConsecutiveAnomaly,
                ratioThreshold, streakThreshold, reason);
    }

    @Override
    public String toString() {
        return "SegmentVerdict{" +
                "segmentAnomaly=" + segmentAnomaly +
                ", anomalyRatio=" + anomalyRatio +
                ", maxConsecutiveAnomaly=" + maxConsecutiveAnomaly +
                ", ratioThreshold=" + ratioThreshold +
                ", streakThreshold=" + streakThreshold +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                '}';
    }
}
