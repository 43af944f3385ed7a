package com.seriessentinel.core.detection;

import com.seriessentinel.core.model.PointResult;
import com.seriessentinel.core.model.SegmentVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Turns ordered point flags into a segment-level verdict.
 *
 * <p>
 * Two independent rules are evaluated and combined with OR:
 * </p>
 * <ul>
 * <li><b>ratio</b> — flagged / total &gt;= {@code ratioThreshold}; catches a
 * diffuse elevated outlier rate</li>
 * <li><b>streak</b> — longest run of consecutive flagged points &gt;=
 * {@code streakThreshold}; catches one long localised anomaly</li>
 * </ul>
 *
 * <p>
 * Thresholds outside their ranges ({@code ratioThreshold} in [0, 1],
 * {@code streakThreshold} &gt;= 1) are rejected with
 * {@link InvalidInputException}, also for an empty segment.
 * </p>
 *
 * @since 1.0.0
 */
public class SegmentAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentAggregator.class);

    public static final double DEFAULT_RATIO_THRESHOLD = 0.20;
    public static final int DEFAULT_STREAK_THRESHOLD = 20;

    /**
     * Aggregate the flags of an ordered result sequence.
     *
     * @param results         point results in scoring order; must not be
     *                        {@code null}
     * @param ratioThreshold  minimum flagged ratio that makes the segment
     *                        anomalous
     * @param streakThreshold minimum run length that makes the segment
     *                        anomalous
     * @return the verdict; {@link SegmentVerdict#empty(double, int)} for an
     *         empty sequence
     * @throws InvalidInputException if a threshold is out of range
     */
    public SegmentVerdict aggregate(List<PointResult> results, double ratioThreshold, int streakThreshold) {
        Objects.requireNonNull(results, "Results must not be null");
        validateThresholds(ratioThreshold, streakThreshold);

        int total = results.size();
        if (total == 0) {
            return SegmentVerdict.empty(ratioThreshold, streakThreshold);
        }

        int flagged = 0;
        int maxStreak = 0;
        int currentStreak = 0;
        for (PointResult result : results) {
            if (result.isAnomaly()) {
                flagged++;
                currentStreak++;
                maxStreak = Math.max(maxStreak, currentStreak);
            } else {
                currentStreak = 0;
            }
        }

        double ratio = (double) flagged / total;
        boolean anomalous = ratio >= ratioThreshold || maxStreak >= streakThreshold;

        LOG.debug("Segment of {} point(s): ratio={} maxStreak={} -> anomalous={}",
                total, ratio, maxStreak, anomalous);
        return SegmentVerdict.of(anomalous, ratio, maxStreak, ratioThreshold, streakThreshold);
    }

    static void validateThresholds(double ratioThreshold, int streakThreshold) {
        if (!(ratioThreshold >= 0.0 && ratioThreshold <= 1.0)) {
            throw new InvalidInputException("ratio_threshold must be in [0, 1], got: " + ratioThreshold);
        }
        if (streakThreshold < 1) {
            throw new InvalidInputException("streak_threshold must be >= 1, got: " + streakThreshold);
        }
    }
}
