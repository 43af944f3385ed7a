package com.seriessentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything one run of the pipeline produced for a segment: the scored
 * points in timestamp order, the verdict, and the extracted intervals (empty
 * unless the verdict is anomalous).
 *
 * @since 1.0.0
 */
public final class SegmentReport {

    private final List<PointResult> points;
    private final SegmentVerdict verdict;
    private final List<AnomalyInterval> intervals;

    public SegmentReport(List<PointResult> points, SegmentVerdict verdict, List<AnomalyInterval> intervals) {
        this.points = List.copyOf(Objects.requireNonNull(points, "points must not be null"));
        this.verdict = Objects.requireNonNull(verdict, "verdict must not be null");
        this.intervals = List.copyOf(Objects.requireNonNull(intervals, "intervals must not be null"));
    }

    public List<PointResult> getPoints() {
        return points;
    }

    public SegmentVerdict getVerdict() {
        return verdict;
    }

    public List<AnomalyInterval> getIntervals() {
        return intervals;
    }

    @Override
    public String toString() {
        return "SegmentReport{" +
                "points=" + points.size() +
                ", verdict=" + verdict +
                ", intervals=" + intervals +
                '}';
    }
}
