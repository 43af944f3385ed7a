package com.seriessentinel.core.detection;

import com.seriessentinel.core.model.AnomalyInterval;
import com.seriessentinel.core.model.PointResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collapses ordered point flags into maximal runs of flagged points.
 *
 * <p>
 * Runs are defined by adjacency in the sequence only. Two flagged neighbours
 * belong to one run no matter how far apart their timestamps are.
 * </p>
 *
 * @since 1.0.0
 */
public class IntervalExtractor {

    /**
     * @param results point results in scoring order; must not be {@code null}
     * @return one interval per run, in order of occurrence
     */
    public List<AnomalyInterval> extract(List<PointResult> results) {
        Objects.requireNonNull(results, "Results must not be null");

        List<AnomalyInterval> intervals = new ArrayList<>();
        int n = results.size();
        int i = 0;
        while (i < n) {
            if (!results.get(i).isAnomaly()) {
                i++;
                continue;
            }
            int start = i;
            while (i < n && results.get(i).isAnomaly()) {
                i++;
            }
            intervals.add(new AnomalyInterval(results.get(start).getTimestamp(), results.get(i - 1).getTimestamp()));
        }
        return Collections.unmodifiableList(intervals);
    }
}
