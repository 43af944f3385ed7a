package com.seriessentinel.core.detection;

import com.seriessentinel.core.model.Observation;
import com.seriessentinel.core.model.PointResult;

import java.util.List;

/**
 * Contract for point-level outlier scorers.
 *
 * <p>
 * Implementations fit their model on the full series passed to each call and
 * keep nothing between calls. All internal randomness must derive from the
 * {@code seed} argument so that identical arguments yield identical results.
 * </p>
 */
public interface PointScorer {

    /**
     * Score every observation of a series.
     *
     * @param series        observations in the order they should be reported
     * @param contamination expected outlier fraction, in (0, 0.5]
     * @param seed          source of all randomness used by the fit
     * @return one result per observation, in input order; empty for an empty
     *         series
     * @throws InvalidInputException if a value is not finite, the contamination
     *                               is out of range, or the series is too short
     *                               to fit
     */
    List<PointResult> score(List<Observation> series, double contamination, long seed);
}
