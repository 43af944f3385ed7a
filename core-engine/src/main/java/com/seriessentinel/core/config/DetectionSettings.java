package com.seriessentinel.core.config;

import com.seriessentinel.core.detection.IsolationForestScorer;
import com.seriessentinel.core.detection.SegmentAggregator;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one run of the detection pipeline.
 *
 * <p>
 * Loaded from YAML as the service-wide defaults, then copied and overridden
 * per request. Expected YAML structure:
 * </p>
 *
 * <pre>
 * contamination: 0.05
 * randomState: 42
 * ratioThreshold: 0.20
 * streakThreshold: 20
 * estimators: 200
 * maxSamples: 256
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value is in range.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    /** Expected fraction of outliers, in (0, 0.5]. */
    private double contamination = 0.05;

    /** Seed for every random choice of the point scorer. */
    private long randomState = 42;

    // --- Segment rules ---
    private double ratioThreshold = SegmentAggregator.DEFAULT_RATIO_THRESHOLD;
    private int streakThreshold = SegmentAggregator.DEFAULT_STREAK_THRESHOLD;

    // --- Forest shape ---
    private int estimators = IsolationForestScorer.DEFAULT_ESTIMATORS;
    private int maxSamples = IsolationForestScorer.DEFAULT_MAX_SAMPLES;

    /**
     * Validate that every value is within its legal range.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(contamination > 0.0 && contamination <= IsolationForestScorer.MAX_CONTAMINATION)) {
            errors.add("'contamination' must be in (0, 0.5], got: " + contamination);
        }
        if (!(ratioThreshold >= 0.0 && ratioThreshold <= 1.0)) {
            errors.add("'ratioThreshold' must be in [0, 1], got: " + ratioThreshold);
        }
        if (streakThreshold < 1) {
            errors.add("'streakThreshold' must be >= 1, got: " + streakThreshold);
        }
        if (estimators < 1) {
            errors.add("'estimators' must be >= 1, got: " + estimators);
        }
        if (maxSamples < IsolationForestScorer.MIN_SERIES_SIZE) {
            errors.add("'maxSamples' must be >= " + IsolationForestScorer.MIN_SERIES_SIZE + ", got: " + maxSamples);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionSettings: " + String.join("; ", errors));
        }
    }

    /**
     * @return an independent copy that can be overridden per request
     */
    public DetectionSettings copy() {
        DetectionSettings copy = new DetectionSettings();
        copy.contamination = contamination;
        copy.randomState = randomState;
        copy.ratioThreshold = ratioThreshold;
        copy.streakThreshold = streakThreshold;
        copy.estimators = estimators;
        copy.maxSamples = maxSamples;
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getRandomState() {
        return randomState;
    }

    public void setRandomState(long randomState) {
        this.randomState = randomState;
    }

    public double getRatioThreshold() {
        return ratioThreshold;
    }

    public void setRatioThreshold(double ratioThreshold) {
        this.ratioThreshold = ratioThreshold;
    }

    public int getStreakThreshold() {
        return streakThreshold;
    }

    public void setStreakThreshold(int streakThreshold) {
        this.streakThreshold = streakThreshold;
    }

    public int getEstimators() {
        return estimators;
    }

    public void setEstimators(int estimators) {
        this.estimators = estimators;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "contamination=" + contamination +
                ", randomState=" + randomState +
                ", ratioThreshold=" + ratioThreshold +
                ", streakThreshold=" + streakThreshold +
                ", estimators=" + estimators +
                ", maxSamples=" + maxSamples +
                '}';
    }
}
