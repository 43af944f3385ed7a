package com.seriessentinel.core.detection;

import com.seriessentinel.core.model.Observation;
import com.seriessentinel.core.model.PointResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

/**
 * Isolation Forest point scorer over the value axis of a series.
 *
 * <p>
 * A forest of random isolation trees is grown on subsamples of the series.
 * Outliers are separated by fewer random splits, so their average path length
 * is short. The raw score of a point is {@code -2^(-E[h(x)] / c(psi))} where
 * {@code psi} is the subsample size; the decision offset is the
 * {@code contamination} quantile of the raw scores of the fitted series.
 * The reported score is {@code raw - offset}, and a point is flagged when it
 * is negative.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * A single {@link SplittableRandom} seeded from the caller's seed is split
 * once per tree, in tree order, before any tree is grown. Trees are then grown
 * in parallel, but path lengths are summed in tree order, so the output is
 * bit-identical for identical arguments regardless of scheduling.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This scorer is <strong>stateless</strong>: every call fits a new forest
 * and discards it afterwards. A single instance may be shared across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestScorer implements PointScorer {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestScorer.class);

    /** Default number of trees in the forest. */
    public static final int DEFAULT_ESTIMATORS = 200;

    /** Default upper bound on the per-tree subsample size. */
    public static final int DEFAULT_MAX_SAMPLES = 256;

    /** Smallest series the forest can be fitted on. */
    public static final int MIN_SERIES_SIZE = 2;

    /** Upper bound of the accepted contamination range (inclusive). */
    public static final double MAX_CONTAMINATION = 0.5;

    private final int estimators;
    private final int maxSamples;

    public IsolationForestScorer() {
        this(DEFAULT_ESTIMATORS, DEFAULT_MAX_SAMPLES);
    }

    /**
     * @param estimators number of trees; must be &gt;= 1
     * @param maxSamples upper bound on the subsample drawn for each tree; must
     *                   be &gt;= 2
     * @throws IllegalArgumentException if either value is out of range
     */
    public IsolationForestScorer(int estimators, int maxSamples) {
        if (estimators < 1) {
            throw new IllegalArgumentException("estimators must be >= 1, got: " + estimators);
        }
        if (maxSamples < MIN_SERIES_SIZE) {
            throw new IllegalArgumentException(
                    "maxSamples must be >= " + MIN_SERIES_SIZE + ", got: " + maxSamples);
        }
        this.estimators = estimators;
        this.maxSamples = maxSamples;
    }

    @Override
    public List<PointResult> score(List<Observation> series, double contamination, long seed) {
        Objects.requireNonNull(series, "Series must not be null");
        validateContamination(contamination);

        if (series.isEmpty()) {
            return Collections.emptyList();
        }
        if (series.size() < MIN_SERIES_SIZE) {
            throw new InvalidInputException("Series must contain at least " + MIN_SERIES_SIZE
                    + " points to be scored, got: " + series.size());
        }

        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            Observation observation = Objects.requireNonNull(series.get(i), "Observation at index " + i + " is null");
            double value = observation.getValue();
            if (!Double.isFinite(value)) {
                throw new InvalidInputException("Value at timestamp '" + observation.getTimestamp()
                        + "' is not a finite number: " + value);
            }
            values[i] = value;
        }

        double[] rawScores = rawScores(values, seed);
        double offset = percentile(rawScores, 100.0 * contamination);

        List<PointResult> results = new ArrayList<>(values.length);
        int flagged = 0;
        for (int i = 0; i < values.length; i++) {
            double decision = rawScores[i] - offset;
            boolean anomaly = decision < 0;
            if (anomaly) {
                flagged++;
            }
            results.add(new PointResult(series.get(i).getTimestamp(), values[i], decision, anomaly));
        }

        LOG.debug("Scored {} point(s) with {} tree(s): offset={} flagged={} contamination={} seed={}",
                values.length, estimators, offset, flagged, contamination, seed);
        return Collections.unmodifiableList(results);
    }

    public int getEstimators() {
        return estimators;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    // ---------------------------------------------------------------
    // Forest
    // ---------------------------------------------------------------

    private double[] rawScores(double[] values, long seed) {
        int subsampleSize = Math.min(maxSamples, values.length);
        int heightLimit = (int) Math.ceil(Math.log(subsampleSize) / Math.log(2));

        SplittableRandom master = new SplittableRandom(seed);
        SplittableRandom[] treeRandoms = new SplittableRandom[estimators];
        for (int t = 0; t < estimators; t++) {
            treeRandoms[t] = master.split();
        }

        List<IsolationTree> forest = IntStream.range(0, estimators)
                .parallel()
                .mapToObj(t -> IsolationTree.grow(
                        subsample(values, subsampleSize, treeRandoms[t]), heightLimit, treeRandoms[t]))
                .toList();

        double normaliser = IsolationTree.averagePathLength(subsampleSize);
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double pathSum = 0.0;
            for (IsolationTree tree : forest) {
                pathSum += tree.pathLength(values[i]);
            }
            double meanPath = pathSum / forest.size();
            scores[i] = -Math.pow(2.0, -meanPath / normaliser);
        }
        return scores;
    }

    /** Draws {@code size} values without replacement (partial Fisher-Yates over indices). */
    private static double[] subsample(double[] values, int size, SplittableRandom random) {
        int[] indices = new int[values.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[] sample = new double[size];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = values[indices[i]];
        }
        return sample;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void validateContamination(double contamination) {
        if (!(contamination > 0.0 && contamination <= MAX_CONTAMINATION)) {
            throw new InvalidInputException(
                    "contamination must be in (0, " + MAX_CONTAMINATION + "], got: " + contamination);
        }
    }

    /** Percentile with linear interpolation between closest ranks. */
    static double percentile(double[] data, double percent) {
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        double rank = percent / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    @Override
    public String toString() {
        return "IsolationForestScorer{" +
                "estimators=" + estimators +
                ", maxSamples=" + maxSamples +
                '}';
    }
}
