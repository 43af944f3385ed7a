package com.seriessentinel.core.detection;

import com.seriessentinel.core.config.DetectionSettings;
import com.seriessentinel.core.model.AnomalyInterval;
import com.seriessentinel.core.model.Observation;
import com.seriessentinel.core.model.PointResult;
import com.seriessentinel.core.model.SegmentReport;
import com.seriessentinel.core.model.SegmentVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs the full detection pipeline over one segment.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   observations
 *     → stable sort by timestamp
 *     → PointScorer (score + flag every point)
 *     → SegmentAggregator (ratio / streak verdict)
 *     → IntervalExtractor (only when the verdict is anomalous)
 * </pre>
 *
 * <p>
 * The aggregator and extractor always see the exact list the scorer
 * returned. Failures are all-or-nothing: {@link InvalidInputException}
 * propagates unchanged, any other runtime failure while scoring is wrapped
 * in a {@link ComputationFailureException}.
 * </p>
 *
 * @since 1.0.0
 */
public class SegmentDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentDetector.class);

    private final PointScorer scorer;
    private final SegmentAggregator aggregator;
    private final IntervalExtractor extractor;

    /**
     * Detector backed by an {@link IsolationForestScorer} shaped by
     * {@code settings}.
     *
     * @param settings forest shape; must not be {@code null}
     */
    public SegmentDetector(DetectionSettings settings) {
        this(new IsolationForestScorer(settings.getEstimators(), settings.getMaxSamples()),
                new SegmentAggregator(), new IntervalExtractor());
    }

    public SegmentDetector(PointScorer scorer, SegmentAggregator aggregator, IntervalExtractor extractor) {
        this.scorer = Objects.requireNonNull(scorer, "PointScorer must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "SegmentAggregator must not be null");
        this.extractor = Objects.requireNonNull(extractor, "IntervalExtractor must not be null");
    }

    /**
     * Detect anomalous intervals in a segment.
     *
     * @param observations raw points in any order; must not be {@code null}
     * @param settings     contamination, seed and segment thresholds
     * @return the scored points, verdict and intervals
     * @throws InvalidInputException       if the series or a parameter is
     *                                     invalid
     * @throws ComputationFailureException if scoring fails unexpectedly
     */
    public SegmentReport detect(List<Observation> observations, DetectionSettings settings) {
        Objects.requireNonNull(observations, "Observations must not be null");
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        SegmentAggregator.validateThresholds(settings.getRatioThreshold(), settings.getStreakThreshold());

        List<Observation> series = new ArrayList<>(observations);
        series.sort(Comparator.comparing(Observation::getTimestamp));

        List<PointResult> points = scoreSeries(series, settings);
        SegmentVerdict verdict = aggregator.aggregate(
                points, settings.getRatioThreshold(), settings.getStreakThreshold());
        List<AnomalyInterval> intervals = verdict.isSegmentAnomaly()
                ? extractor.extract(points)
                : List.of();

        LOG.debug("Segment detection finished: {} point(s), verdict={}, {} interval(s)",
                points.size(), verdict, intervals.size());
        return new SegmentReport(points, verdict, intervals);
    }

    private List<PointResult> scoreSeries(List<Observation> series, DetectionSettings settings) {
        try {
            return scorer.score(series, settings.getContamination(), settings.getRandomState());
        } catch (DetectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationFailureException("Scoring failed for a series of " + series.size() + " point(s)", e);
        }
    }
}
