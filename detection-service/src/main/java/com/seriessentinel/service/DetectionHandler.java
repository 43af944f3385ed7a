package com.seriessentinel.service;

import com.seriessentinel.core.config.DetectionSettings;
import com.seriessentinel.core.detection.ComputationFailureException;
import com.seriessentinel.core.detection.InvalidInputException;
import com.seriessentinel.core.detection.SegmentDetector;
import com.seriessentinel.core.model.Observation;
import com.seriessentinel.core.model.SegmentReport;
import com.seriessentinel.service.api.DataPoint;
import com.seriessentinel.service.api.DetectRequest;
import com.seriessentinel.service.api.DetectResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a {@link DetectRequest} onto one run of the {@link SegmentDetector}.
 *
 * <p>
 * Every request gets its own copy of the default {@link DetectionSettings}
 * with the request's overrides applied; no fitted model or other state is
 * kept between requests.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionHandler.class);

    private final SegmentDetector detector;
    private final DetectionSettings defaults;
    private final DetectionMetrics metrics;

    /**
     * @param defaults validated service-wide defaults; also shape the forest
     * @param metrics  meters updated on every request
     */
    public DetectionHandler(DetectionSettings defaults, DetectionMetrics metrics) {
        this(new SegmentDetector(defaults), defaults, metrics);
    }

    public DetectionHandler(SegmentDetector detector, DetectionSettings defaults, DetectionMetrics metrics) {
        this.detector = Objects.requireNonNull(detector, "SegmentDetector must not be null");
        this.defaults = Objects.requireNonNull(defaults, "DetectionSettings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "DetectionMetrics must not be null");
    }

    /**
     * Run detection for one request.
     *
     * @param request parsed request body
     * @return metadata echo and anomalous intervals
     * @throws InvalidInputException       if the request shape or a parameter
     *                                     is invalid
     * @throws ComputationFailureException if scoring fails unexpectedly
     */
    public DetectResponse detect(DetectRequest request) {
        long startNanos = System.nanoTime();
        metrics.incrementRequests();
        try {
            List<Observation> observations = toObservations(request);
            DetectionSettings settings = effectiveSettings(request);

            SegmentReport report = detector.detect(observations, settings);
            if (report.getVerdict().isSegmentAnomaly()) {
                metrics.incrementSegmentAnomalies();
            }

            LOG.info("Detection finished: points={} anomalous={} ratio={} maxStreak={} intervals={}",
                    observations.size(),
                    report.getVerdict().isSegmentAnomaly(),
                    report.getVerdict().getAnomalyRatio(),
                    report.getVerdict().getMaxConsecutiveAnomaly(),
                    report.getIntervals().size());
            return new DetectResponse(request.getMetadata(), report.getIntervals());
        } catch (InvalidInputException e) {
            metrics.incrementInvalidInputs();
            throw e;
        } catch (ComputationFailureException e) {
            metrics.incrementComputationFailures();
            throw e;
        } finally {
            metrics.recordLatency(System.nanoTime() - startNanos);
        }
    }

    private static List<Observation> toObservations(DetectRequest request) {
        if (request == null) {
            throw new InvalidInputException("Request body is required");
        }
        if (request.getData() == null) {
            throw new InvalidInputException("Field 'data' is required");
        }

        List<Observation> observations = new ArrayList<>(request.getData().size());
        for (int i = 0; i < request.getData().size(); i++) {
            DataPoint point = request.getData().get(i);
            if (point == null || point.getTimestamp() == null || point.getValue() == null) {
                throw new InvalidInputException(
                        "data points must include timestamp and value (index " + i + ")");
            }
            observations.add(new Observation(point.getTimestamp(), point.getValue()));
        }
        return observations;
    }

    private DetectionSettings effectiveSettings(DetectRequest request) {
        DetectionSettings settings = defaults.copy();
        if (request.getContamination() != null) {
            settings.setContamination(request.getContamination());
        }
        if (request.getRandomState() != null) {
            settings.setRandomState(request.getRandomState());
        }
        if (request.getRatioThreshold() != null) {
            settings.setRatioThreshold(request.getRatioThreshold());
        }
        if (request.getStreakThreshold() != null) {
            settings.setStreakThreshold(request.getStreakThreshold());
        }
        return settings;
    }
}
