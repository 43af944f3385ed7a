/**
 * Segment anomaly detection engine.
 *
 * <p>
 * {@link com.seriessentinel.core.detection.SegmentDetector} chains three
 * stages over one ordered series:
 * </p>
 * <ul>
 * <li>{@link com.seriessentinel.core.detection.PointScorer} — per-point score
 * and flag; the built-in implementation is
 * {@link com.seriessentinel.core.detection.IsolationForestScorer}</li>
 * <li>{@link com.seriessentinel.core.detection.SegmentAggregator} — ratio OR
 * streak verdict for the whole segment</li>
 * <li>{@link com.seriessentinel.core.detection.IntervalExtractor} — maximal
 * runs of flagged points as timestamp ranges</li>
 * </ul>
 *
 * <p>
 * Errors are reported as subclasses of
 * {@link com.seriessentinel.core.detection.DetectionException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.detection;
