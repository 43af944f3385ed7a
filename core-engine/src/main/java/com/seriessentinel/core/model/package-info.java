/**
 * Domain model classes for Series Sentinel.
 *
 * <p>
 * All types are immutable and request-scoped:
 * </p>
 * <ul>
 * <li>{@link com.seriessentinel.core.model.Observation} — raw time-series
 * point</li>
 * <li>{@link com.seriessentinel.core.model.PointResult} — scored and flagged
 * point</li>
 * <li>{@link com.seriessentinel.core.model.SegmentVerdict} — segment-level
 * decision</li>
 * <li>{@link com.seriessentinel.core.model.AnomalyInterval} — contiguous run of
 * flagged points</li>
 * <li>{@link com.seriessentinel.core.model.SegmentReport} — everything one
 * detection run produced</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.model;
