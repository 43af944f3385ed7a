package com.seriessentinel.core.model;

import java.util.Objects;

/**
 * A single raw point of a univariate time series.
 *
 * <p>
 * Timestamps are opaque strings (ISO-8601 in practice). They are compared
 * lexicographically and never parsed, so callers must supply them in one
 * consistent format for the ordering to be meaningful.
 * </p>
 *
 * @since 1.0.0
 */
public final class Observation {

    private final String timestamp;
    private final double value;

    /**
     * @param timestamp point label; must not be {@code null}
     * @param value     observed value
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public Observation(String timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "timestamp='" + timestamp + '\'' +
                ", value=" + value +
                '}';
    }
}
