package com.seriessentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Inclusive timestamp range covering one maximal run of flagged points.
 *
 * @since 1.0.0
 */
public final class AnomalyInterval {

    private final String start;
    private final String end;

    @JsonCreator
    public AnomalyInterval(@JsonProperty("start") String start, @JsonProperty("end") String end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    @JsonProperty("start")
    public String getStart() {
        return start;
    }

    @JsonProperty("end")
    public String getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyInterval that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "AnomalyInterval{" + start + " .. " + end + '}';
    }
}
