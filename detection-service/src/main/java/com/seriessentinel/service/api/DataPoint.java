package com.seriessentinel.service.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One {@code {timestamp, value}} entry of a detection request. Both fields
 * are required; they are boxed so a missing field can be told apart from
 * zero.
 */
public class DataPoint {

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("value")
    private Double value;

    public DataPoint() {
    }

    public DataPoint(String timestamp, Double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "DataPoint{" + timestamp + '=' + value + '}';
    }
}
