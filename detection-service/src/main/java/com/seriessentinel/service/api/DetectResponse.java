package com.seriessentinel.service.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.seriessentinel.core.model.AnomalyInterval;

import java.util.List;

/**
 * Body of a successful detection response: the request metadata (omitted
 * when the request had none) and the anomalous intervals, empty when the
 * segment verdict is not anomalous.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetectResponse {

    private final Metadata metadata;
    private final List<AnomalyInterval> anomalies;

    @JsonCreator
    public DetectResponse(@JsonProperty("metadata") Metadata metadata,
            @JsonProperty("anomalies") List<AnomalyInterval> anomalies) {
        this.metadata = metadata;
        this.anomalies = anomalies != null ? List.copyOf(anomalies) : List.of();
    }

    @JsonProperty("metadata")
    public Metadata getMetadata() {
        return metadata;
    }

    @JsonProperty("anomalies")
    public List<AnomalyInterval> getAnomalies() {
        return anomalies;
    }

    @Override
    public String toString() {
        return "DetectResponse{" +
                "metadata=" + metadata +
                ", anomalies=" + anomalies +
                '}';
    }
}
