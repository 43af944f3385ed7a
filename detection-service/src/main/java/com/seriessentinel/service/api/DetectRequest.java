package com.seriessentinel.service.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /api/v1/anomaly/detect}.
 *
 * <p>
 * Only {@code data} is required. Parameters left out (or sent as
 * {@code null}) fall back to the service-wide detection defaults.
 * </p>
 */
public class DetectRequest {

    @JsonProperty("metadata")
    private Metadata metadata;

    @JsonProperty("data")
    private List<DataPoint> data;

    @JsonProperty("contamination")
    private Double contamination;

    @JsonProperty("random_state")
    private Long randomState;

    @JsonProperty("ratio_threshold")
    private Double ratioThreshold;

    @JsonProperty("streak_threshold")
    private Integer streakThreshold;

    public Metadata getMetadata() {
        return metadata;
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = metadata;
    }

    public List<DataPoint> getData() {
        return data;
    }

    public void setData(List<DataPoint> data) {
        this.data = data;
    }

    public Double getContamination() {
        return contamination;
    }

    public void setContamination(Double contamination) {
        this.contamination = contamination;
    }

    public Long getRandomState() {
        return randomState;
    }

    public void setRandomState(Long randomState) {
        this.randomState = randomState;
    }

    public Double getRatioThreshold() {
        return ratioThreshold;
    }

    public void setRatioThreshold(Double ratioThreshold) {
        this.ratioThreshold = ratioThreshold;
    }

    public Integer getStreakThreshold() {
        return streakThreshold;
    }

    public void setStreakThreshold(Integer streakThreshold) {
        this.streakThreshold = streakThreshold;
    }

    @Override
    public String toString() {
        return "DetectRequest{" +
                "metadata=" + metadata +
                ", points=" + (data != null ? data.size() : 0) +
                ", contamination=" + contamination +
                ", randomState=" + randomState +
                ", ratioThreshold=" + ratioThreshold +
                ", streakThreshold=" + streakThreshold +
                '}';
    }
}
