package com.seriessentinel.service.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Optional alert context attached to a detection request and echoed back
 * unchanged in the response.
 */
public class Metadata {

    @JsonProperty("alert_name")
    private String alertName = "";

    @JsonProperty("severity")
    private String severity = "";

    @JsonProperty("labels")
    private Map<String, String> labels = new LinkedHashMap<>();

    public String getAlertName() {
        return alertName;
    }

    public void setAlertName(String alertName) {
        this.alertName = alertName;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public void setLabels(Map<String, String> labels) {
        this.labels = labels != null ? new LinkedHashMap<>(labels) : new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metadata that))
            return false;
        return Objects.equals(alertName, that.alertName)
                && Objects.equals(severity, that.severity)
                && Objects.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertName, severity, labels);
    }

    @Override
    public String toString() {
        return "Metadata{" +
                "alertName='" + alertName + '\'' +
                ", severity='" + severity + '\'' +
                ", labels=" + labels +
                '}';
    }
}
