package com.seriessentinel.service.relay;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One alert payload captured by the relay, stamped with its arrival time.
 */
@JsonPropertyOrder({ "timestamp", "data" })
public final class ReceivedAlert {

    private final Instant receivedAt;
    private final JsonNode data;

    @JsonCreator
    public ReceivedAlert(@JsonProperty("timestamp") Instant receivedAt, @JsonProperty("data") JsonNode data) {
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt must not be null");
        this.data = Objects.requireNonNull(data, "data must not be null").deepCopy();
    }

    @JsonProperty("timestamp")
    public Instant getReceivedAt() {
        return receivedAt;
    }

    @JsonProperty("data")
    public JsonNode getData() {
        return data;
    }

    @Override
    public String toString() {
        return "ReceivedAlert{receivedAt=" + receivedAt + '}';
    }
}
