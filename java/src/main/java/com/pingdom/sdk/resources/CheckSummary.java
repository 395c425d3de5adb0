package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Check as returned by the listing endpoint, and (with only {@code id} and {@code name} set) by check creation.
 */
public record CheckSummary(
    int id,
    String name,
    String hostname,
    String status,
    int resolution,
    String type,
    boolean paused,
    Instant created,
    @JsonProperty("lasterrortime") Instant lastErrorTime,
    @JsonProperty("lasttesttime") Instant lastTestTime,
    @JsonProperty("lastresponsetime") long lastResponseTime
) {
}
