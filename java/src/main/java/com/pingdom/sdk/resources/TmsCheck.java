package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Transaction (multi-step) check. {@code steps} keeps the raw script steps; it is only populated when reading a single
 * check.
 */
public record TmsCheck(
    int id,
    String name,
    boolean active,
    String status,
    int frequency,
    String region,
    @JsonProperty("severity_level") String severityLevel,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("modified_at") Instant modifiedAt,
    @JsonProperty("team_ids") List<Integer> teamIds,
    JsonNode steps
) {
}
