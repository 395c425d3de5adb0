package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Scheduled maintenance window. {@code recurrenceType} is one of {@code none}, {@code day}, {@code week},
 * {@code month}.
 */
public record MaintenanceWindow(
    int id,
    String description,
    Instant from,
    Instant to,
    @JsonProperty("recurrencetype") String recurrenceType,
    @JsonProperty("repeatevery") int repeatEvery,
    @JsonProperty("effectiveto") Instant effectiveTo,
    Checks checks
) {

    public record Checks(List<Integer> uptime, List<Integer> tms) {
    }
}
