package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pingdom probe server.
 */
public record Probe(
    int id,
    String country,
    String city,
    String name,
    boolean active,
    String hostname,
    String ip,
    String ipv6,
    @JsonProperty("countryiso") String countryIso,
    String region
) {
}
