package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PublicReport(
    @JsonProperty("checkid") int checkId,
    @JsonProperty("checkname") String checkName,
    @JsonProperty("reporturl") String reportUrl
) {
}
