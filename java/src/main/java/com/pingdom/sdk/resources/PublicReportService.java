package com.pingdom.sdk.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;

/**
 * Checks published on the public reports page ({@code /reports.public}).
 */
public final class PublicReportService extends ResourceService {

    public PublicReportService(PingdomClient client) {
        super(client);
    }

    public List<PublicReport> list() throws PingdomException {
        return orEmpty(call("GET", "/reports.public", null, PublicReportsResponse.class).reports());
    }

    record PublicReportsResponse(@JsonProperty("public") List<PublicReport> reports) {
    }
}
