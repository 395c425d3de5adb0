package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;
import java.util.Map;

/**
 * Probe servers ({@code /probes}). Supported filters include {@code onlyactive} and {@code includedeleted}.
 */
public final class ProbeService extends ResourceService {

    public ProbeService(PingdomClient client) {
        super(client);
    }

    public List<Probe> list(Map<String, String> params) throws PingdomException {
        return orEmpty(call("GET", "/probes", params, ProbesResponse.class).probes());
    }

    record ProbesResponse(List<Probe> probes) {
    }
}
