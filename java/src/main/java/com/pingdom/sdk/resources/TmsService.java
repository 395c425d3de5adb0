package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;
import java.util.Map;

/**
 * Transaction monitoring checks ({@code /tms/check}). Listing accepts filters such as {@code type}, {@code tags},
 * {@code limit} and {@code offset}.
 */
public final class TmsService extends ResourceService {

    public TmsService(PingdomClient client) {
        super(client);
    }

    public List<TmsCheck> list(Map<String, String> params) throws PingdomException {
        return orEmpty(call("GET", "/tms/check", params, TmsChecksResponse.class).checks());
    }

    public TmsCheck read(int id) throws PingdomException {
        return call("GET", "/tms/check/" + id, null, TmsCheckResponse.class).check();
    }

    public String delete(int id) throws PingdomException {
        return message("DELETE", "/tms/check/" + id, null);
    }

    record TmsChecksResponse(List<TmsCheck> checks) {
    }

    record TmsCheckResponse(TmsCheck check) {
    }
}
