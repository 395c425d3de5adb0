package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;
import java.util.Map;

/**
 * Uptime checks ({@code /checks}). Create and update parameters are passed through as query parameters using the
 * API's own names ({@code name}, {@code host}, {@code type}, {@code resolution}, ...).
 */
public final class CheckService extends ResourceService {

    public CheckService(PingdomClient client) {
        super(client);
    }

    public List<CheckSummary> list(Map<String, String> params) throws PingdomException {
        return orEmpty(call("GET", "/checks", params, ChecksResponse.class).checks());
    }

    public List<CheckSummary> list() throws PingdomException {
        return list(null);
    }

    public CheckDetail read(int id) throws PingdomException {
        return call("GET", "/checks/" + id, null, CheckResponse.class).check();
    }

    /**
     * @return the created check; only {@code id} and {@code name} are populated by the API.
     */
    public CheckSummary create(Map<String, String> params) throws PingdomException {
        return call("POST", "/checks", requireParams(params), CreatedCheckResponse.class).check();
    }

    public String update(int id, Map<String, String> params) throws PingdomException {
        return message("PUT", "/checks/" + id, requireParams(params));
    }

    public String delete(int id) throws PingdomException {
        return message("DELETE", "/checks/" + id, null);
    }

    record ChecksResponse(List<CheckSummary> checks) {
    }

    record CheckResponse(CheckDetail check) {
    }

    record CreatedCheckResponse(CheckSummary check) {
    }
}
