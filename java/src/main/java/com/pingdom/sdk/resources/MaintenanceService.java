package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;
import java.util.Map;

/**
 * Maintenance windows ({@code /maintenance}).
 */
public final class MaintenanceService extends ResourceService {

    public MaintenanceService(PingdomClient client) {
        super(client);
    }

    public List<MaintenanceWindow> list(Map<String, String> params) throws PingdomException {
        return orEmpty(call("GET", "/maintenance", params, MaintenanceListResponse.class).maintenance());
    }

    public MaintenanceWindow read(int id) throws PingdomException {
        return call("GET", "/maintenance/" + id, null, MaintenanceResponse.class).maintenance();
    }

    public String delete(int id) throws PingdomException {
        return message("DELETE", "/maintenance/" + id, null);
    }

    record MaintenanceListResponse(List<MaintenanceWindow> maintenance) {
    }

    record MaintenanceResponse(MaintenanceWindow maintenance) {
    }
}
