package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;

/**
 * Alerting teams ({@code /alerting/teams}).
 */
public final class TeamService extends ResourceService {

    public TeamService(PingdomClient client) {
        super(client);
    }

    public List<Team> list() throws PingdomException {
        return orEmpty(call("GET", "/alerting/teams", null, TeamsResponse.class).teams());
    }

    public Team read(int id) throws PingdomException {
        return call("GET", "/alerting/teams/" + id, null, TeamResponse.class).team();
    }

    public String delete(int id) throws PingdomException {
        return message("DELETE", "/alerting/teams/" + id, null);
    }

    record TeamsResponse(List<Team> teams) {
    }

    record TeamResponse(Team team) {
    }
}
