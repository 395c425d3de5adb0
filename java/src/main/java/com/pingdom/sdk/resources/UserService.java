package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;

import java.util.List;

/**
 * Account users ({@code /users}).
 */
public final class UserService extends ResourceService {

    public UserService(PingdomClient client) {
        super(client);
    }

    public List<User> list() throws PingdomException {
        return orEmpty(call("GET", "/users", null, UsersResponse.class).users());
    }

    public String delete(int id) throws PingdomException {
        return message("DELETE", "/users/" + id, null);
    }

    record UsersResponse(List<User> users) {
    }
}
