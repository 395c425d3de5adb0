package com.pingdom.sdk.resources;

import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.PingdomException;
import com.pingdom.sdk.PingdomResponse;
import com.pingdom.sdk.ResponseDecodeException;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared plumbing for the per-resource services: each call is one request built and executed through
 * {@link PingdomClient}.
 */
abstract class ResourceService {

    protected final PingdomClient client;

    ResourceService(PingdomClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    protected <T> T call(String method, String resource, Map<String, String> params, Class<T> type)
        throws PingdomException {
        HttpRequest request = client.newRequest(method, resource, params);
        PingdomResponse<T> response = client.execute(request, type);
        if (response.body() == null) {
            throw new ResponseDecodeException(response.statusCode(),
                "decode response into " + type.getSimpleName() + ": empty JSON value", null);
        }
        return response.body();
    }

    protected String message(String method, String resource, Map<String, String> params) throws PingdomException {
        return call(method, resource, params, MessageResponse.class).message();
    }

    protected static Map<String, String> requireParams(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            throw new IllegalArgumentException("at least one parameter is required");
        }
        return params;
    }

    protected static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    record MessageResponse(String message) {
    }
}
