package com.pingdom.sdk.internal;

import com.pingdom.sdk.ClientConfig;
import com.pingdom.sdk.PingdomException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Builds authenticated Pingdom requests. Every request carries HTTP Basic credentials and the {@code App-Key} header;
 * {@code Account-Email} is added only for multi-user configurations.
 */
public final class RequestFactory {

    public static final String APP_KEY_HEADER = "App-Key";
    public static final String ACCOUNT_EMAIL_HEADER = "Account-Email";

    private final String baseUrl;
    private final String authorization;
    private final String apiKey;
    private final String accountEmail;

    public RequestFactory(ClientConfig config) {
        this.baseUrl = config.getBaseUrl();
        this.authorization = basicAuth(config.getUser(), config.getPassword());
        this.apiKey = config.getApiKey();
        this.accountEmail = config.getAccountEmail();
    }

    public HttpRequest create(String method, String resource, Map<String, String> params) throws PingdomException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(resource, "resource");
        URI uri;
        try {
            uri = new URI(baseUrl + resource);
            if (params != null && !params.isEmpty()) {
                // replaces any query already present on the resource
                uri = new URI(uri.getScheme() + "://" + uri.getRawAuthority() + uri.getRawPath()
                    + "?" + encodeQuery(params));
            }
        } catch (URISyntaxException ex) {
            throw new PingdomException("build request: invalid resource " + resource + ": " + ex.getMessage(), ex);
        }

        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .method(method, HttpRequest.BodyPublishers.noBody())
                .header("Authorization", authorization)
                .header(APP_KEY_HEADER, apiKey)
                .header("Accept", "application/json");

            if (accountEmail != null && !accountEmail.isEmpty()) {
                builder.header(ACCOUNT_EMAIL_HEADER, accountEmail);
            }
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new PingdomException("build request: " + method + " " + uri + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Form-encodes the parameters in key order.
     */
    static String encodeQuery(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : new TreeMap<>(params).entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    private static String basicAuth(String user, String password) {
        String credentials = user + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
