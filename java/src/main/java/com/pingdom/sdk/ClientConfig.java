package com.pingdom.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link PingdomClient} instances.
 */
public final class ClientConfig {

    public static final String DEFAULT_BASE_URL = "https://api.pingdom.com/api/2.1";

    private final String user;
    private final String password;
    private final String apiKey;
    private final String accountEmail;
    private final String baseUrl;
    private final HttpClient httpClient;

    private ClientConfig(Builder builder) {
        this.user = builder.user;
        this.password = builder.password;
        this.apiKey = builder.apiKey;
        this.accountEmail = builder.accountEmail;
        this.baseUrl = builder.baseUrl;
        this.httpClient = builder.httpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Process-wide HTTP client used when a configuration does not supply its own. Tests should always inject an
     * isolated client instead.
     */
    public static HttpClient defaultHttpClient() {
        return SharedHttpClient.INSTANCE;
    }

    public ClientConfig withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_BASE_URL));

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = defaultHttpClient();
        }

        return new Builder()
            .user(Optional.ofNullable(user).orElse(""))
            .password(Optional.ofNullable(password).orElse(""))
            .apiKey(Optional.ofNullable(apiKey).orElse(""))
            .accountEmail(Optional.ofNullable(accountEmail).orElse(""))
            .baseUrl(resolvedBaseUrl)
            .httpClient(resolvedClient)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("BaseURL must include scheme and host: " + url);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid BaseURL: " + url, ex);
        }
        if (url.endsWith("/")) {
            return url.substring(0, url.length() - 1);
        }
        return url;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getApiKey() {
        return apiKey;
    }

    /**
     * @return account email used for multi-user authentication; empty when not configured.
     */
    public String getAccountEmail() {
        return accountEmail;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    @Override
    public String toString() {
        return "ClientConfig{user=" + user + ", accountEmail=" + accountEmail + ", baseUrl=" + baseUrl + "}";
    }

    private static final class SharedHttpClient {
        private static final HttpClient INSTANCE = HttpClient.newHttpClient();
    }

    public static final class Builder {
        private String user;
        private String password;
        private String apiKey;
        private String accountEmail;
        private String baseUrl;
        private HttpClient httpClient;

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder accountEmail(String accountEmail) {
            this.accountEmail = accountEmail;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this).withDefaults();
        }

        private ClientConfig buildInternal() {
            return new ClientConfig(this);
        }
    }
}
