package com.pingdom.sdk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pingdom.sdk.internal.RequestFactory;
import com.pingdom.sdk.internal.ResponseDecoder;
import com.pingdom.sdk.internal.ResponseValidator;
import com.pingdom.sdk.resources.CheckService;
import com.pingdom.sdk.resources.MaintenanceService;
import com.pingdom.sdk.resources.ProbeService;
import com.pingdom.sdk.resources.PublicReportService;
import com.pingdom.sdk.resources.TeamService;
import com.pingdom.sdk.resources.TmsService;
import com.pingdom.sdk.resources.UserService;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for the Pingdom REST API (v2.1). The client is immutable and thread-safe as long as the underlying
 * {@link HttpClient} is: create one per set of credentials and share it.
 * </p>
 *
 * <h2>Making calls</h2>
 * <p>
 * The resource services ({@link #checks()}, {@link #probes()}, ...) cover the common endpoints. Anything else can be
 * reached directly:
 * </p>
 * <pre>{@code
 * HttpRequest request = client.newRequest("GET", "/summary.average/123", Map.of("includeuptime", "true"));
 * PingdomResponse<JsonNode> response = client.execute(request, JsonNode.class);
 * }</pre>
 *
 * <p>
 * Every call is a single synchronous round trip. There are no retries and no timeouts at this layer; configure those on
 * the injected {@link HttpClient} if needed.
 * </p>
 */
public final class PingdomClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(PingdomClient.class.getName());

    private final ClientConfig config;
    private final HttpClient httpClient;
    private final RequestFactory requestFactory;

    private final CheckService checks;
    private final ProbeService probes;
    private final TeamService teams;
    private final MaintenanceService maintenances;
    private final UserService users;
    private final PublicReportService publicReports;
    private final TmsService tms;

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration. Defaults are applied again here, so a configuration that was never
     *               built through {@link ClientConfig.Builder#build()} still resolves its base URL and transport.
     * @throws IllegalArgumentException when the base URL is malformed.
     */
    public PingdomClient(ClientConfig config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.httpClient = this.config.getHttpClient();
        this.requestFactory = new RequestFactory(this.config);
        this.checks = new CheckService(this);
        this.probes = new ProbeService(this);
        this.teams = new TeamService(this);
        this.maintenances = new MaintenanceService(this);
        this.users = new UserService(this);
        this.publicReports = new PublicReportService(this);
        this.tms = new TmsService(this);
    }

    /**
     * Returns a client with the default base URL and the shared HTTP client.
     *
     * <p>
     * <strong>Construction failures are not reported.</strong> If the configuration cannot be resolved, a warning is
     * logged and {@code null} is returned instead of an exception. The only input validated at construction is the base
     * URL, which these factories always take from {@link ClientConfig#DEFAULT_BASE_URL}, so in practice the result is
     * never {@code null}; any credentials, including {@code null} ones, are accepted. Kept only for callers written
     * against the original positional API.
     * </p>
     *
     * @deprecated use {@link #PingdomClient(ClientConfig)}, which reports configuration errors.
     */
    @Deprecated
    public static PingdomClient newClient(String user, String password, String key) {
        return legacyClient(ClientConfig.builder()
            .user(user)
            .password(password)
            .apiKey(key));
    }

    /**
     * Multi-user variant of {@link #newClient(String, String, String)}; requests carry {@code Account-Email}.
     * Construction failures are logged and yield {@code null}, exactly like {@code newClient}.
     *
     * @deprecated use {@link #PingdomClient(ClientConfig)} with {@link ClientConfig.Builder#accountEmail(String)}.
     */
    @Deprecated
    public static PingdomClient newMultiUserClient(String user, String password, String key, String accountEmail) {
        return legacyClient(ClientConfig.builder()
            .user(user)
            .password(password)
            .apiKey(key)
            .accountEmail(accountEmail));
    }

    private static PingdomClient legacyClient(ClientConfig.Builder builder) {
        try {
            return new PingdomClient(builder.build());
        } catch (IllegalArgumentException ex) {
            LOGGER.warning(() -> "[pingdom-sdk] legacy client construction failed: " + ex.getMessage());
            return null;
        }
    }

    /**
     * Builds an authenticated request without sending it.
     *
     * @param method   HTTP method in upper case, e.g. {@code GET}, {@code POST}, {@code PUT}, {@code DELETE}.
     * @param resource resource path beginning with {@code /}, appended to the base URL.
     * @param params   query parameters; may be {@code null}. Encoded order is not guaranteed.
     * @throws PingdomException when the resulting URL or method is rejected.
     */
    public HttpRequest newRequest(String method, String resource, Map<String, String> params) throws PingdomException {
        return requestFactory.create(method, resource, params);
    }

    public HttpRequest newRequest(String method, String resource) throws PingdomException {
        return requestFactory.create(method, resource, null);
    }

    /**
     * Sends {@code request} and decodes a successful body into {@code type}.
     *
     * @throws PingdomTransportException       when no response was obtained.
     * @throws PingdomApiException             when the API reported an error.
     * @throws MalformedErrorResponseException when a non-2xx body could not be parsed.
     * @throws ResponseDecodeException         when a 2xx body does not match {@code type}.
     */
    public <T> PingdomResponse<T> execute(HttpRequest request, Class<T> type) throws PingdomException {
        Objects.requireNonNull(type, "nil decode target");
        return send(request, (status, body) -> ResponseDecoder.decode(status, body, type));
    }

    public <T> PingdomResponse<T> execute(HttpRequest request, TypeReference<T> type) throws PingdomException {
        Objects.requireNonNull(type, "nil decode target");
        return send(request, (status, body) -> ResponseDecoder.decode(status, body, type));
    }

    /**
     * Sends {@code request} and updates {@code target} in place from a successful body. On a non-2xx response the
     * target is left untouched.
     */
    public <T> PingdomResponse<T> executeInto(HttpRequest request, T target) throws PingdomException {
        Objects.requireNonNull(target, "nil decode target");
        return send(request, (status, body) -> ResponseDecoder.decodeInto(status, body, target));
    }

    private <T> PingdomResponse<T> send(HttpRequest request, BodyDecoder<T> decoder) throws PingdomException {
        Objects.requireNonNull(request, "request");
        String label = request.method() + " " + request.uri().getRawPath();
        LOGGER.fine(() -> "[pingdom-sdk] sending " + label);

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new PingdomTransportException(label + " interrupted", ex);
            }
            throw new PingdomTransportException(label + " request: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[pingdom-sdk] %s returned %d", label, status));

        try (InputStream bodyStream = response.body()) {
            ResponseValidator.validate(status, bodyStream);
            T body = decoder.decode(status, bodyStream);
            return new PingdomResponse<>(status, response.headers(), body);
        } catch (IOException ex) {
            throw new PingdomTransportException(label + " read response: " + ex.getMessage(), ex);
        }
    }

    public CheckService checks() {
        return checks;
    }

    public ProbeService probes() {
        return probes;
    }

    public TeamService teams() {
        return teams;
    }

    public MaintenanceService maintenances() {
        return maintenances;
    }

    public UserService users() {
        return users;
    }

    public PublicReportService publicReports() {
        return publicReports;
    }

    public TmsService tms() {
        return tms;
    }

    public String getUser() {
        return config.getUser();
    }

    public String getApiKey() {
        return config.getApiKey();
    }

    public String getAccountEmail() {
        return config.getAccountEmail();
    }

    public String getBaseUrl() {
        return config.getBaseUrl();
    }

    /**
     * No-op: the {@link HttpClient} is owned by whoever supplied it (or shared process-wide).
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    @FunctionalInterface
    private interface BodyDecoder<T> {
        T decode(int statusCode, InputStream body) throws PingdomException, IOException;
    }
}
