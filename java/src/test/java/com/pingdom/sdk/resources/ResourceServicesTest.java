package com.pingdom.sdk.resources;

import com.pingdom.sdk.ClientConfig;
import com.pingdom.sdk.PingdomClient;
import com.pingdom.sdk.ResponseDecodeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceServicesTest {

    private HttpServer server;
    private PingdomClient client;
    private volatile String lastRequest;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        client = new PingdomClient(ClientConfig.builder()
            .user("u")
            .password("p")
            .apiKey("k")
            .baseUrl("http://localhost:" + server.getAddress().getPort())
            .httpClient(HttpClient.newHttpClient())
            .build());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void probesListHonoursFilters() throws Exception {
        stub("/probes", "{\"probes\":[{\"id\":1,\"country\":\"United Kingdom\",\"city\":\"Manchester\","
            + "\"name\":\"Manchester, UK\",\"active\":true,\"hostname\":\"s424.pingdom.com\",\"ip\":\"212.84.74.156\","
            + "\"ipv6\":\"2a02:6b8::156\",\"countryiso\":\"GB\",\"region\":\"EU\"}]}");

        List<Probe> probes = client.probes().list(Map.of("onlyactive", "true"));

        assertEquals("GET /probes?onlyactive=true", lastRequest);
        assertEquals(1, probes.size());
        assertEquals("GB", probes.get(0).countryIso());
        assertTrue(probes.get(0).active());
    }

    @Test
    void teamsListAndRead() throws Exception {
        stub("/alerting/teams", "{\"teams\":[{\"id\":1,\"name\":\"Ops\",\"members\":[{\"id\":10,\"name\":\"Jane\",\"type\":\"user\"}]}]}");

        List<Team> teams = client.teams().list();
        assertEquals("Ops", teams.get(0).name());
        assertEquals("user", teams.get(0).members().get(0).type());

        stub("/alerting/teams/1", "{\"team\":{\"id\":1,\"name\":\"Ops\",\"members\":[]}}");
        Team team = client.teams().read(1);
        assertEquals(1, team.id());
        assertTrue(team.members().isEmpty());
    }

    @Test
    void maintenanceWindowsDecodeTimestamps() throws Exception {
        stub("/maintenance", "{\"maintenance\":[{\"id\":5,\"description\":\"Patch night\",\"from\":1717200000,"
            + "\"to\":1717203600,\"recurrencetype\":\"week\",\"repeatevery\":1,\"effectiveto\":1719792000,"
            + "\"checks\":{\"uptime\":[85975],\"tms\":[]}}]}");

        List<MaintenanceWindow> windows = client.maintenances().list(null);

        assertEquals("GET /maintenance", lastRequest);
        MaintenanceWindow window = windows.get(0);
        assertEquals(Instant.ofEpochSecond(1717200000L), window.from());
        assertEquals(Instant.ofEpochSecond(1717203600L), window.to());
        assertEquals("week", window.recurrenceType());
        assertEquals(List.of(85975), window.checks().uptime());
    }

    @Test
    void maintenanceDeleteReturnsMessage() throws Exception {
        stub("/maintenance/5", "{\"message\":\"Maintenance window successfully deleted!\"}");

        assertEquals("Maintenance window successfully deleted!", client.maintenances().delete(5));
        assertEquals("DELETE /maintenance/5", lastRequest);
    }

    @Test
    void usersListIncludesContactTargets() throws Exception {
        stub("/users", "{\"users\":[{\"id\":7,\"name\":\"Jane\",\"paused\":\"NO\",\"primary\":\"YES\","
            + "\"email\":[{\"id\":3,\"address\":\"jane@example.com\",\"severity\":\"HIGH\"}]}]}");

        User user = client.users().list().get(0);

        assertEquals("Jane", user.name());
        assertEquals("YES", user.primary());
        assertEquals("jane@example.com", user.email().get(0).address());
    }

    @Test
    void publicReportsListDecodesPublicField() throws Exception {
        stub("/reports.public", "{\"public\":[{\"checkid\":85975,\"checkname\":\"My check 1\","
            + "\"reporturl\":\"http://stats.pingdom.com/s/85975\"}]}");

        List<PublicReport> reports = client.publicReports().list();

        assertEquals(85975, reports.get(0).checkId());
        assertEquals("http://stats.pingdom.com/s/85975", reports.get(0).reportUrl());
    }

    @Test
    void missingListFieldYieldsEmptyList() throws Exception {
        stub("/probes", "{}");

        assertTrue(client.probes().list(null).isEmpty());
    }

    @Test
    void nullBodyRaisesDecodeError() {
        stub("/probes", "null");

        ResponseDecodeException ex = assertThrows(ResponseDecodeException.class, () -> client.probes().list(null));
        assertEquals(200, ex.getStatusCode());
    }

    @Test
    void tmsChecksListReadAndDelete() throws Exception {
        stub("/tms/check", "{\"checks\":[{\"id\":9,\"name\":\"Login flow\",\"active\":true,"
            + "\"status\":\"successful\",\"frequency\":60,\"region\":\"us-east\",\"severity_level\":\"low\","
            + "\"created_at\":1553070682,\"modified_at\":1553070700,\"team_ids\":[4]}]}");

        List<TmsCheck> checks = client.tms().list(Map.of("limit", "1"));

        assertEquals("GET /tms/check?limit=1", lastRequest);
        TmsCheck check = checks.get(0);
        assertEquals("Login flow", check.name());
        assertEquals("low", check.severityLevel());
        assertEquals(Instant.ofEpochSecond(1553070682L), check.createdAt());
        assertEquals(List.of(4), check.teamIds());

        stub("/tms/check/9", "{\"check\":{\"id\":9,\"name\":\"Login flow\","
            + "\"steps\":[{\"fn\":\"go_to\",\"args\":{\"url\":\"https://example.com\"}}]}}");
        TmsCheck detail = client.tms().read(9);
        assertEquals("go_to", detail.steps().get(0).path("fn").asText());

        stub("/tms/check/10", "{\"message\":\"Deletion of check was successful!\"}");
        assertEquals("Deletion of check was successful!", client.tms().delete(10));
        assertEquals("DELETE /tms/check/10", lastRequest);
    }

    private void stub(String path, String body) {
        server.createContext(path, exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            lastRequest = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath()
                + (query == null ? "" : "?" + query);
            respond(exchange, 200, body);
        });
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
