package io.seriesfetch.analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.seriesfetch.error.PipelineException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HttpAnalyticsTransportTest {
    private static final String REPORT = "{"
            + "\"dimensionHeaders\":[{\"name\":\"date\"}],"
            + "\"metricHeaders\":[{\"name\":\"totalUsers\",\"type\":\"TYPE_INTEGER\"},{\"name\":\"activeUsers\",\"type\":\"TYPE_INTEGER\"}],"
            + "\"rows\":["
            + "{\"dimensionValues\":[{\"value\":\"20240102\"}],\"metricValues\":[{\"value\":\"12\"},{\"value\":\"9\"}]},"
            + "{\"dimensionValues\":[{\"value\":\"20240101\"}],\"metricValues\":[{\"value\":\"10\"},{\"value\":\"8\"}]}"
            + "],\"rowCount\":2}";

    HttpServer server;
    ReportHandler handler;

    @BeforeEach
    void startServer() throws IOException {
        handler = new ReportHandler();
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1beta", handler);
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private HttpAnalyticsTransport transport(CredentialProvider credentials) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1beta/";
        return new HttpAnalyticsTransport(endpoint, credentials, Duration.ofSeconds(2));
    }

    @Test
    void postsRunReportAndParsesRows() throws Exception {
        handler.respond(200, REPORT);
        RawResponse raw = transport(new EnvCredentialProvider("tok-1")).call("123456",
                List.of("totalUsers", "activeUsers"), List.of("date"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2));

        assertEquals("/v1beta/properties/123456:runReport", handler.path);
        assertEquals("POST", handler.method);
        assertEquals("Bearer tok-1", handler.authorization);
        JsonNode body = AnalyticsJson.MAPPER.readTree(handler.body);
        assertEquals("2024-01-01", body.path("dateRanges").get(0).path("startDate").asText());
        assertEquals("2024-01-02", body.path("dateRanges").get(0).path("endDate").asText());
        assertEquals("activeUsers", body.path("metrics").get(1).path("name").asText());
        assertEquals("date", body.path("dimensions").get(0).path("name").asText());
        assertTrue(body.path("keepEmptyRows").asBoolean());

        assertEquals(List.of("date"), raw.dimensionHeaders());
        assertEquals(List.of("totalUsers", "activeUsers"), raw.metricHeaders());
        assertEquals(2, raw.rows().size());
        assertEquals(List.of("12", "9"), raw.rows().get(0).metricValues());
    }

    @Test
    void reportWithoutRowsIsEmpty() throws Exception {
        handler.respond(200, "{\"dimensionHeaders\":[{\"name\":\"date\"}],\"metricHeaders\":[{\"name\":\"totalUsers\"}]}");
        RawResponse raw = transport(() -> "t").call("1", List.of("totalUsers"), List.of("date"),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1));
        assertTrue(raw.rows().isEmpty());
    }

    @Test
    void statusesMapToTypedFailures() {
        assertStatus(401, AuthException.class, false);
        assertStatus(403, AuthException.class, false);
        assertStatus(400, InvalidArgumentException.class, false);
        assertStatus(404, InvalidArgumentException.class, false);
        assertStatus(429, RateLimitException.class, true);
        assertStatus(503, TransientNetworkException.class, true);
    }

    @Test
    void garbageBodyIsMalformed() {
        handler.respond(200, "<html>oops</html>");
        assertThrows(MalformedResponseException.class, () -> transport(() -> "t").call("1", List.of("totalUsers"),
                List.of("date"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
    }

    @Test
    void missingTokenFailsBeforeSending() {
        assertThrows(AuthException.class, () -> transport(new EnvCredentialProvider(null)).call("1", List.of("totalUsers"),
                List.of("date"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
        assertNull(handler.path);
    }

    @Test
    void unreachableServerIsTransient() {
        server.stop(0);
        assertThrows(TransientNetworkException.class, () -> transport(() -> "t").call("1", List.of("totalUsers"),
                List.of("date"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
    }

    private void assertStatus(int status, Class<? extends PipelineException> type, boolean retryable) {
        handler.respond(status, "{\"error\":{\"code\":" + status + "}}");
        PipelineException e = assertThrows(type, () -> transport(() -> "t").call("1", List.of("totalUsers"),
                List.of("date"), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
        assertEquals(retryable, e.isRetryable(), "status " + status);
        assertTrue(e.getMessage().contains(String.valueOf(status)));
    }

    static class ReportHandler implements HttpHandler {
        volatile int status = 200;
        volatile String response = "{}";
        volatile String path;
        volatile String method;
        volatile String authorization;
        volatile String body;

        void respond(int status, String response) {
            this.status = status;
            this.response = response;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            path = exchange.getRequestURI().getPath();
            method = exchange.getRequestMethod();
            authorization = exchange.getRequestHeaders().getFirst("Authorization");
            body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            byte[] out = response.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        }
    }
}
