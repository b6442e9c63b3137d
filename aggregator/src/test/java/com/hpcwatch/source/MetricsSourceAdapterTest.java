package com.hpcwatch.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hpcwatch.config.SourceConfig.MetricsProperties;
import com.hpcwatch.source.TimeRanges.QueryWindow;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsSourceAdapterTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private final List<String> requestQueries = new CopyOnWriteArrayList<>();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();

    private volatile int status = 200;
    private volatile String body = "";
    private volatile long delayMillis;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/api/v1/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void parsesInstantVectorWithLabels() throws Exception {
        body = fixture("global-system-status.json");

        FetchResult<List<MetricSeries>> result = adapter(properties()).instant("globalSystemStatus").get();

        assertTrue(result.isSuccess());
        List<MetricSeries> series = result.getValue();
        assertEquals(3, series.size());
        assertEquals("hopper-01.cluster.local:9100", series.get(0).label("instance").orElseThrow());
        assertEquals("3", series.get(0).latest().orElseThrow().rawValue());
        assertEquals(1_773_144_000L, series.get(0).latest().orElseThrow().epochSecond());
        assertEquals("not-a-number", series.get(2).latest().orElseThrow().rawValue());
        assertEquals("/api/v1/query?query=globalSystemStatus", requestQueries.get(0));
    }

    @Test
    void parsesRangeMatrixAndSendsWindow() throws Exception {
        body = fixture("power-history-range.json");
        QueryWindow window = new QueryWindow(1_773_057_600L, 1_773_144_000L, "1h");

        FetchResult<List<MetricSeries>> result = adapter(properties())
                .range("sum(redfish_power_powercontrol_power_consumed_watts)", window).get();

        assertEquals(3, result.getValue().get(0).points().size());
        assertEquals("42011.25", result.getValue().get(0).latest().orElseThrow().rawValue());
        String sent = URLDecoder.decode(requestQueries.get(0), StandardCharsets.UTF_8);
        assertEquals("/api/v1/query_range?query=sum(redfish_power_powercontrol_power_consumed_watts)"
                + "&start=1773057600&end=1773144000&step=1h", sent);
    }

    @Test
    void errorEnvelopeIsRejected() throws Exception {
        body = fixture("query-error.json");

        FetchResult<List<MetricSeries>> result = adapter(properties()).instant("sum(").get();

        assertEquals(FetchErrorType.SOURCE_REJECTED, result.getError().type());
        assertEquals("1:9: parse error: unexpected end of input", result.getError().message());
    }

    @Test
    void non2xxStatusIsRejected() throws Exception {
        status = 503;
        body = "unavailable";

        FetchResult<List<MetricSeries>> result = adapter(properties()).instant("up").get();

        assertEquals(FetchErrorType.SOURCE_REJECTED, result.getError().type());
        assertEquals("HTTP 503", result.getError().message());
    }

    @Test
    void unreadableBodyIsMalformed() throws Exception {
        body = "<html>proxy error</html>";
        FetchResult<List<MetricSeries>> garbage = adapter(properties()).instant("up").get();

        body = "{\"status\":\"success\",\"data\":{}}";
        FetchResult<List<MetricSeries>> noResult = adapter(properties()).instant("up").get();

        assertEquals(FetchErrorType.MALFORMED_PAYLOAD, garbage.getError().type());
        assertEquals(FetchErrorType.MALFORMED_PAYLOAD, noResult.getError().type());
    }

    @Test
    void slowBackendTimesOutAsUnreachable() throws Exception {
        delayMillis = 2_000;
        body = fixture("global-system-status.json");
        MetricsProperties properties = properties();
        properties.setRequestTimeout(Duration.ofMillis(200));

        FetchResult<List<MetricSeries>> result = adapter(properties).instant("up").get();

        assertEquals(FetchErrorType.SOURCE_UNREACHABLE, result.getError().type());
    }

    @Test
    void refusedConnectionIsUnreachable() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        MetricsProperties properties = properties();
        properties.setBaseUrl("http://127.0.0.1:" + port);

        FetchResult<List<MetricSeries>> result = adapter(properties).instant("up").get();

        assertEquals(FetchErrorType.SOURCE_UNREACHABLE, result.getError().type());
    }

    @Test
    void sendsBearerTokenOrBasicCredentials() throws Exception {
        body = fixture("global-system-status.json");

        MetricsProperties token = properties();
        token.setToken("s3cr3t");
        adapter(token).instant("up").get();

        MetricsProperties basic = properties();
        basic.setUsername("grafana");
        basic.setPassword("pw");
        adapter(basic).instant("up").get();

        adapter(properties()).instant("up").get();

        assertEquals("Bearer s3cr3t", authorizations.get(0));
        assertEquals("Basic Z3JhZmFuYTpwdw==", authorizations.get(1));
        assertEquals("", authorizations.get(2));
    }

    private MetricsProperties properties() {
        MetricsProperties properties = new MetricsProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        properties.setRequestTimeout(Duration.ofSeconds(5));
        return properties;
    }

    private static MetricsSourceAdapter adapter(MetricsProperties properties) {
        return new MetricsSourceAdapter(properties, new ObjectMapper());
    }

    private void handle(HttpExchange exchange) throws IOException {
        requestQueries.add(exchange.getRequestURI().getRawPath() + "?" + exchange.getRequestURI().getRawQuery());
        String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        authorizations.add(authorization == null ? "" : authorization);
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = MetricsSourceAdapterTest.class.getResourceAsStream("/metrics/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
