package in.annurelay.infrastructure.metrics;

import in.annurelay.domain.upstream.ConnectionState;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
class MetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusRelayMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        metrics = new PrometheusRelayMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("");
    }

    private HttpResponse<String> scrape(String query) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testMetricsEndpointReturns200() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        assertTrue(response.body().contains("# HELP"));
        assertTrue(response.body().contains("# TYPE"));
    }

    @Test
    void testRecordedValuesExported() throws Exception {
        metrics.setConnectionState(ConnectionState.CONNECTED);
        metrics.recordRequest("CNSRLST", "success", Duration.ofMillis(120));
        metrics.recordPush("0B");
        metrics.recordPush("0B");
        metrics.recordBroadcast("cond_3", 2);
        metrics.setListenerCount(4);

        String body = scrape().body();

        assertTrue(body.contains("relay_upstream_connection_state 2.0"));
        assertTrue(body.contains("relay_requests_total{tag=\"CNSRLST\",outcome=\"success\",} 1.0"));
        assertTrue(body.contains("relay_push_events_total{kind=\"0B\",} 2.0"));
        assertTrue(body.contains("relay_broadcast_deliveries_total{target=\"cond\",} 2.0"),
            "Condition groups share one label");
        assertTrue(body.contains("relay_listeners 4.0"));
        assertTrue(body.contains("relay_request_latency_seconds_count{tag=\"CNSRLST\",} 1.0"));
    }

    @Test
    void testNameFilter() throws Exception {
        metrics.setListenerCount(1);
        metrics.recordHeartbeat();

        String body = scrape("?name%5B%5D=relay_listeners").body();

        assertTrue(body.contains("relay_listeners 1.0"));
        assertFalse(body.contains("relay_heartbeats_total"));
    }
}
