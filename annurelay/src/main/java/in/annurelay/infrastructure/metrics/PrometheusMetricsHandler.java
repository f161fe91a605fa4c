package in.annurelay.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics in Prometheus text format 0.0.4.
 *
 * <p>Supports the standard {@code name[]} filter, e.g.
 * {@code /metrics?name[]=relay_listeners&name[]=relay_requests_total}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        try {
            StringWriter writer = new StringWriter();
            if (names == null || names.isEmpty()) {
                TextFormat.write004(writer, registry.metricFamilySamples());
            } else {
                Set<String> included = new HashSet<>(names);
                TextFormat.write004(writer, registry.filteredMetricFamilySamples(included));
            }

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseSender().send(writer.toString());
        } catch (IOException e) {
            log.error("[METRICS] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
