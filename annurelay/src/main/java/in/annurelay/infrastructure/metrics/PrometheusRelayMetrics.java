package in.annurelay.infrastructure.metrics;

import in.annurelay.domain.upstream.ConnectionState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of RelayMetrics.
 *
 * Key Metrics:
 * - relay_upstream_connection_events_total{event}
 * - relay_upstream_connection_state - ordinal of ConnectionState (2=CONNECTED, 4=FAILED)
 * - relay_requests_total{tag, outcome}
 * - relay_request_latency_seconds{tag}
 * - relay_push_events_total{kind}
 * - relay_heartbeats_total
 * - relay_cache_write_failures_total{kind}
 * - relay_broadcasts_total{target} / relay_broadcast_deliveries_total{target}
 * - relay_listeners_removed_total{reason} / relay_listeners
 */
public class PrometheusRelayMetrics implements RelayMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRelayMetrics.class);

    private final CollectorRegistry registry;

    private final Counter connectionEvents;
    private final Gauge connectionState;
    private final Counter requests;
    private final Histogram requestLatency;
    private final Counter pushEvents;
    private final Counter heartbeats;
    private final Counter cacheWriteFailures;
    private final Counter broadcasts;
    private final Counter broadcastDeliveries;
    private final Counter listenersRemoved;
    private final Gauge listeners;

    public PrometheusRelayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRelayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connectionEvents = Counter.build()
            .name("relay_upstream_connection_events_total")
            .help("Upstream connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("relay_upstream_connection_state")
            .help("Upstream connection state ordinal (0=DISCONNECTED 1=CONNECTING 2=CONNECTED 3=RECONNECTING 4=FAILED)")
            .register(registry);

        this.requests = Counter.build()
            .name("relay_requests_total")
            .help("Correlated upstream requests by outcome")
            .labelNames("tag", "outcome")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("relay_request_latency_seconds")
            .help("Correlated upstream request latency in seconds")
            .labelNames("tag")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0, 20.0)
            .register(registry);

        this.pushEvents = Counter.build()
            .name("relay_push_events_total")
            .help("Push events received from the venue")
            .labelNames("kind")
            .register(registry);

        this.heartbeats = Counter.build()
            .name("relay_heartbeats_total")
            .help("Venue PING frames echoed")
            .register(registry);

        this.cacheWriteFailures = Counter.build()
            .name("relay_cache_write_failures_total")
            .help("Failed cache writes")
            .labelNames("kind")
            .register(registry);

        this.broadcasts = Counter.build()
            .name("relay_broadcasts_total")
            .help("Downstream broadcasts")
            .labelNames("target")
            .register(registry);

        this.broadcastDeliveries = Counter.build()
            .name("relay_broadcast_deliveries_total")
            .help("Frames delivered to downstream listeners")
            .labelNames("target")
            .register(registry);

        this.listenersRemoved = Counter.build()
            .name("relay_listeners_removed_total")
            .help("Downstream listeners removed")
            .labelNames("reason")
            .register(registry);

        this.listeners = Gauge.build()
            .name("relay_listeners")
            .help("Connected downstream listeners")
            .register(registry);

        log.info("[PrometheusRelayMetrics] Initialized");
    }

    @Override
    public void recordConnectionEvent(String event) {
        connectionEvents.labels(event).inc();
    }

    @Override
    public void setConnectionState(ConnectionState state) {
        connectionState.set(state.ordinal());
    }

    @Override
    public void recordRequest(String tag, String outcome, Duration latency) {
        requests.labels(tag, outcome).inc();
        requestLatency.labels(tag).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordPush(String kindCode) {
        pushEvents.labels(kindCode.isEmpty() ? "none" : kindCode).inc();
    }

    @Override
    public void recordHeartbeat() {
        heartbeats.inc();
    }

    @Override
    public void recordCacheWriteFailure(String kindCode) {
        cacheWriteFailures.labels(kindCode).inc();
    }

    @Override
    public void recordBroadcast(String target, int delivered) {
        // group ids are client-chosen; condition groups collapse to one label
        String label = target.startsWith("cond_") ? "cond" : target;
        broadcasts.labels(label).inc();
        broadcastDeliveries.labels(label).inc(delivered);
    }

    @Override
    public void recordListenerRemoved(String reason) {
        listenersRemoved.labels(reason).inc();
    }

    @Override
    public void setListenerCount(int count) {
        listeners.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
