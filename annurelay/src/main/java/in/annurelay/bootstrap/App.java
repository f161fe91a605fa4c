package in.annurelay.bootstrap;

import in.annurelay.config.FieldProfileLoader;
import in.annurelay.config.RelayConfig;
import in.annurelay.infrastructure.cache.CacheStore;
import in.annurelay.infrastructure.cache.InMemoryCacheStore;
import in.annurelay.infrastructure.cache.RedisCacheStore;
import in.annurelay.infrastructure.metrics.PrometheusMetricsHandler;
import in.annurelay.infrastructure.metrics.PrometheusRelayMetrics;
import in.annurelay.infrastructure.upstream.JdkWebSocketConnector;
import in.annurelay.infrastructure.upstream.UpstreamTransport;
import in.annurelay.infrastructure.upstream.auth.OAuthTokenClient;
import in.annurelay.infrastructure.upstream.auth.TokenRefreshManager;
import in.annurelay.infrastructure.upstream.common.HeartbeatMonitor;
import in.annurelay.infrastructure.upstream.common.ReconnectionPolicy;
import in.annurelay.service.MarketDataCache;
import in.annurelay.service.condition.ConditionSearchService;
import in.annurelay.service.correlation.RequestCorrelator;
import in.annurelay.service.push.FieldExtractor;
import in.annurelay.service.push.PushDispatcher;
import in.annurelay.service.subscription.SubscriptionRegistry;
import in.annurelay.service.subscription.SubscriptionService;
import in.annurelay.transport.http.ApiHandlers;
import in.annurelay.transport.ws.ClientCommandHandler;
import in.annurelay.transport.ws.ListenerRegistry;
import in.annurelay.transport.ws.RelayWsHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final String VENUE = "KIWOOM";

    public static void main(String[] args) {
        RelayConfig config = RelayConfig.fromEnv();
        log.info("Starting relay (venue={}, real={}, port={})", VENUE, config.realServer(), config.port());

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry collectorRegistry = new CollectorRegistry();
        PrometheusRelayMetrics metrics = new PrometheusRelayMetrics(collectorRegistry);

        // ═══════════════════════════════════════════════════════════════
        // Cache store
        // ═══════════════════════════════════════════════════════════════
        CacheStore store = createCacheStore(config);
        MarketDataCache marketDataCache = new MarketDataCache(
            store, config.snapshotTtlSeconds(), config.seriesTtlSeconds(), config.marketZone());

        // ═══════════════════════════════════════════════════════════════
        // Upstream session
        // ═══════════════════════════════════════════════════════════════
        TokenRefreshManager credentials = new TokenRefreshManager(VENUE,
            new OAuthTokenClient(config.restHost(), config.appKey(), config.secretKey()),
            config.tokenValidity());

        SubscriptionRegistry subscriptionRegistry = new SubscriptionRegistry();
        ReconnectionPolicy reconnectionPolicy = ReconnectionPolicy.builder()
            .baseDelay(config.reconnectBaseDelay())
            .maxAttempts(config.reconnectMaxAttempts())
            .build();

        UpstreamTransport transport = new UpstreamTransport(
            new JdkWebSocketConnector(config.requestTimeout()),
            URI.create(config.socketUrl()),
            credentials,
            subscriptionRegistry,
            reconnectionPolicy,
            metrics);

        // ═══════════════════════════════════════════════════════════════
        // Push pipeline and correlation
        // ═══════════════════════════════════════════════════════════════
        ListenerRegistry listenerRegistry = new ListenerRegistry(metrics);
        ExecutorService cacheWriter = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cache-writer");
            t.setDaemon(true);
            return t;
        });
        FieldExtractor fieldExtractor = new FieldExtractor(FieldProfileLoader.load(config.configDir()));
        PushDispatcher pushDispatcher = new PushDispatcher(
            fieldExtractor, marketDataCache, listenerRegistry, cacheWriter, metrics);

        RequestCorrelator correlator = new RequestCorrelator(transport, credentials, pushDispatcher, metrics);
        transport.setFrameHandler(correlator);

        HeartbeatMonitor heartbeatMonitor = null;
        if (config.heartbeatEnabled()) {
            heartbeatMonitor = new HeartbeatMonitor(VENUE, config.heartbeatTimeout(),
                transport::getConnectedSince, transport::dropConnection);
            correlator.setHeartbeatListener(heartbeatMonitor::recordPing);
            heartbeatMonitor.start();
            log.info("✓ Heartbeat monitor started (timeout {}s)", config.heartbeatTimeout().toSeconds());
        }

        transport.setFatalListener(reason -> {
            log.error("[UPSTREAM] Giving up on {}: {}", VENUE, reason);
            correlator.cancelAll("upstream failed: " + reason);
            if (config.exitOnUpstreamFailure()) {
                log.error("EXIT_ON_UPSTREAM_FAILURE set, exiting");
                System.exit(1);
            }
        });

        SubscriptionService subscriptionService = new SubscriptionService(subscriptionRegistry, transport);
        ConditionSearchService conditionSearchService = new ConditionSearchService(
            correlator, subscriptionRegistry, config.requestTimeout(), config.conditionSearchTimeout());

        // ═══════════════════════════════════════════════════════════════
        // Downstream surfaces
        // ═══════════════════════════════════════════════════════════════
        AtomicInteger workerSeq = new AtomicInteger();
        ExecutorService commandWorkers = Executors.newFixedThreadPool(config.commandWorkers(), r -> {
            Thread t = new Thread(r, "relay-command-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ClientCommandHandler commandHandler = new ClientCommandHandler(
            subscriptionService, conditionSearchService, listenerRegistry, transport::isConnected);
        RelayWsHub wsHub = new RelayWsHub(listenerRegistry, commandHandler, commandWorkers, config.relayToken());

        ApiHandlers api = new ApiHandlers(subscriptionService, conditionSearchService, marketDataCache,
            transport, correlator, listenerRegistry);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(collectorRegistry))
            .get("/api/health", api::health)
            .get("/api/realtime/subscriptions", api::subscriptions)
            .post("/api/realtime/price/subscribe", new BlockingHandler(api::subscribePrice))
            .post("/api/realtime/price/unsubscribe", new BlockingHandler(api::unsubscribePrice))
            .delete("/api/realtime/price/group/{groupNo}", new BlockingHandler(api::unsubscribeGroup))
            .get("/api/condition/list", new BlockingHandler(api::conditionList))
            .post("/api/condition/search", new BlockingHandler(api::conditionSearch))
            .post("/api/condition/realtime", new BlockingHandler(api::conditionRealtime))
            .post("/api/condition/cancel", new BlockingHandler(api::conditionCancel))
            .get("/api/market/{kind}/{item}", new BlockingHandler(api::marketLatest))
            .get("/api/market/{kind}/{item}/recent", new BlockingHandler(api::marketRecent))
            .get("/ws/realdata", wsHub.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Realtime relay\n\n" +
                    "API: GET /api/health, /api/realtime/subscriptions, /api/market/{kind}/{item}\n" +
                    "WS:  ws://localhost:" + config.port() + "/ws/realdata?token=<relay token>\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(cors(routes))
            .build();
        server.start();
        log.info("✓ HTTP/WS server started on port {}", config.port());

        // ═══════════════════════════════════════════════════════════════
        // Connect
        // ═══════════════════════════════════════════════════════════════
        if (transport.start()) {
            log.info("✓ Upstream connected: {}", config.socketUrl());
        } else {
            log.warn("[UPSTREAM] Initial connect failed, reconnecting in background");
        }

        HeartbeatMonitor monitor = heartbeatMonitor;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down relay");
            if (monitor != null) {
                monitor.stop();
            }
            correlator.cancelAll("shutdown");
            transport.shutdown();
            credentials.revoke();
            commandWorkers.shutdown();
            cacheWriter.shutdown();
            try {
                cacheWriter.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            try {
                store.close();
            } catch (Exception e) {
                log.warn("Cache store close failed: {}", e.getMessage());
            }
            server.stop();
            log.info("✓ Relay stopped");
        }, "shutdown"));
    }

    private static CacheStore createCacheStore(RelayConfig config) {
        if (!config.redisEnabled()) {
            log.info("[CACHE] REDIS_HOST not set, using in-memory store");
            return new InMemoryCacheStore();
        }
        RedisCacheStore redis = new RedisCacheStore(
            config.redisHost(), config.redisPort(), config.redisPassword(), config.redisDb());
        redis.ping();
        log.info("✓ Redis connected: {}:{}/{}", config.redisHost(), config.redisPort(), config.redisDb());
        return redis;
    }

    static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }
}
