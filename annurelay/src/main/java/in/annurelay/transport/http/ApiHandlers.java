package in.annurelay.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.annurelay.domain.upstream.ConnectionState;
import in.annurelay.domain.upstream.UpstreamResult;
import in.annurelay.infrastructure.upstream.UpstreamTransport;
import in.annurelay.service.MarketDataCache;
import in.annurelay.service.condition.ConditionSearchService;
import in.annurelay.service.correlation.RequestCorrelator;
import in.annurelay.service.subscription.SubscriptionService;
import in.annurelay.service.subscription.SubscriptionService.MutationResult;
import in.annurelay.transport.ws.ListenerRegistry;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST handlers. Registered behind a BlockingHandler: upstream calls wait for their reply.
 *
 * Responses use the same envelope as the downstream socket:
 * {@code {status: "success"|"error", data?|message?}}.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final int DEFAULT_RECENT_COUNT = 10;
    static final int MAX_RECENT_COUNT = 500;

    private final SubscriptionService subscriptions;
    private final ConditionSearchService conditions;
    private final MarketDataCache cache;
    private final UpstreamTransport transport;
    private final RequestCorrelator correlator;
    private final ListenerRegistry listeners;

    public ApiHandlers(SubscriptionService subscriptions, ConditionSearchService conditions, MarketDataCache cache,
                       UpstreamTransport transport, RequestCorrelator correlator, ListenerRegistry listeners) {
        this.subscriptions = subscriptions;
        this.conditions = conditions;
        this.cache = cache;
        this.transport = transport;
        this.correlator = correlator;
        this.listeners = listeners;
    }

    // ═══════════════════════════════════════════════════════════════
    // Health / status
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/health - 200 when the upstream session is up, 503 otherwise.
     */
    public void health(HttpServerExchange exchange) {
        ConnectionState state = transport.getState();
        ObjectNode data = MAPPER.createObjectNode();
        data.put("status", switch (state) {
            case CONNECTED -> "UP";
            case FAILED -> "DOWN";
            default -> "DEGRADED";
        });

        ObjectNode upstream = data.putObject("upstream");
        upstream.put("state", state.name());
        upstream.set("connected_since", MAPPER.valueToTree(transport.getConnectedSince()));
        upstream.set("last_connected_at", MAPPER.valueToTree(transport.getLastConnectedAt()));
        upstream.put("reconnect_attempts", transport.getReconnectAttempts());

        data.put("listeners", listeners.listenerCount());
        data.put("pending_requests", correlator.pendingTags().size());
        data.put("subscription_groups", subscriptions.subscriptions().size());
        data.put("condition_subscriptions", subscriptions.conditionSubscriptions().size());

        sendJson(exchange, state == ConnectionState.CONNECTED ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE,
            success(data));
    }

    /**
     * GET /api/realtime/subscriptions
     */
    public void subscriptions(HttpServerExchange exchange) {
        ObjectNode data = MAPPER.createObjectNode();
        data.set("subscriptions", MAPPER.valueToTree(subscriptions.subscriptions()));
        data.set("condition_subscriptions", MAPPER.valueToTree(subscriptions.conditionSubscriptions()));
        data.put("upstream_connected", transport.isConnected());
        sendJson(exchange, StatusCodes.OK, success(data));
    }

    // ═══════════════════════════════════════════════════════════════
    // Price subscriptions
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/realtime/price/subscribe - {@code {group_no?, items, data_types?, refresh?}}
     */
    public void subscribePrice(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            String groupId = body.path("group_no").asText("1");
            List<String> items = stringList(body.get("items"));
            List<String> kinds = stringList(body.get("data_types"));
            boolean refresh = body.path("refresh").asBoolean(true);
            MutationResult result = subscriptions.registerInstruments(
                groupId, items, kinds == null ? List.of("0D") : kinds, refresh);
            sendMutation(exchange, result);
        });
    }

    /**
     * POST /api/realtime/price/unsubscribe - {@code {group_no?, items, data_types?}}
     */
    public void unsubscribePrice(HttpServerExchange exchange) {
        withBody(exchange, body -> {
            String groupId = body.path("group_no").asText("1");
            List<String> items = stringList(body.get("items"));
            if (items == null) {
                throw new IllegalArgumentException("'items' is required");
            }
            MutationResult result = subscriptions.unregisterInstruments(
                groupId, items, stringList(body.get("data_types")));
            sendMutation(exchange, result);
        });
    }

    /**
     * DELETE /api/realtime/price/group/{groupNo}
     */
    public void unsubscribeGroup(HttpServerExchange exchange) {
        try {
            String groupId = requireParam(exchange, "groupNo");
            sendMutation(exchange, subscriptions.unregisterGroup(groupId));
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            serverError(exchange, "unsubscribe group", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Condition search
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/condition/list
     */
    public void conditionList(HttpServerExchange exchange) {
        if (rejectIfDisconnected(exchange)) {
            return;
        }
        try {
            sendUpstream(exchange, conditions.listConditions());
        } catch (RuntimeException e) {
            serverError(exchange, "condition list", e);
        }
    }

    /**
     * POST /api/condition/search - {@code {seq, stex_tp?, cont_yn?, next_key?}}
     */
    public void conditionSearch(HttpServerExchange exchange) {
        if (rejectIfDisconnected(exchange)) {
            return;
        }
        withBody(exchange, body -> sendUpstream(exchange, conditions.search(
            requireText(body, "seq"),
            body.path("stex_tp").asText(null),
            body.path("cont_yn").asText(null),
            body.path("next_key").asText(null))));
    }

    /**
     * POST /api/condition/realtime - {@code {seq, stex_tp?}}
     */
    public void conditionRealtime(HttpServerExchange exchange) {
        if (rejectIfDisconnected(exchange)) {
            return;
        }
        withBody(exchange, body -> sendUpstream(exchange,
            conditions.startRealtime(requireText(body, "seq"), body.path("stex_tp").asText(null))));
    }

    /**
     * POST /api/condition/cancel - {@code {seq}}
     */
    public void conditionCancel(HttpServerExchange exchange) {
        if (rejectIfDisconnected(exchange)) {
            return;
        }
        withBody(exchange, body -> sendUpstream(exchange, conditions.cancelRealtime(requireText(body, "seq"))));
    }

    // ═══════════════════════════════════════════════════════════════
    // Cached market data
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/market/{kind}/{item}
     */
    public void marketLatest(HttpServerExchange exchange) {
        try {
            String kind = requireParam(exchange, "kind");
            String item = requireParam(exchange, "item");
            Optional<Map<String, String>> record = cache.latest(kind, item);
            if (record.isEmpty()) {
                sendError(exchange, StatusCodes.NOT_FOUND, "No cached data for " + kind + ":" + item);
                return;
            }
            sendJson(exchange, StatusCodes.OK, success(MAPPER.valueToTree(record.get())));
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            serverError(exchange, "market latest", e);
        }
    }

    /**
     * GET /api/market/{kind}/{item}/recent?count=N
     */
    public void marketRecent(HttpServerExchange exchange) {
        try {
            String kind = requireParam(exchange, "kind");
            String item = requireParam(exchange, "item");
            int count = parseCount(exchange.getQueryParameters().get("count"));
            List<Map<String, String>> records = cache.recent(kind, item, count);
            if (records.isEmpty()) {
                sendError(exchange, StatusCodes.NOT_FOUND, "No cached data for " + kind + ":" + item);
                return;
            }
            sendJson(exchange, StatusCodes.OK, success(MAPPER.valueToTree(records)));
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            serverError(exchange, "market recent", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    @FunctionalInterface
    private interface BodyAction {
        void accept(JsonNode body);
    }

    private void withBody(HttpServerExchange exchange, BodyAction action) {
        exchange.getRequestReceiver().receiveFullString((ex, raw) -> {
            JsonNode body;
            try {
                body = raw == null || raw.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(raw);
            } catch (JsonProcessingException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getOriginalMessage());
                return;
            }
            if (!body.isObject()) {
                sendError(ex, StatusCodes.BAD_REQUEST, "Body must be a JSON object");
                return;
            }
            try {
                action.accept(body);
            } catch (IllegalArgumentException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (RuntimeException e) {
                serverError(ex, ex.getRequestPath(), e);
            }
        }, StandardCharsets.UTF_8);
    }

    private boolean rejectIfDisconnected(HttpServerExchange exchange) {
        if (transport.isConnected()) {
            return false;
        }
        sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Upstream not connected (" + transport.getState() + ")");
        return true;
    }

    /**
     * A registry change that could not be sent upstream is kept for replay and reported as 503.
     */
    private void sendMutation(HttpServerExchange exchange, MutationResult result) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("group_no", result.groupId());
        data.put("delivered", result.delivered());
        data.set("group", MAPPER.valueToTree(result.groupState()));
        if (result.delivered()) {
            sendJson(exchange, StatusCodes.OK, success(data));
            return;
        }
        ObjectNode body = error("Upstream not connected; change kept and replayed on reconnect");
        body.set("data", data);
        sendJson(exchange, StatusCodes.SERVICE_UNAVAILABLE, body);
    }

    static int statusFor(UpstreamResult result) {
        if (result.success()) {
            return result.isUpstreamError() ? StatusCodes.BAD_GATEWAY : StatusCodes.OK;
        }
        return switch (result.errorKind()) {
            case TRANSPORT -> StatusCodes.SERVICE_UNAVAILABLE;
            case TIMEOUT -> StatusCodes.GATEWAY_TIME_OUT;
            case DUPLICATE_TAG -> StatusCodes.CONFLICT;
            case INTERRUPTED -> StatusCodes.INTERNAL_SERVER_ERROR;
        };
    }

    private void sendUpstream(HttpServerExchange exchange, UpstreamResult result) {
        int status = statusFor(result);
        if (status == StatusCodes.OK) {
            sendJson(exchange, status, success(result.payload()));
            return;
        }
        ObjectNode body = error(result.success() ? result.returnMessage() : result.message());
        if (result.success()) {
            body.set("data", result.payload());
        } else {
            body.put("error_kind", result.errorKind().name());
        }
        sendJson(exchange, status, body);
    }

    static int parseCount(Deque<String> param) {
        if (param == null || param.isEmpty()) {
            return DEFAULT_RECENT_COUNT;
        }
        int count;
        try {
            count = Integer.parseInt(param.getFirst().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'count' must be an integer");
        }
        if (count <= 0 || count > MAX_RECENT_COUNT) {
            throw new IllegalArgumentException("'count' must be between 1 and " + MAX_RECENT_COUNT);
        }
        return count;
    }

    private static String requireParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.getFirst().isBlank()) {
            throw new IllegalArgumentException("Missing '" + name + "'");
        }
        return values.getFirst();
    }

    private static String requireText(JsonNode body, String field) {
        String value = body.path(field).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return value;
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private static ObjectNode success(JsonNode data) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", "success");
        body.set("data", data);
        return body;
    }

    private static ObjectNode error(String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", "error");
        body.put("message", message);
        return body;
    }

    private static void serverError(HttpServerExchange exchange, String operation, RuntimeException e) {
        log.error("[API] {} failed: {}", operation, e.getMessage(), e);
        sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal error: " + e.getMessage());
    }

    private static void sendError(HttpServerExchange exchange, int statusCode, String message) {
        sendJson(exchange, statusCode, error(message));
    }

    private static void sendJson(HttpServerExchange exchange, int statusCode, JsonNode body) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
