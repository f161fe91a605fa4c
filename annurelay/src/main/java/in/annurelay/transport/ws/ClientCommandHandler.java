package in.annurelay.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.annurelay.domain.upstream.UpstreamResult;
import in.annurelay.service.condition.ConditionSearchService;
import in.annurelay.service.subscription.SubscriptionService;
import in.annurelay.service.subscription.SubscriptionService.MutationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Executes downstream client commands.
 *
 * A command is a JSON object with an {@code action}. Every command gets exactly
 * one reply: {@code {status: "success"|"error", action, data?|message?}}. Bad
 * input produces an error reply, never an exception.
 */
public final class ClientCommandHandler {
    private static final Logger log = LoggerFactory.getLogger(ClientCommandHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String DEFAULT_GROUP = "1";
    static final String DEFAULT_PRICE_KIND = "0D";

    private final SubscriptionService subscriptions;
    private final ConditionSearchService conditions;
    private final ListenerRegistry listeners;
    private final BooleanSupplier upstreamConnected;

    public ClientCommandHandler(SubscriptionService subscriptions, ConditionSearchService conditions,
                                ListenerRegistry listeners, BooleanSupplier upstreamConnected) {
        this.subscriptions = subscriptions;
        this.conditions = conditions;
        this.listeners = listeners;
        this.upstreamConnected = upstreamConnected;
    }

    public ObjectNode handle(ListenerHandle client, String raw) {
        JsonNode command;
        try {
            command = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            return error(null, "Invalid JSON: " + e.getOriginalMessage());
        }
        if (command == null || !command.isObject()) {
            return error(null, "Command must be a JSON object");
        }
        String action = command.path("action").asText("");
        if (action.isEmpty()) {
            return error(null, "Missing 'action'");
        }

        try {
            return switch (action) {
                case "register" -> register(client, command, action, null, false);
                case "subscribe_price" -> register(client, command, action, List.of(DEFAULT_PRICE_KIND), true);
                case "unsubscribe_price" -> unsubscribe(client, command, action);
                case "condition_list" -> fromUpstream(action, conditions.listConditions());
                case "condition_search" -> fromUpstream(action, conditions.search(
                    requireText(command, "seq"),
                    command.path("stex_tp").asText(null),
                    command.path("cont_yn").asText(null),
                    command.path("next_key").asText(null)));
                case "condition_realtime" -> conditionRealtime(client, command, action);
                case "condition_cancel" -> conditionCancel(client, command, action);
                case "get_status" -> success(action, status(client));
                case "ping" -> {
                    ObjectNode data = MAPPER.createObjectNode();
                    data.put("pong", true);
                    yield success(action, data);
                }
                default -> error(action, "Unknown action: " + action);
            };
        } catch (IllegalArgumentException e) {
            return error(action, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[CLIENT] {} failed for {}", action, client, e);
            return error(action, "Internal error: " + e.getMessage());
        }
    }

    private ObjectNode register(ListenerHandle client, JsonNode command, String action,
                                List<String> defaultKinds, boolean defaultRefresh) {
        String groupId = command.path("group_no").asText(defaultKinds != null ? DEFAULT_GROUP : "");
        List<String> items = stringList(command, "items");
        List<String> kinds = stringList(command, "data_types");
        if (kinds == null) {
            kinds = stringList(command, "types");
        }
        if (kinds == null) {
            kinds = defaultKinds;
        }
        boolean refresh = command.has("refresh") ? command.path("refresh").asBoolean(defaultRefresh) : defaultRefresh;

        MutationResult result = subscriptions.registerInstruments(groupId, items, kinds, refresh);
        listeners.joinGroup(client, groupId);
        return mutationReply(action, result);
    }

    private ObjectNode unsubscribe(ListenerHandle client, JsonNode command, String action) {
        String groupId = command.path("group_no").asText(DEFAULT_GROUP);
        List<String> items = stringList(command, "items");
        MutationResult result;
        if (items == null) {
            result = subscriptions.unregisterGroup(groupId);
            listeners.leaveGroup(client, groupId);
        } else {
            result = subscriptions.unregisterInstruments(groupId, items, stringList(command, "data_types"));
        }
        return mutationReply(action, result);
    }

    private ObjectNode conditionRealtime(ListenerHandle client, JsonNode command, String action) {
        String seq = requireText(command, "seq");
        UpstreamResult result = conditions.startRealtime(seq, command.path("stex_tp").asText(null));
        if (result.success() && !result.isUpstreamError()) {
            listeners.joinGroup(client, ConditionSearchService.groupFor(seq));
        }
        return fromUpstream(action, result);
    }

    private ObjectNode conditionCancel(ListenerHandle client, JsonNode command, String action) {
        String seq = requireText(command, "seq");
        UpstreamResult result = conditions.cancelRealtime(seq);
        listeners.leaveGroup(client, ConditionSearchService.groupFor(seq));
        return fromUpstream(action, result);
    }

    private ObjectNode status(ListenerHandle client) {
        ObjectNode data = MAPPER.createObjectNode();
        data.set("subscriptions", MAPPER.valueToTree(subscriptions.subscriptions()));
        data.set("condition_subscriptions", MAPPER.valueToTree(subscriptions.conditionSubscriptions()));
        ObjectNode connection = data.putObject("connection_info");
        connection.put("client_id", client.getId());
        connection.set("groups", MAPPER.valueToTree(listeners.groupsOf(client)));
        connection.set("connected_at", MAPPER.valueToTree(client.getConnectedAt()));
        connection.put("upstream_connected", upstreamConnected.getAsBoolean());
        return data;
    }

    private ObjectNode mutationReply(String action, MutationResult result) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("group_no", result.groupId());
        data.put("delivered", result.delivered());
        data.set("group", MAPPER.valueToTree(result.groupState()));
        if (!result.delivered()) {
            // registry kept the change; the next reconnect replays it
            data.put("note", "Upstream not reachable; subscription will be sent on reconnect");
        }
        return success(action, data);
    }

    static ObjectNode fromUpstream(String action, UpstreamResult result) {
        if (!result.success()) {
            ObjectNode reply = error(action, result.message());
            reply.put("error_kind", result.errorKind().name());
            return reply;
        }
        if (result.isUpstreamError()) {
            ObjectNode reply = error(action, result.returnMessage());
            reply.set("data", result.payload());
            return reply;
        }
        return success(action, result.payload());
    }

    static ObjectNode success(String action, JsonNode data) {
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("status", "success");
        reply.put("action", action);
        reply.set("data", data);
        return reply;
    }

    static ObjectNode error(String action, String message) {
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("status", "error");
        if (action != null) {
            reply.put("action", action);
        }
        reply.put("message", message);
        return reply;
    }

    private static String requireText(JsonNode command, String field) {
        String value = command.path(field).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return value;
    }

    /**
     * Accepts an array of strings or a single string; null when the field is absent or null.
     */
    private static List<String> stringList(JsonNode command, String field) {
        JsonNode node = command.get(field);
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
}
