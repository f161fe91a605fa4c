package in.annurelay.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Downstream WebSocket endpoint.
 *
 * Features:
 * - Optional shared-token check (?token=xxx)
 * - Commands executed on the command worker pool, never on the IO thread
 * - Listener removed from every group on close or error
 */
public final class RelayWsHub {
    private static final Logger log = LoggerFactory.getLogger(RelayWsHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ListenerRegistry listeners;
    private final ClientCommandHandler commands;
    private final ExecutorService commandWorkers;
    private final String relayToken;

    /**
     * @param relayToken shared token clients must present; null or blank disables the check
     */
    public RelayWsHub(ListenerRegistry listeners, ClientCommandHandler commands,
                      ExecutorService commandWorkers, String relayToken) {
        this.listeners = listeners;
        this.commands = commands;
        this.commandWorkers = commandWorkers;
        this.relayToken = relayToken;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                if (!isAuthorized(extractToken(exchange.getQueryString()))) {
                    log.warn("[WS] Connection rejected: invalid token from {}", channel.getSourceAddress());
                    WebSockets.sendText(toJson(ClientCommandHandler.error("connect", "Invalid or missing token")),
                        channel, null);
                    WebSockets.sendClose(CloseMessage.MSG_VIOLATES_POLICY, "unauthorized", channel, null);
                    return;
                }

                UndertowListenerChannel listenerChannel = new UndertowListenerChannel(channel);
                ListenerHandle handle = listeners.addListener(UUID.randomUUID().toString(), listenerChannel);
                listenerChannel.setFailureHook(error -> listeners.onChannelFailure(handle, error));

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        submit(handle, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        listeners.removeListener(handle);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS] {} error: {}", handle, error.toString());
                        listeners.removeListener(handle);
                        super.onError(ch, error);
                    }
                });
                channel.addCloseTask(ch -> listeners.removeListener(handle));
                channel.resumeReceives();

                ObjectNode data = MAPPER.createObjectNode();
                data.put("client_id", handle.getId());
                listeners.sendTo(handle, toJson(ClientCommandHandler.success("connect", data)));
            }
        });
    }

    boolean isAuthorized(String token) {
        if (relayToken == null || relayToken.isBlank()) {
            return true;
        }
        return relayToken.equals(token);
    }

    void submit(ListenerHandle handle, String raw) {
        try {
            commandWorkers.execute(() -> {
                ObjectNode reply = commands.handle(handle, raw);
                listeners.sendTo(handle, toJson(reply));
            });
        } catch (RejectedExecutionException e) {
            log.warn("[WS] Command rejected for {}: workers shut down", handle);
            listeners.sendTo(handle, toJson(ClientCommandHandler.error(null, "Relay is shutting down")));
        }
    }

    static String extractToken(String query) {
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            if (param.startsWith("token=")) {
                return param.substring(6);
            }
        }
        return null;
    }

    private static String toJson(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Reply serialization failed", e);
        }
    }
}
