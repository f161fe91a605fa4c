package in.annurelay.infrastructure.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annurelay.domain.upstream.ConnectionState;
import in.annurelay.infrastructure.metrics.RelayMetrics;
import in.annurelay.infrastructure.upstream.auth.CredentialProvider;
import in.annurelay.infrastructure.upstream.common.ReconnectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Owns the single WebSocket connection to the venue.
 *
 * Connect sequence: open socket, send LOGIN with the current token, replay the
 * subscription state from the {@link ReplaySource}, then start one receive-loop
 * thread for that socket. Every frame read is parsed and handed to the
 * {@link UpstreamFrameHandler} in arrival order.
 *
 * When the receive loop ends the transport moves to RECONNECTING and a single
 * reconnect thread retries with linear backoff. The attempt count resets only
 * when the venue accepts LOGIN; a connection lost before that counts as a
 * failed attempt. Once the policy's attempts are
 * used up the state becomes FAILED and the fatal listener is told; nothing
 * retries after that until {@link #start()} is called again.
 *
 * State machine:
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED → (lost) → RECONNECTING → CONNECTING → ...
 *                                                  RECONNECTING → (exhausted) → FAILED
 * </pre>
 */
public final class UpstreamTransport implements UpstreamSender {
    private static final Logger log = LoggerFactory.getLogger(UpstreamTransport.class);
    private static final ObjectMapper MAPPER = WireProtocol.MAPPER;

    private final UpstreamConnector connector;
    private final URI endpoint;
    private final CredentialProvider credentials;
    private final ReplaySource replaySource;
    private final ReconnectionPolicy policy;
    private final RelayMetrics metrics;

    private final Object lock = new Object();
    private final ExecutorService reconnectExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "upstream-reconnect");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean(false);
    private final AtomicInteger connectionSeq = new AtomicInteger();

    private volatile UpstreamFrameHandler frameHandler = (raw, frame) -> { };
    private volatile Consumer<String> fatalListener = reason -> { };
    private volatile UpstreamSocket socket;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Instant lastConnectedAt;
    private volatile boolean running = true;
    private volatile boolean awaitingLogin;

    public UpstreamTransport(UpstreamConnector connector, URI endpoint, CredentialProvider credentials,
                             ReplaySource replaySource, ReconnectionPolicy policy, RelayMetrics metrics) {
        this.connector = connector;
        this.endpoint = endpoint;
        this.credentials = credentials;
        this.replaySource = replaySource;
        this.policy = policy;
        this.metrics = metrics;
    }

    public void setFrameHandler(UpstreamFrameHandler frameHandler) {
        this.frameHandler = frameHandler;
    }

    /**
     * Called once, from the reconnect thread, when reconnect attempts are exhausted.
     */
    public void setFatalListener(Consumer<String> fatalListener) {
        this.fatalListener = fatalListener;
    }

    /**
     * Connect, or fall into the reconnect cycle if the first attempt fails.
     *
     * @return true if connected on the first attempt
     */
    public boolean start() {
        running = true;
        policy.reset();
        if (connect()) {
            return true;
        }
        log.warn("[UPSTREAM] Initial connect failed, entering reconnect cycle");
        synchronized (lock) {
            setState(ConnectionState.RECONNECTING);
        }
        scheduleReconnect();
        return false;
    }

    /**
     * Open a socket, log in and replay subscriptions. No-op when already connected.
     *
     * @return true if connected when this returns
     */
    public boolean connect() {
        synchronized (lock) {
            if (socket != null && state == ConnectionState.CONNECTED) {
                return true;
            }
            if (!running) {
                log.debug("[UPSTREAM] Transport stopped, not connecting");
                return false;
            }
            ConnectionState previous = state;
            setState(ConnectionState.CONNECTING);

            UpstreamSocket candidate = null;
            try {
                String token = credentials.getToken();
                log.info("[UPSTREAM] Connecting to {}", endpoint);
                candidate = connector.open(endpoint);
                candidate.sendText(MAPPER.writeValueAsString(WireProtocol.login(token)));

                List<ObjectNode> replay = replaySource.replayFrames();
                for (ObjectNode frame : replay) {
                    candidate.sendText(MAPPER.writeValueAsString(frame));
                }

                socket = candidate;
                lastConnectedAt = Instant.now();
                awaitingLogin = true;
                setState(ConnectionState.CONNECTED);
                metrics.recordConnectionEvent("connected");
                startReceiveLoop(candidate, connectionSeq.incrementAndGet());

                log.info("[UPSTREAM] ✓ Connected and logged in ({} replay frames sent)", replay.size());
                return true;
            } catch (TransportException | IOException | RuntimeException e) {
                log.warn("[UPSTREAM] Connect failed: {}", e.getMessage());
                if (candidate != null) {
                    candidate.close();
                }
                if (previous == ConnectionState.FAILED) {
                    setState(ConnectionState.FAILED);
                } else {
                    setState(reconnectScheduled.get() ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED);
                }
                return false;
            }
        }
    }

    @Override
    public boolean send(Object message) {
        String text;
        try {
            text = message instanceof String ? (String) message : MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("[UPSTREAM] Cannot serialize outbound message: {}", e.getMessage());
            return false;
        }

        UpstreamSocket current = socket;
        if (current == null || state != ConnectionState.CONNECTED) {
            if (!running) {
                return false;
            }
            log.warn("[UPSTREAM] Not connected, trying one connect before send");
            if (!connect()) {
                return false;
            }
            current = socket;
            if (current == null) {
                return false;
            }
        }

        try {
            current.sendText(text);
            log.debug("[UPSTREAM] → {}", abbreviate(text));
            return true;
        } catch (IOException e) {
            log.error("[UPSTREAM] Send failed: {}", e.getMessage());
            handleConnectionLost(current, "send failed: " + e.getMessage());
            return false;
        }
    }

    @Override
    public void dropConnection(String reason) {
        UpstreamSocket current = socket;
        if (current != null) {
            handleConnectionLost(current, reason);
        }
    }

    @Override
    public void onLoginAccepted() {
        if (awaitingLogin) {
            awaitingLogin = false;
            policy.recordSuccess();
        }
    }

    /**
     * Close the connection and stop reconnecting.
     */
    public void disconnect() {
        running = false;
        UpstreamSocket current;
        synchronized (lock) {
            current = socket;
            socket = null;
            setState(ConnectionState.DISCONNECTED);
        }
        if (current != null) {
            current.close();
        }
        log.info("[UPSTREAM] Disconnected");
    }

    public void shutdown() {
        disconnect();
        reconnectExecutor.shutdownNow();
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && socket != null;
    }

    public ConnectionState getState() {
        return state;
    }

    public Instant getLastConnectedAt() {
        return lastConnectedAt;
    }

    /**
     * @return when the current connection was established, or null when not connected
     */
    public Instant getConnectedSince() {
        return isConnected() ? lastConnectedAt : null;
    }

    public int getReconnectAttempts() {
        return policy.getAttemptCount();
    }

    private void startReceiveLoop(UpstreamSocket sock, int id) {
        Thread t = new Thread(() -> receiveLoop(sock), "upstream-receive-" + id);
        t.setDaemon(true);
        t.start();
    }

    private void receiveLoop(UpstreamSocket sock) {
        String reason = "closed by venue";
        try {
            while (true) {
                String raw = sock.receive();
                if (raw == null || socket != sock) {
                    break;
                }
                dispatch(raw);
            }
        } catch (IOException e) {
            reason = "read failed: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = "receive loop interrupted";
        }
        handleConnectionLost(sock, reason);
    }

    private void dispatch(String raw) {
        JsonNode frame;
        try {
            frame = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("[UPSTREAM] Skipping malformed frame: {}", abbreviate(raw));
            return;
        }
        try {
            frameHandler.onFrame(raw, frame);
        } catch (RuntimeException e) {
            log.error("[UPSTREAM] Frame handler failed for trnm={}", WireProtocol.tagOf(frame), e);
        }
    }

    private void handleConnectionLost(UpstreamSocket sock, String reason) {
        synchronized (lock) {
            if (socket != sock) {
                return;
            }
            socket = null;
            sock.close();
            metrics.recordConnectionEvent("lost");
            if (!running) {
                setState(ConnectionState.DISCONNECTED);
                return;
            }
            log.warn("[UPSTREAM] Connection lost: {}", reason);
            if (awaitingLogin) {
                awaitingLogin = false;
                policy.recordFailure();
                log.warn("[UPSTREAM] Lost before login was accepted ({}/{} attempts used)",
                    policy.getAttemptCount(), policy.getMaxAttempts());
            }
            setState(ConnectionState.RECONNECTING);
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!running || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            reconnectExecutor.submit(this::reconnectLoop);
        } catch (RuntimeException e) {
            reconnectScheduled.set(false);
            log.error("[UPSTREAM] Could not schedule reconnect: {}", e.getMessage());
        }
    }

    private void reconnectLoop() {
        try {
            while (running) {
                if (isConnected()) {
                    return;
                }
                if (!policy.shouldRetry()) {
                    enterFailed();
                    return;
                }
                Duration delay = policy.getNextDelay();
                int attempt = policy.getAttemptCount() + 1;
                log.info("[UPSTREAM] Reconnect attempt {}/{} in {}ms",
                    attempt, policy.getMaxAttempts(), delay.toMillis());
                metrics.recordConnectionEvent("reconnect_attempt");
                Thread.sleep(delay.toMillis());

                if (!running || isConnected()) {
                    return;
                }
                if (connect()) {
                    log.info("[UPSTREAM] ✓ Reconnected on attempt {}", attempt);
                    return;
                }
                policy.recordFailure();
                metrics.recordConnectionEvent("reconnect_failed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            reconnectScheduled.set(false);
            // a loss that raced with this loop's exit still needs a reconnect
            if (running && state == ConnectionState.RECONNECTING && !Thread.currentThread().isInterrupted()) {
                scheduleReconnect();
            }
        }
    }

    private void enterFailed() {
        synchronized (lock) {
            setState(ConnectionState.FAILED);
        }
        String reason = "reconnect attempts exhausted after " + policy.getMaxAttempts() + " tries";
        log.error("[UPSTREAM] ✗ {}; upstream connection is down", reason);
        metrics.recordConnectionEvent("exhausted");
        fatalListener.accept(reason);
    }

    private void setState(ConnectionState next) {
        if (state != next) {
            log.debug("[UPSTREAM] State {} → {}", state, next);
        }
        state = next;
        metrics.setConnectionState(next);
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
