package in.annurelay.infrastructure.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Upstream connector on top of the JDK WebSocket client.
 *
 * The JDK client is callback driven; frames are queued so the transport's
 * receive loop can read them one at a time.
 */
public final class JdkWebSocketConnector implements UpstreamConnector {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public JdkWebSocketConnector(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public UpstreamSocket open(URI uri) throws TransportException {
        JdkUpstreamSocket socket = new JdkUpstreamSocket(timeout);
        try {
            WebSocket ws = httpClient.newWebSocketBuilder()
                .connectTimeout(timeout)
                .buildAsync(uri, socket.listener())
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            socket.attach(ws);
            log.info("[UPSTREAM] Socket opened: {}", uri);
            return socket;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException(uri.toString(), "Handshake failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransportException(uri.toString(), "Handshake timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(uri.toString(), "Interrupted while connecting", e);
        }
    }

    static final class JdkUpstreamSocket implements UpstreamSocket {
        private static final Object CLOSED = new Object();

        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final Duration timeout;
        private volatile WebSocket ws;

        JdkUpstreamSocket(Duration timeout) {
            this.timeout = timeout;
        }

        void attach(WebSocket ws) {
            this.ws = ws;
        }

        WebSocket.Listener listener() {
            return new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        inbound.offer(buf.toString());
                        buf.setLength(0);
                    }
                    webSocket.request(1);
                    return null;
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    log.warn("[UPSTREAM] Socket closed by venue: {} {}", statusCode, reason);
                    inbound.offer(CLOSED);
                    return null;
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    log.error("[UPSTREAM] Socket error: {}", error.toString());
                    inbound.offer(CLOSED);
                }
            };
        }

        @Override
        public synchronized void sendText(String text) throws IOException {
            WebSocket current = ws;
            if (current == null || current.isOutputClosed()) {
                throw new IOException("Socket is closed");
            }
            try {
                current.sendText(text, true).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new IOException("Send failed: " + e.getCause(), e.getCause());
            } catch (TimeoutException e) {
                throw new IOException("Send timed out", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while sending", e);
            }
        }

        @Override
        public String receive() throws InterruptedException {
            Object next = inbound.take();
            if (next == CLOSED) {
                // keep the marker so later reads also see the close
                inbound.offer(CLOSED);
                return null;
            }
            return (String) next;
        }

        @Override
        public void close() {
            WebSocket current = ws;
            if (current != null && !current.isOutputClosed()) {
                current.sendClose(WebSocket.NORMAL_CLOSURE, "")
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((r, err) -> {
                        if (err != null) {
                            current.abort();
                        }
                    });
            }
            inbound.offer(CLOSED);
        }
    }
}
