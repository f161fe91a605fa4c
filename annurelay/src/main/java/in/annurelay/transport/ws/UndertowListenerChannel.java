package in.annurelay.transport.ws;

import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Listener channel over an Undertow WebSocket. Sends are asynchronous; a failure
 * reported after {@link #send} returned goes to the failure hook.
 */
final class UndertowListenerChannel implements ListenerChannel {
    private static final Logger log = LoggerFactory.getLogger(UndertowListenerChannel.class);

    private final WebSocketChannel channel;
    private volatile Consumer<Throwable> failureHook = error -> { };

    UndertowListenerChannel(WebSocketChannel channel) {
        this.channel = channel;
    }

    void setFailureHook(Consumer<Throwable> failureHook) {
        this.failureHook = failureHook;
    }

    @Override
    public void send(String message) throws IOException {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            throw new IOException("Channel closed");
        }
        WebSockets.sendText(message, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                failureHook.accept(throwable);
            }
        });
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.sendClose();
            channel.close();
        } catch (IOException e) {
            log.debug("[WS] Close failed for {}: {}", remoteAddress(), e.getMessage());
        }
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}
