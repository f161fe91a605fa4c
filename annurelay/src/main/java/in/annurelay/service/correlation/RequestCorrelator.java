package in.annurelay.service.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import in.annurelay.domain.upstream.UpstreamErrorKind;
import in.annurelay.domain.upstream.UpstreamResult;
import in.annurelay.infrastructure.metrics.RelayMetrics;
import in.annurelay.infrastructure.upstream.UpstreamFrameHandler;
import in.annurelay.infrastructure.upstream.UpstreamSender;
import in.annurelay.infrastructure.upstream.WireProtocol;
import in.annurelay.infrastructure.upstream.auth.CredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Matches venue replies to the callers waiting for them.
 *
 * The venue has no request ids: a reply carries the request's transaction name
 * ({@code trnm}) and nothing else, so at most one request per transaction name
 * can be in flight. A second request for a pending name fails immediately.
 *
 * Frames from the receive loop are classified in this order:
 * <ol>
 *   <li>PING: echoed back verbatim, never touches the pending table</li>
 *   <li>LOGIN: accepted resets the reconnect budget, a non-zero return_code drops the connection</li>
 *   <li>a pending request with the same trnm: completed exactly once</li>
 *   <li>anything else: handed to the push handler</li>
 * </ol>
 */
public final class RequestCorrelator implements UpstreamFrameHandler {
    private static final Logger log = LoggerFactory.getLogger(RequestCorrelator.class);

    private final ConcurrentHashMap<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final UpstreamSender sender;
    private final CredentialProvider credentials;
    private final UpstreamFrameHandler pushHandler;
    private final RelayMetrics metrics;

    private volatile Runnable heartbeatListener = () -> { };

    public RequestCorrelator(UpstreamSender sender, CredentialProvider credentials,
                             UpstreamFrameHandler pushHandler, RelayMetrics metrics) {
        this.sender = sender;
        this.credentials = credentials;
        this.pushHandler = pushHandler;
        this.metrics = metrics;
    }

    public void setHeartbeatListener(Runnable heartbeatListener) {
        this.heartbeatListener = heartbeatListener;
    }

    /**
     * Send {@code message} and wait for the next frame tagged {@code tag}.
     * Never retries; a timeout leaves no trace in the pending table.
     */
    public UpstreamResult sendAndAwait(Object message, String tag, Duration timeout) {
        Instant start = Instant.now();
        PendingRequest slot = new PendingRequest(tag, new CompletableFuture<>(), start, start.plus(timeout));

        PendingRequest existing = pending.putIfAbsent(tag, slot);
        if (existing != null) {
            log.warn("[CORRELATOR] {} already pending since {}, rejecting duplicate", tag, existing.sentAt());
            return finish(start, UpstreamResult.failure(tag, UpstreamErrorKind.DUPLICATE_TAG,
                "A " + tag + " request is already awaiting its reply"));
        }

        if (!sender.send(message)) {
            pending.remove(tag, slot);
            return finish(start, UpstreamResult.failure(tag, UpstreamErrorKind.TRANSPORT,
                "Message could not be sent upstream"));
        }

        try {
            JsonNode reply = slot.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return finish(start, UpstreamResult.success(tag, reply));
        } catch (TimeoutException e) {
            if (pending.remove(tag, slot)) {
                log.warn("[CORRELATOR] {} timed out after {}ms", tag, timeout.toMillis());
                return finish(start, UpstreamResult.failure(tag, UpstreamErrorKind.TIMEOUT,
                    tag + " reply not received within " + timeout.toMillis() + "ms"));
            }
            // the reply claimed the slot just as the deadline passed
            return finish(start, UpstreamResult.success(tag, slot.completion().join()));
        } catch (InterruptedException e) {
            pending.remove(tag, slot);
            Thread.currentThread().interrupt();
            return finish(start, UpstreamResult.failure(tag, UpstreamErrorKind.INTERRUPTED,
                "Interrupted while waiting for " + tag));
        } catch (ExecutionException e) {
            pending.remove(tag, slot);
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            return finish(start, UpstreamResult.failure(tag, UpstreamErrorKind.TRANSPORT, reason));
        }
    }

    @Override
    public void onFrame(String raw, JsonNode frame) {
        String tag = WireProtocol.tagOf(frame);

        if (WireProtocol.PING.equals(tag)) {
            sender.send(raw);
            metrics.recordHeartbeat();
            heartbeatListener.run();
            return;
        }

        if (WireProtocol.LOGIN.equals(tag)) {
            handleLoginReply(frame);
            return;
        }

        PendingRequest slot = tag.isEmpty() ? null : pending.remove(tag);
        if (slot != null) {
            slot.completion().complete(frame);
            log.debug("[CORRELATOR] {} resolved in {}ms", tag,
                Duration.between(slot.sentAt(), Instant.now()).toMillis());
            return;
        }

        pushHandler.onFrame(raw, frame);
    }

    /**
     * Fail every waiting caller. Used on shutdown.
     */
    public void cancelAll(String reason) {
        for (String tag : Set.copyOf(pending.keySet())) {
            PendingRequest slot = pending.remove(tag);
            if (slot != null) {
                slot.completion().completeExceptionally(new IllegalStateException(reason));
            }
        }
    }

    public Set<String> pendingTags() {
        return new TreeSet<>(pending.keySet());
    }

    private void handleLoginReply(JsonNode frame) {
        int returnCode = frame.path("return_code").asInt(0);
        if (returnCode == 0) {
            log.info("[CORRELATOR] ✓ Login accepted");
            sender.onLoginAccepted();
            return;
        }
        String message = frame.path("return_msg").asText("");
        log.error("[CORRELATOR] Login rejected: return_code={} return_msg={}", returnCode, message);
        metrics.recordConnectionEvent("login_rejected");
        credentials.invalidate();
        sender.dropConnection("login rejected (" + returnCode + ")");
    }

    private UpstreamResult finish(Instant start, UpstreamResult result) {
        String outcome;
        if (!result.success()) {
            outcome = result.errorKind().name();
        } else {
            outcome = result.isUpstreamError() ? "upstream_error" : "success";
        }
        metrics.recordRequest(result.tag(), outcome, Duration.between(start, Instant.now()));
        return result;
    }

    record PendingRequest(String tag, CompletableFuture<JsonNode> completion, Instant sentAt, Instant deadline) {}
}
