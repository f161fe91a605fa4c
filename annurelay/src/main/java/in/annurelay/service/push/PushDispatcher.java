package in.annurelay.service.push;

import com.fasterxml.jackson.databind.JsonNode;
import in.annurelay.domain.realtime.DataKind;
import in.annurelay.domain.realtime.PushEvent;
import in.annurelay.infrastructure.metrics.RelayMetrics;
import in.annurelay.infrastructure.upstream.UpstreamFrameHandler;
import in.annurelay.service.MarketDataCache;
import in.annurelay.service.condition.ConditionSearchService;
import in.annurelay.transport.ws.ListenerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Handles every frame that is not a reply to a waiting request.
 *
 * Each {@code data[]} entry is reduced to its kind's field profile and written to
 * the cache on the cache-writer executor. The original frame text goes to the
 * downstream listeners unreduced. The two sinks fail independently.
 */
public final class PushDispatcher implements UpstreamFrameHandler {
    private static final Logger log = LoggerFactory.getLogger(PushDispatcher.class);

    private final FieldExtractor extractor;
    private final MarketDataCache cache;
    private final ListenerRegistry listeners;
    private final Executor cacheWriter;
    private final RelayMetrics metrics;

    public PushDispatcher(FieldExtractor extractor, MarketDataCache cache, ListenerRegistry listeners,
                          Executor cacheWriter, RelayMetrics metrics) {
        this.extractor = extractor;
        this.cache = cache;
        this.listeners = listeners;
        this.cacheWriter = cacheWriter;
        this.metrics = metrics;
    }

    @Override
    public void onFrame(String raw, JsonNode frame) {
        List<PushEvent> events = parseEvents(frame);
        for (PushEvent event : events) {
            metrics.recordPush(event.kindCode());
            if (event.instrumentId().isEmpty()) {
                log.debug("[PUSH] {} entry without item, not cached", event.kindCode());
                continue;
            }
            writeToCache(extractor.reduce(event));
        }

        String target = targetOf(events);
        try {
            listeners.broadcast(target, raw);
        } catch (RuntimeException e) {
            log.error("[PUSH] Broadcast to {} failed", target, e);
        }
    }

    static List<PushEvent> parseEvents(JsonNode frame) {
        JsonNode data = frame.path("data");
        if (!data.isArray()) {
            return List.of();
        }
        List<PushEvent> events = new ArrayList<>(data.size());
        for (JsonNode entry : data) {
            PushEvent event = PushEvent.fromJson(entry);
            if (event != null) {
                events.add(event);
            }
        }
        return events;
    }

    /**
     * Condition hits for a single condition go to that condition's group; everything else to all listeners.
     */
    static String targetOf(List<PushEvent> events) {
        if (events.isEmpty()) {
            return ListenerRegistry.ALL;
        }
        String seq = null;
        for (PushEvent event : events) {
            if (event.kind() != DataKind.CONDITION_HIT) {
                return ListenerRegistry.ALL;
            }
            String eventSeq = event.field(DataKind.CONDITION_SEQ_FIELD);
            if (eventSeq == null || (seq != null && !seq.equals(eventSeq))) {
                return ListenerRegistry.ALL;
            }
            seq = eventSeq;
        }
        return ConditionSearchService.groupFor(seq);
    }

    private void writeToCache(PushEvent reduced) {
        try {
            cacheWriter.execute(() -> {
                try {
                    cache.write(reduced);
                } catch (RuntimeException e) {
                    log.warn("[PUSH] Cache write failed for {}:{}: {}",
                        reduced.kindCode(), reduced.instrumentId(), e.getMessage());
                    metrics.recordCacheWriteFailure(reduced.kindCode());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[PUSH] Cache writer rejected {}:{}", reduced.kindCode(), reduced.instrumentId());
            metrics.recordCacheWriteFailure(reduced.kindCode());
        }
    }
}
