package in.annurelay.service.condition;

import in.annurelay.domain.upstream.UpstreamResult;
import in.annurelay.infrastructure.upstream.WireProtocol;
import in.annurelay.service.correlation.RequestCorrelator;
import in.annurelay.service.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Saved-condition queries on the venue socket.
 *
 * Realtime condition hits arrive as pushes and are broadcast to the downstream
 * group {@code cond_{seq}} (see {@link #groupFor(String)}).
 */
public final class ConditionSearchService {
    private static final Logger log = LoggerFactory.getLogger(ConditionSearchService.class);

    public static final String CONDITION_GROUP_PREFIX = "cond_";

    private final RequestCorrelator correlator;
    private final SubscriptionRegistry registry;
    private final Duration requestTimeout;
    private final Duration searchTimeout;

    public ConditionSearchService(RequestCorrelator correlator, SubscriptionRegistry registry,
                                  Duration requestTimeout, Duration searchTimeout) {
        this.correlator = correlator;
        this.registry = registry;
        this.requestTimeout = requestTimeout;
        this.searchTimeout = searchTimeout;
    }

    public static String groupFor(String seq) {
        return CONDITION_GROUP_PREFIX + seq;
    }

    /** CNSRLST: the account's saved conditions. */
    public UpstreamResult listConditions() {
        return correlator.sendAndAwait(WireProtocol.conditionList(), WireProtocol.CONDITION_LIST, requestTimeout);
    }

    /** CNSRREQ with search_type 0: one page of matches. */
    public UpstreamResult search(String seq, String marketType, String contYn, String nextKey) {
        requireSeq(seq);
        UpstreamResult result = correlator.sendAndAwait(
            WireProtocol.conditionSearch(seq,
                orDefault(marketType, WireProtocol.DEFAULT_MARKET),
                orDefault(contYn, "N"),
                nextKey == null ? "" : nextKey),
            WireProtocol.CONDITION_REQUEST, searchTimeout);
        log.info("[CONDITION] search seq={} success={} upstreamError={}",
            seq, result.success(), result.isUpstreamError());
        return result;
    }

    /**
     * CNSRREQ with search_type 1. The seq is kept for reconnect replay only when
     * the venue accepted the request.
     */
    public UpstreamResult startRealtime(String seq, String marketType) {
        requireSeq(seq);
        UpstreamResult result = correlator.sendAndAwait(
            WireProtocol.conditionRealtime(seq, orDefault(marketType, WireProtocol.DEFAULT_MARKET)),
            WireProtocol.CONDITION_REQUEST, requestTimeout);
        if (result.success() && !result.isUpstreamError()) {
            registry.addCondition(seq);
            log.info("[CONDITION] ✓ realtime started for seq={}", seq);
        } else {
            log.warn("[CONDITION] realtime start failed for seq={}: {}", seq,
                result.success() ? result.returnMessage() : result.message());
        }
        return result;
    }

    /**
     * CNSRCNC. The seq leaves the registry whatever the venue answers.
     */
    public UpstreamResult cancelRealtime(String seq) {
        requireSeq(seq);
        registry.removeCondition(seq);
        UpstreamResult result = correlator.sendAndAwait(
            WireProtocol.conditionCancel(seq), WireProtocol.CONDITION_CANCEL, requestTimeout);
        log.info("[CONDITION] realtime cancelled for seq={} (reply success={})", seq, result.success());
        return result;
    }

    private static void requireSeq(String seq) {
        if (seq == null || seq.isBlank()) {
            throw new IllegalArgumentException("seq is required");
        }
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
