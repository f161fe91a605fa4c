package in.annurelay.infrastructure.metrics;

import in.annurelay.domain.upstream.ConnectionState;

import java.time.Duration;

/**
 * Relay metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Upstream connection state and reconnect attempts
 * - Correlated request outcomes and latency
 * - Push volume per data kind
 * - Cache write failures
 * - Downstream listener count and removals
 */
public interface RelayMetrics {

    /**
     * Record an upstream connection event.
     *
     * @param event connected, lost, reconnect_attempt, reconnect_failed, login_rejected, exhausted
     */
    void recordConnectionEvent(String event);

    void setConnectionState(ConnectionState state);

    /**
     * Record the outcome of a correlated request.
     *
     * @param tag     transaction name
     * @param outcome success, upstream_error, or an UpstreamErrorKind name
     * @param latency time from send to resolution
     */
    void recordRequest(String tag, String outcome, Duration latency);

    void recordPush(String kindCode);

    void recordHeartbeat();

    void recordCacheWriteFailure(String kindCode);

    /**
     * @param target    group id, or "*" for every listener
     * @param delivered listeners the frame reached
     */
    void recordBroadcast(String target, int delivered);

    void recordListenerRemoved(String reason);

    void setListenerCount(int count);
}
