package in.annurelay.infrastructure.upstream.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy with linear backoff for the upstream connection.
 *
 * The wait before attempt {@code n} (1-based) is {@code n * baseDelay}, capped
 * at {@code maxDelay}. After {@code maxAttempts} consecutive failures the
 * circuit opens and no further attempts are allowed until {@link #reset()} or
 * a recorded success.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(5))
 *     .maxAttempts(5)
 *     .build();
 *
 * while (policy.shouldRetry()) {
 *     Thread.sleep(policy.getNextDelay().toMillis());
 *     if (connect()) {
 *         policy.recordSuccess();
 *         break;
 *     }
 *     policy.recordFailure();
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Instant lastAttemptTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return true if another attempt is allowed
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Delay before the next attempt: {@code (failures + 1) * baseDelay}.
     */
    public synchronized Duration getNextDelay() {
        long millis = baseDelay.toMillis() * (attemptCount + 1L);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();
        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        lastAttemptTime = null;
        circuitOpen = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return failed attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofMinutes(5);
        private int maxAttempts = 5;

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= baseDelay");
            }
            return new ReconnectionPolicy(baseDelay, maxDelay, maxAttempts);
        }
    }
}
