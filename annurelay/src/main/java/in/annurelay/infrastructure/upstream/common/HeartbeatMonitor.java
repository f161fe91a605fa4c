package in.annurelay.infrastructure.upstream.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Watches the venue's heartbeat stream.
 *
 * The venue sends PING frames on its own schedule and the relay only echoes
 * them, so there is nothing to send here. If no PING has been seen for longer
 * than {@code timeout} on the current connection, the stale callback fires once
 * for that connection.
 *
 * Usage:
 * <pre>
 * HeartbeatMonitor monitor = new HeartbeatMonitor(
 *     "KIWOOM",
 *     Duration.ofSeconds(60),
 *     transport::getConnectedSince,
 *     reason -> transport.dropConnection(reason));
 *
 * monitor.start();
 * // on every venue PING:
 * monitor.recordPing();
 * monitor.stop();
 * </pre>
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final String venue;
    private final Duration timeout;
    private final Supplier<Instant> connectedSince;
    private final Consumer<String> staleCallback;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> checkTask;
    private volatile Instant lastPingTime;
    private volatile Instant reportedFor;
    private volatile boolean running = false;

    public HeartbeatMonitor(String venue, Duration timeout,
                            Supplier<Instant> connectedSince,
                            Consumer<String> staleCallback) {
        this(venue, timeout, connectedSince, staleCallback, Clock.systemUTC());
    }

    public HeartbeatMonitor(String venue, Duration timeout,
                            Supplier<Instant> connectedSince,
                            Consumer<String> staleCallback,
                            Clock clock) {
        this.venue = venue;
        this.timeout = timeout;
        this.connectedSince = connectedSince;
        this.staleCallback = staleCallback;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Heartbeat-" + venue);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat monitor already running", venue);
            return;
        }
        running = true;
        long periodMillis = Math.max(100, timeout.toMillis() / 4);
        log.info("[{}] Starting heartbeat monitor (timeout: {}s)", venue, timeout.toSeconds());
        checkTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                checkStale();
            } catch (RuntimeException e) {
                log.error("[{}] Heartbeat check failed", venue, e);
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[{}] Stopping heartbeat monitor", venue);
        running = false;
        if (checkTask != null) {
            checkTask.cancel(false);
            checkTask = null;
        }
        scheduler.shutdownNow();
    }

    public void recordPing() {
        lastPingTime = clock.instant();
        log.trace("[{}] PING received", venue);
    }

    public Instant getLastPingTime() {
        return lastPingTime;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Fire the stale callback if the current connection has gone quiet.
     *
     * @return true if the callback fired
     */
    public boolean checkStale() {
        Instant since = connectedSince.get();
        if (since == null) {
            return false;
        }
        if (since.equals(reportedFor)) {
            return false;
        }
        Instant ping = lastPingTime;
        Instant reference = ping != null && ping.isAfter(since) ? ping : since;
        Duration quiet = Duration.between(reference, clock.instant());
        if (quiet.compareTo(timeout) <= 0) {
            return false;
        }
        reportedFor = since;
        log.warn("[{}] No heartbeat for {}s, dropping connection", venue, quiet.toSeconds());
        staleCallback.accept("heartbeat timeout after " + quiet.toSeconds() + "s");
        return true;
    }
}
