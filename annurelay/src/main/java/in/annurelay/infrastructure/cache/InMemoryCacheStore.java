package in.annurelay.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Process-local cache used when no Redis host is configured.
 * Expired entries are dropped on read and scan, and by a sweep that writes
 * trigger at most once per {@link #SWEEP_INTERVAL}.
 */
public final class InMemoryCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    static final Duration SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong nextSweepAt = new AtomicLong();
    private final Clock clock;

    public InMemoryCacheStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
        log.info("[CACHE] Using in-memory cache store");
    }

    @Override
    public void setWithTtl(String key, Map<String, String> fields, long ttlSeconds) {
        if (fields.isEmpty()) {
            entries.remove(key);
            return;
        }
        Instant now = clock.instant();
        entries.put(key, new Entry(Map.copyOf(fields), now.plusSeconds(ttlSeconds)));
        sweepIfDue(now);
    }

    @Override
    public Optional<Map<String, String>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.fields());
    }

    @Override
    public Set<String> scan(String pattern) {
        Pattern regex = globToRegex(pattern);
        Instant now = clock.instant();
        Set<String> keys = new LinkedHashSet<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                entries.remove(key, entry);
            } else if (regex.matcher(key).matches()) {
                keys.add(key);
            }
        });
        return keys;
    }

    private void sweepIfDue(Instant now) {
        long due = nextSweepAt.get();
        long nowMillis = now.toEpochMilli();
        if (nowMillis < due || !nextSweepAt.compareAndSet(due, nowMillis + SWEEP_INTERVAL.toMillis())) {
            return;
        }
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("[CACHE] Swept {} expired entries ({} live)", removed, entries.size());
        }
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        entries.clear();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    private record Entry(Map<String, String> fields, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
