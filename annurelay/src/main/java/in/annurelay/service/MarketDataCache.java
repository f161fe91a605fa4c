package in.annurelay.service;

import in.annurelay.domain.realtime.CachePolicy;
import in.annurelay.domain.realtime.DataKind;
import in.annurelay.domain.realtime.PushEvent;
import in.annurelay.infrastructure.cache.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived cache of reduced push records.
 *
 * Key policy:
 * - snapshot kinds: {@code kind:instrument}, overwritten by every push
 * - time-series kinds: {@code kind:instrument:HHmmssSSS} in the market zone, one key per push
 *
 * Time-series stamps are forced strictly increasing per series so two pushes in
 * the same millisecond keep distinct keys. A series' last stamp is forgotten
 * once it is older than the series TTL.
 */
public final class MarketDataCache {
    private static final Logger log = LoggerFactory.getLogger(MarketDataCache.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmssSSS");

    public static final String TIME_FIELD = "_time";
    public static final String KIND_FIELD = "_kind";

    private final CacheStore store;
    private final long snapshotTtlSeconds;
    private final long seriesTtlSeconds;
    private final ZoneId marketZone;
    private final Clock clock;
    private final ConcurrentHashMap<String, Long> lastStamp = new ConcurrentHashMap<>();
    private volatile long nextPruneAt;

    public MarketDataCache(CacheStore store, long snapshotTtlSeconds, long seriesTtlSeconds, ZoneId marketZone) {
        this(store, snapshotTtlSeconds, seriesTtlSeconds, marketZone, Clock.systemUTC());
    }

    public MarketDataCache(CacheStore store, long snapshotTtlSeconds, long seriesTtlSeconds,
                           ZoneId marketZone, Clock clock) {
        this.store = store;
        this.snapshotTtlSeconds = snapshotTtlSeconds;
        this.seriesTtlSeconds = seriesTtlSeconds;
        this.marketZone = marketZone;
        this.clock = clock;
    }

    /**
     * Write one reduced record under its kind's key policy.
     *
     * @return the key written
     */
    public String write(PushEvent event) {
        Instant now = clock.instant();
        Map<String, String> value = new LinkedHashMap<>(event.fields());
        value.put(KIND_FIELD, event.kindCode());

        String key;
        long ttl;
        if (event.kind().cachePolicy() == CachePolicy.TIME_SERIES) {
            pruneStamps(now.toEpochMilli());
            String series = seriesKey(event.kindCode(), event.instrumentId());
            long stamp = lastStamp.merge(series, now.toEpochMilli(),
                (previous, candidate) -> Math.max(previous + 1, candidate));
            String time = marketTime(Instant.ofEpochMilli(stamp));
            value.put(TIME_FIELD, time);
            key = series + ":" + time;
            ttl = seriesTtlSeconds;
        } else {
            value.put(TIME_FIELD, marketTime(now));
            key = seriesKey(event.kindCode(), event.instrumentId());
            ttl = snapshotTtlSeconds;
        }

        store.setWithTtl(key, value, ttl);
        log.trace("[CACHE] {} ← {} fields (ttl {}s)", key, value.size(), ttl);
        return key;
    }

    /**
     * Latest snapshot-kind record, or the newest entry of a time-series kind.
     */
    public Optional<Map<String, String>> latest(String kindCode, String instrumentId) {
        if (DataKind.fromCode(kindCode).cachePolicy() == CachePolicy.TIME_SERIES) {
            List<Map<String, String>> newest = recent(kindCode, instrumentId, 1);
            return newest.isEmpty() ? Optional.empty() : Optional.of(newest.get(0));
        }
        return store.get(seriesKey(kindCode, instrumentId));
    }

    /**
     * Most recent time-series records for one instrument, newest first.
     */
    public List<Map<String, String>> recent(String kindCode, String instrumentId, int count) {
        if (count <= 0) {
            return List.of();
        }
        String prefix = seriesKey(kindCode, instrumentId) + ":";
        List<String> keys = new ArrayList<>();
        for (String key : store.scan(prefix + "*")) {
            if (stampOf(key, prefix) >= 0) {
                keys.add(key);
            }
        }
        keys.sort(Comparator.comparingLong((String key) -> stampOf(key, prefix)).reversed());

        List<Map<String, String>> records = new ArrayList<>();
        for (String key : keys) {
            if (records.size() >= count) {
                break;
            }
            // an entry can expire between scan and read
            store.get(key).ifPresent(records::add);
        }
        return records;
    }

    int trackedSeries() {
        return lastStamp.size();
    }

    private void pruneStamps(long nowMillis) {
        if (nowMillis < nextPruneAt) {
            return;
        }
        long ttlMillis = seriesTtlSeconds * 1000;
        nextPruneAt = nowMillis + Math.max(ttlMillis, 1000);
        lastStamp.values().removeIf(stamp -> stamp <= nowMillis - ttlMillis);
    }

    private String marketTime(Instant instant) {
        return TIME.format(instant.atZone(marketZone));
    }

    static String seriesKey(String kindCode, String instrumentId) {
        return kindCode + ":" + instrumentId;
    }

    /**
     * Numeric HHmmssSSS suffix, or -1 for keys that are not series entries.
     */
    private static long stampOf(String key, String prefix) {
        String suffix = key.substring(prefix.length());
        if (suffix.length() != 9) {
            return -1;
        }
        try {
            return Long.parseLong(suffix);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
