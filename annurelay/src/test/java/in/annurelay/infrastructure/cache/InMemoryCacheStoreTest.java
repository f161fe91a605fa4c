package in.annurelay.infrastructure.cache;

import in.annurelay.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-02T00:00:00Z");

    @Test
    void testSetAndGet() {
        InMemoryCacheStore store = new InMemoryCacheStore();

        store.setWithTtl("0D:005930", Map.of("41", "71100"), 60);

        assertEquals(Map.of("41", "71100"), store.get("0D:005930").orElseThrow());
        assertTrue(store.get("0D:000660").isEmpty());
    }

    @Test
    void testSetReplacesWholeValue() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.setWithTtl("k", Map.of("a", "1", "b", "2"), 60);

        store.setWithTtl("k", Map.of("a", "3"), 60);

        assertEquals(Map.of("a", "3"), store.get("k").orElseThrow());
    }

    @Test
    void testEntriesExpire() {
        MutableClock clock = new MutableClock(T0);
        InMemoryCacheStore store = new InMemoryCacheStore(clock);
        store.setWithTtl("k", Map.of("a", "1"), 60);

        clock.advance(Duration.ofSeconds(59));
        assertTrue(store.get("k").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.get("k").isEmpty());
        assertTrue(store.scan("*").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void testScanGlob() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.setWithTtl("0B:005930:090001250", Map.of("a", "1"), 60);
        store.setWithTtl("0B:005930:090001251", Map.of("a", "1"), 60);
        store.setWithTtl("0B:0059301:090001250", Map.of("a", "1"), 60);
        store.setWithTtl("0D:005930", Map.of("a", "1"), 60);

        assertEquals(Set.of("0B:005930:090001250", "0B:005930:090001251"), store.scan("0B:005930:*"));
        assertEquals(Set.of("0D:005930"), store.scan("0?:005930"));
    }

    @Test
    void testGlobQuotesRegexCharacters() {
        assertTrue(InMemoryCacheStore.globToRegex("a.b*").matcher("a.bcd").matches());
        assertFalse(InMemoryCacheStore.globToRegex("a.b*").matcher("axbcd").matches());
    }

    @Test
    void testEmptyFieldsDeleteKey() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.setWithTtl("k", Map.of("a", "1"), 60);

        store.setWithTtl("k", Map.of(), 60);

        assertTrue(store.get("k").isEmpty());
    }

    @Test
    void testExpiredEntriesSweptByWrites() {
        MutableClock clock = new MutableClock(T0);
        InMemoryCacheStore store = new InMemoryCacheStore(clock);

        // ten ticks a second for 1000s with nobody reading
        for (int i = 0; i < 10_000; i++) {
            store.setWithTtl("0B:005930:" + i, Map.of("10", "71000"), 300);
            clock.advance(Duration.ofMillis(100));
        }

        long maxLive = 3_000 + InMemoryCacheStore.SWEEP_INTERVAL.toMillis() / 100;
        assertTrue(store.size() <= maxLive, "Live entries bounded by TTL, was " + store.size());
        assertTrue(store.get("0B:005930:9999").isPresent());
    }
}
