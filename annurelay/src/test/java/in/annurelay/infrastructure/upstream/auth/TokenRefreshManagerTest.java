package in.annurelay.infrastructure.upstream.auth;

import in.annurelay.infrastructure.upstream.auth.TokenRefreshManager.TokenInfo;
import in.annurelay.infrastructure.upstream.auth.TokenRefreshManager.TokenRefreshException;
import in.annurelay.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenRefreshManager.
 *
 * Tests:
 * - Lazy initial fetch
 * - Reuse inside the validity window, refetch after it
 * - Invalidate and revoke
 * - Exception handling
 * - Thread safety
 */
class TokenRefreshManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T00:00:00Z");

    /** Token source handing out tok-1, tok-2, ... */
    private static final class CountingTokenSource implements TokenSource {
        final AtomicInteger fetches = new AtomicInteger();
        final List<String> revoked = new ArrayList<>();

        @Override
        public String fetchToken() {
            return "tok-" + fetches.incrementAndGet();
        }

        @Override
        public void revokeToken(String token) {
            revoked.add(token);
        }
    }

    @Test
    void testTokenFetchedLazily() {
        CountingTokenSource source = new CountingTokenSource();
        MutableClock clock = new MutableClock(T0);
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6), clock);

        assertEquals(0, source.fetches.get(), "Nothing fetched before first use");
        assertFalse(manager.hasValidToken());

        assertEquals("tok-1", manager.getToken());

        TokenInfo info = manager.getTokenInfo();
        assertEquals(T0, info.issuedAt());
        assertEquals(T0.plus(Duration.ofHours(6)), info.expiresAt());
        assertTrue(manager.hasValidToken());
    }

    @Test
    void testTokenReusedWithinValidity() {
        CountingTokenSource source = new CountingTokenSource();
        MutableClock clock = new MutableClock(T0);
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6), clock);

        manager.getToken();
        clock.advance(Duration.ofHours(5));

        assertEquals("tok-1", manager.getToken());
        assertEquals(1, source.fetches.get());
    }

    @Test
    void testTokenRefetchedAfterValidity() {
        CountingTokenSource source = new CountingTokenSource();
        MutableClock clock = new MutableClock(T0);
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6), clock);

        manager.getToken();
        clock.advance(Duration.ofHours(6));

        assertFalse(manager.hasValidToken(), "Token expires exactly at the end of the window");
        assertEquals("tok-2", manager.getToken());
        assertEquals(2, source.fetches.get());
    }

    @Test
    void testInvalidateForcesRefetch() {
        CountingTokenSource source = new CountingTokenSource();
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));

        assertEquals("tok-1", manager.getToken());
        manager.invalidate();

        assertFalse(manager.hasValidToken());
        assertEquals("tok-2", manager.getToken());
    }

    @Test
    void testForceRefresh() {
        CountingTokenSource source = new CountingTokenSource();
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));

        manager.getToken();
        TokenInfo refreshed = manager.forceRefresh();

        assertEquals("tok-2", refreshed.accessToken());
        assertEquals("tok-2", manager.getToken());
    }

    @Test
    void testRevokeClearsAndRevokesToken() {
        CountingTokenSource source = new CountingTokenSource();
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));

        manager.getToken();
        manager.revoke();

        assertEquals(List.of("tok-1"), source.revoked);
        assertNull(manager.getTokenInfo());

        manager.revoke();
        assertEquals(1, source.revoked.size(), "Nothing to revoke the second time");
    }

    @Test
    void testRevokeFailureIsLogged() {
        TokenSource source = new TokenSource() {
            @Override
            public String fetchToken() {
                return "tok";
            }

            @Override
            public void revokeToken(String token) {
                throw new TokenRefreshException("KIWOOM", "revoke endpoint down");
            }
        };
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));
        manager.getToken();

        assertDoesNotThrow(manager::revoke);
        assertFalse(manager.hasValidToken());
    }

    @Test
    void testFetchFailureWrapped() {
        TokenSource source = new TokenSource() {
            @Override
            public String fetchToken() {
                throw new IllegalStateException("Auth failed");
            }

            @Override
            public void revokeToken(String token) {
            }
        };
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));

        TokenRefreshException exception = assertThrows(TokenRefreshException.class, manager::getToken);

        assertEquals("KIWOOM", exception.getVenue());
        assertTrue(exception.getMessage().startsWith("[KIWOOM]"));
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertFalse(manager.hasValidToken());
    }

    @Test
    void testBlankTokenRejected() {
        TokenSource source = new TokenSource() {
            @Override
            public String fetchToken() {
                return " ";
            }

            @Override
            public void revokeToken(String token) {
            }
        };
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));

        assertThrows(TokenRefreshException.class, manager::getToken);
    }

    @Test
    void testConcurrentCallersShareOneFetch() throws InterruptedException {
        CountingTokenSource source = new CountingTokenSource();
        TokenRefreshManager manager = new TokenRefreshManager("KIWOOM", source, Duration.ofHours(6));

        int threads = 10;
        CountDownLatch done = new CountDownLatch(threads);
        List<String> tokens = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < threads; i++) {
            new Thread(() -> {
                tokens.add(manager.getToken());
                done.countDown();
            }).start();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(1, source.fetches.get(), "Only one fetch for concurrent callers");
        assertTrue(tokens.stream().allMatch("tok-1"::equals));
    }
}
