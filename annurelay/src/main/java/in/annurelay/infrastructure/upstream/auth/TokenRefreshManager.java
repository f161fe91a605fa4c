package in.annurelay.infrastructure.upstream.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token cache with a fixed validity window.
 *
 * The venue issues tokens without telling us when they expire, so a token is
 * trusted for {@code validity} after it was issued and then fetched again on the
 * next {@link #getToken()}. Refresh is lazy: nothing runs in the background.
 *
 * Usage:
 * <pre>
 * TokenRefreshManager manager = new TokenRefreshManager(
 *     "KIWOOM",
 *     new OAuthTokenClient(host, appKey, secretKey),
 *     Duration.ofHours(6));
 *
 * String token = manager.getToken();  // fetched on first use
 * manager.revoke();                   // on shutdown
 * </pre>
 */
public class TokenRefreshManager implements CredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(TokenRefreshManager.class);

    private final String venue;
    private final TokenSource tokenSource;
    private final Duration validity;
    private final Clock clock;

    private volatile TokenInfo currentToken;

    public TokenRefreshManager(String venue, TokenSource tokenSource, Duration validity) {
        this(venue, tokenSource, validity, Clock.systemUTC());
    }

    public TokenRefreshManager(String venue, TokenSource tokenSource, Duration validity, Clock clock) {
        this.venue = venue;
        this.tokenSource = tokenSource;
        this.validity = validity;
        this.clock = clock;
    }

    @Override
    public synchronized String getToken() {
        TokenInfo token = currentToken;
        if (token != null && !isExpired(token)) {
            return token.accessToken();
        }
        if (token != null) {
            log.info("[{}] Token issued at {} is past its validity window, refreshing", venue, token.issuedAt());
        }
        return refreshToken().accessToken();
    }

    public TokenInfo getTokenInfo() {
        return currentToken;
    }

    public boolean hasValidToken() {
        TokenInfo token = currentToken;
        return token != null && !isExpired(token);
    }

    @Override
    public synchronized void invalidate() {
        if (currentToken != null) {
            log.info("[{}] Cached token invalidated", venue);
        }
        currentToken = null;
    }

    @Override
    public synchronized void revoke() {
        TokenInfo token = currentToken;
        currentToken = null;
        if (token == null) {
            return;
        }
        try {
            tokenSource.revokeToken(token.accessToken());
            log.info("[{}] Token revoked", venue);
        } catch (RuntimeException e) {
            log.warn("[{}] Token revoke failed: {}", venue, e.getMessage());
        }
    }

    /**
     * Fetch a new token regardless of the cached one.
     */
    public synchronized TokenInfo forceRefresh() {
        log.info("[{}] Forcing token refresh", venue);
        return refreshToken();
    }

    private TokenInfo refreshToken() {
        String accessToken;
        try {
            accessToken = tokenSource.fetchToken();
        } catch (TokenRefreshException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[{}] Token fetch failed", venue, e);
            throw new TokenRefreshException(venue, "Token fetch failed", e);
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new TokenRefreshException(venue, "Token source returned no token");
        }
        Instant now = clock.instant();
        TokenInfo token = new TokenInfo(accessToken, now, now.plus(validity));
        currentToken = token;
        log.info("[{}] Token refreshed, trusted until {}", venue, token.expiresAt());
        return token;
    }

    private boolean isExpired(TokenInfo token) {
        return !clock.instant().isBefore(token.expiresAt());
    }

    public record TokenInfo(String accessToken, Instant issuedAt, Instant expiresAt) {}

    /**
     * Thrown when no token could be obtained from the venue.
     */
    public static class TokenRefreshException extends RuntimeException {
        private final String venue;

        public TokenRefreshException(String venue, String message) {
            super(String.format("[%s] %s", venue, message));
            this.venue = venue;
        }

        public TokenRefreshException(String venue, String message, Throwable cause) {
            super(String.format("[%s] %s", venue, message), cause);
            this.venue = venue;
        }

        public String getVenue() {
            return venue;
        }
    }
}
