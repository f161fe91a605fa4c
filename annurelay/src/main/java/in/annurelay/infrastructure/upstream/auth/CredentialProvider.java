package in.annurelay.infrastructure.upstream.auth;

/**
 * Supplies the access token used to log in to the venue socket.
 */
public interface CredentialProvider {

    /**
     * Current token, fetching a new one when the cached token is missing or past its validity window.
     *
     * @throws TokenRefreshManager.TokenRefreshException if no token could be obtained
     */
    String getToken();

    /**
     * Drop the cached token so the next {@link #getToken()} fetches a fresh one.
     */
    void invalidate();

    /**
     * Revoke the cached token with the venue. Called on shutdown.
     */
    void revoke();
}
