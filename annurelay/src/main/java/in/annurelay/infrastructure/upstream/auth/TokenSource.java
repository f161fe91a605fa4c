package in.annurelay.infrastructure.upstream.auth;

/**
 * Issues and revokes venue access tokens.
 */
public interface TokenSource {
    String fetchToken();

    void revokeToken(String token);
}
