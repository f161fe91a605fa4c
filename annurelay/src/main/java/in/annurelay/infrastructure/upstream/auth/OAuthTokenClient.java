package in.annurelay.infrastructure.upstream.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annurelay.infrastructure.upstream.auth.TokenRefreshManager.TokenRefreshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Client-credentials token endpoint of the venue's REST host.
 *
 * POST /oauth2/token  {grant_type, appkey, secretkey}  returns {token, expires_dt, return_code, return_msg}
 * POST /oauth2/revoke {appkey, secretkey, token}
 */
public final class OAuthTokenClient implements TokenSource {
    private static final Logger log = LoggerFactory.getLogger(OAuthTokenClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String VENUE = "KIWOOM";
    private static final int MAX_ATTEMPTS = 3;

    private final String host;
    private final String appKey;
    private final String secretKey;
    private final Duration retryDelay;
    private final HttpClient httpClient;

    public OAuthTokenClient(String host, String appKey, String secretKey) {
        this(host, appKey, secretKey, Duration.ofSeconds(1));
    }

    public OAuthTokenClient(String host, String appKey, String secretKey, Duration retryDelay) {
        this.host = host;
        this.appKey = appKey;
        this.secretKey = secretKey;
        this.retryDelay = retryDelay;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public String fetchToken() {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("grant_type", "client_credentials");
        body.put("appkey", appKey);
        body.put("secretkey", secretKey);

        Exception lastError = null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            try {
                HttpResponse<String> response = post("/oauth2/token", body);
                int status = response.statusCode();
                if (isRetryableStatus(status)) {
                    log.warn("[AUTH] Token request returned HTTP {} (attempt {}/{})", status, attempt + 1, MAX_ATTEMPTS);
                    lastError = new IOException("HTTP " + status);
                    backoff(attempt);
                    continue;
                }
                JsonNode json = MAPPER.readTree(response.body());
                String token = json.path("token").asText(null);
                if (status != 200 || token == null || token.isEmpty()) {
                    throw new TokenRefreshException(VENUE, String.format(
                        "Token request rejected: HTTP %d, return_code=%s, return_msg=%s",
                        status, json.path("return_code").asText("?"), json.path("return_msg").asText("")));
                }
                log.info("[AUTH] Token issued (expires_dt={})", json.path("expires_dt").asText("unknown"));
                return token;
            } catch (IOException e) {
                log.warn("[AUTH] Token request failed (attempt {}/{}): {}", attempt + 1, MAX_ATTEMPTS, e.getMessage());
                lastError = e;
                backoff(attempt);
            }
        }
        throw new TokenRefreshException(VENUE, "Token request failed after " + MAX_ATTEMPTS + " attempts", lastError);
    }

    @Override
    public void revokeToken(String token) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("appkey", appKey);
        body.put("secretkey", secretKey);
        body.put("token", token);
        try {
            HttpResponse<String> response = post("/oauth2/revoke", body);
            JsonNode json = MAPPER.readTree(response.body());
            log.info("[AUTH] Revoke response: HTTP {} {}", response.statusCode(), json.path("return_msg").asText(""));
        } catch (IOException e) {
            throw new TokenRefreshException(VENUE, "Token revoke failed", e);
        }
    }

    private HttpResponse<String> post(String path, ObjectNode body) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(host + path))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json;charset=UTF-8")
            .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
            .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + path, e);
        }
    }

    private void backoff(int attempt) {
        if (attempt + 1 >= MAX_ATTEMPTS) {
            return;
        }
        try {
            Thread.sleep(retryDelay.toMillis() * (attempt + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRefreshException(VENUE, "Interrupted while waiting to retry token request", e);
        }
    }

    private static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode == 502 || statusCode == 503 || statusCode == 504;
    }
}
