package in.annurelay.config;

import in.annurelay.util.Env;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Immutable relay configuration, read once at startup.
 *
 * Upstream endpoints default to the venue's mock environment unless
 * KIWOOM_REAL_SERVER=true. Either endpoint can be overridden directly.
 */
public record RelayConfig(
    int port,
    String relayToken,
    boolean realServer,
    String socketUrl,
    String restHost,
    String appKey,
    String secretKey,
    Duration tokenValidity,
    Duration reconnectBaseDelay,
    int reconnectMaxAttempts,
    Duration requestTimeout,
    Duration conditionSearchTimeout,
    Duration heartbeatTimeout,
    long snapshotTtlSeconds,
    long seriesTtlSeconds,
    ZoneId marketZone,
    String redisHost,
    int redisPort,
    String redisPassword,
    int redisDb,
    Path configDir,
    int commandWorkers,
    boolean exitOnUpstreamFailure
) {
    public static final String REAL_SOCKET_URL = "wss://api.kiwoom.com:10000/api/dostk/websocket";
    public static final String MOCK_SOCKET_URL = "wss://mockapi.kiwoom.com:10000/api/dostk/websocket";
    public static final String REAL_REST_HOST = "https://api.kiwoom.com";
    public static final String MOCK_REST_HOST = "https://mockapi.kiwoom.com";

    public static RelayConfig fromEnv() {
        boolean real = Env.getBool("KIWOOM_REAL_SERVER", false);
        return new RelayConfig(
            Env.getInt("PORT", 9090),
            Env.get("RELAY_TOKEN", null),
            real,
            Env.get("UPSTREAM_SOCKET_URL", real ? REAL_SOCKET_URL : MOCK_SOCKET_URL),
            Env.get("UPSTREAM_REST_HOST", real ? REAL_REST_HOST : MOCK_REST_HOST),
            Env.get("KIWOOM_APP_KEY", ""),
            Env.get("KIWOOM_SECRET_KEY", ""),
            Duration.ofHours(Env.getInt("TOKEN_VALIDITY_HOURS", 6)),
            Env.getMillis("RECONNECT_BASE_DELAY_MS", 5000),
            Env.getInt("RECONNECT_MAX_ATTEMPTS", 5),
            Env.getMillis("REQUEST_TIMEOUT_MS", 10_000),
            Env.getMillis("CONDITION_SEARCH_TIMEOUT_MS", 20_000),
            Duration.ofSeconds(Env.getInt("HEARTBEAT_TIMEOUT_SECONDS", 0)),
            Env.getLong("CACHE_SNAPSHOT_TTL_SECONDS", 60),
            Env.getLong("CACHE_SERIES_TTL_SECONDS", 300),
            ZoneId.of(Env.get("MARKET_ZONE", "Asia/Seoul")),
            Env.get("REDIS_HOST", null),
            Env.getInt("REDIS_PORT", 6379),
            Env.get("REDIS_PASSWORD", null),
            Env.getInt("REDIS_DB", 0),
            Paths.get(Env.get("CONFIG_DIR", "./config")),
            Env.getInt("COMMAND_WORKERS", 8),
            Env.getBool("EXIT_ON_UPSTREAM_FAILURE", false)
        );
    }

    public boolean redisEnabled() {
        return redisHost != null && !redisHost.isBlank();
    }

    public boolean heartbeatEnabled() {
        return !heartbeatTimeout.isZero() && !heartbeatTimeout.isNegative();
    }
}
