package in.annurelay.infrastructure.cache;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store with per-key expiry.
 *
 * Values are flat field maps (a Redis hash). Implementations are thread-safe.
 * Failures surface as {@link CacheStoreException}.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * Replace the value at {@code key} and expire it after {@code ttlSeconds}.
     */
    void setWithTtl(String key, Map<String, String> fields, long ttlSeconds);

    Optional<Map<String, String>> get(String key);

    /**
     * Live keys matching a glob pattern ({@code *} and {@code ?} wildcards).
     */
    Set<String> scan(String pattern);

    @Override
    void close();
}
