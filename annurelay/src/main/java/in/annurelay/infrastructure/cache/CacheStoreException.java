package in.annurelay.infrastructure.cache;

/**
 * Cache backend failure.
 */
public class CacheStoreException extends RuntimeException {
    private final String key;

    public CacheStoreException(String key, String message, Throwable cause) {
        super(String.format("[%s] %s", key, message), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
