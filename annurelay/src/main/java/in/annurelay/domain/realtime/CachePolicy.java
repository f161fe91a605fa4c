package in.annurelay.domain.realtime;

/**
 * How pushes of a data kind are kept in the cache.
 */
public enum CachePolicy {
    /** One entry per instrument, overwritten by every push. */
    SNAPSHOT,
    /** One entry per push, keyed by event time, expiring after the series TTL. */
    TIME_SERIES
}
