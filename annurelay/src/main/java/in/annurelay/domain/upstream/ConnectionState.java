package in.annurelay.domain.upstream;

/**
 * Lifecycle of the single upstream connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    /** Reconnect attempts exhausted. Terminal until restarted. */
    FAILED
}
