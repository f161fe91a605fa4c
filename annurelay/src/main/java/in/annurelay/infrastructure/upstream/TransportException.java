package in.annurelay.infrastructure.upstream;

/**
 * Failure to open or use the upstream socket.
 */
public class TransportException extends Exception {
    private final String endpoint;

    public TransportException(String endpoint, String message) {
        super(String.format("[%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public TransportException(String endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
