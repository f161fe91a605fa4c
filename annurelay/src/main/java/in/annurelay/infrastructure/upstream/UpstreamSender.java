package in.annurelay.infrastructure.upstream;

/**
 * Write side of the upstream connection as seen by request issuers.
 */
public interface UpstreamSender {

    /**
     * Send a message; non-string payloads are serialized to JSON.
     *
     * @return false when the message was not delivered to the socket
     */
    boolean send(Object message);

    /**
     * Close the current connection and let the reconnect cycle take over.
     */
    void dropConnection(String reason);

    /**
     * The venue accepted LOGIN on the current connection.
     */
    void onLoginAccepted();

    boolean isConnected();
}
