package in.annurelay.transport.ws;

import java.io.IOException;

/**
 * Outbound side of one downstream client connection.
 */
public interface ListenerChannel {

    /**
     * @throws IOException when the channel can no longer deliver
     */
    void send(String message) throws IOException;

    void close();

    String remoteAddress();
}
