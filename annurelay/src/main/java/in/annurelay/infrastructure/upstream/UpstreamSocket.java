package in.annurelay.infrastructure.upstream;

import java.io.IOException;

/**
 * One open text-frame connection to the venue.
 *
 * Writes may come from any thread. Reads are done by a single receive loop.
 */
public interface UpstreamSocket {

    void sendText(String text) throws IOException;

    /**
     * Block until the next complete text frame arrives.
     *
     * @return the frame, or null once the connection is closed
     */
    String receive() throws IOException, InterruptedException;

    void close();
}
