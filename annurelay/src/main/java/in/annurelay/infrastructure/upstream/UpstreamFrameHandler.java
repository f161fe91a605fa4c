package in.annurelay.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives every frame read by the transport's receive loop, in arrival order.
 */
@FunctionalInterface
public interface UpstreamFrameHandler {
    /**
     * @param raw   frame text exactly as received
     * @param frame parsed frame
     */
    void onFrame(String raw, JsonNode frame);
}
