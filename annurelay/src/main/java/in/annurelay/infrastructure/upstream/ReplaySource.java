package in.annurelay.infrastructure.upstream;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Supplies the frames that rebuild venue-side subscription state on a fresh connection.
 */
@FunctionalInterface
public interface ReplaySource {
    List<ObjectNode> replayFrames();
}
