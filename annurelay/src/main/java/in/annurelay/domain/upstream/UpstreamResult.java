package in.annurelay.domain.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a correlated upstream request.
 *
 * A reply the venue marks as failed ({@code return_code != 0}) is still a
 * successful exchange; callers check {@link #isUpstreamError()} on the payload.
 */
public record UpstreamResult(
    boolean success,
    String tag,
    JsonNode payload,
    UpstreamErrorKind errorKind,
    String message
) {
    public static UpstreamResult success(String tag, JsonNode payload) {
        return new UpstreamResult(true, tag, payload, null, null);
    }

    public static UpstreamResult failure(String tag, UpstreamErrorKind kind, String message) {
        return new UpstreamResult(false, tag, null, kind, message);
    }

    public boolean isUpstreamError() {
        return success && returnCode() != 0;
    }

    public int returnCode() {
        if (payload == null || !payload.has("return_code")) {
            return 0;
        }
        return payload.path("return_code").asInt(0);
    }

    public String returnMessage() {
        if (payload == null) {
            return message;
        }
        return payload.path("return_msg").asText(null);
    }
}
