package in.annurelay.domain.realtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a venue push frame's {@code data} array.
 *
 * @param kindCode     raw kind code as sent by the venue
 * @param kind         resolved kind, {@link DataKind#UNKNOWN} when not recognised
 * @param instrumentId instrument (or account) the values belong to
 * @param fields       field code to value, in arrival order
 */
public record PushEvent(String kindCode, DataKind kind, String instrumentId, Map<String, String> fields) {

    public PushEvent {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Parse one {@code data[]} entry: {@code {"type":"0B","item":"005930","values":{...}}}.
     * Returns null when the entry has no type.
     */
    public static PushEvent fromJson(JsonNode entry) {
        String type = entry.path("type").asText("");
        if (type.isEmpty()) {
            return null;
        }
        String item = entry.path("item").asText("");
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode valuesNode = entry.path("values");
        Iterator<Map.Entry<String, JsonNode>> it = valuesNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            values.put(field.getKey(), field.getValue().asText());
        }
        return new PushEvent(type, DataKind.fromCode(type), item, values);
    }

    public PushEvent withFields(Map<String, String> reduced) {
        return new PushEvent(kindCode, kind, instrumentId, reduced);
    }

    public String field(String code) {
        return fields.get(code);
    }
}
