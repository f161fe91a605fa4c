package in.annurelay.service.push;

import in.annurelay.domain.realtime.DataKind;
import in.annurelay.domain.realtime.PushEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a push to the field codes its kind's profile keeps.
 * Unknown kinds pass through unreduced.
 */
public final class FieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private final Map<DataKind, List<String>> profiles = new EnumMap<>(DataKind.class);

    public FieldExtractor() {
        this(Map.of());
    }

    /**
     * @param overrides kind code → field codes, replacing the built-in profile for that kind
     */
    public FieldExtractor(Map<String, List<String>> overrides) {
        for (DataKind kind : DataKind.values()) {
            profiles.put(kind, kind.defaultFields());
        }
        overrides.forEach((code, fields) -> {
            DataKind kind = DataKind.fromCode(code);
            if (kind == DataKind.UNKNOWN) {
                log.warn("Ignoring field profile for unknown kind '{}'", code);
                return;
            }
            profiles.put(kind, List.copyOf(fields));
        });
    }

    public PushEvent reduce(PushEvent event) {
        if (event.kind() == DataKind.UNKNOWN) {
            return event;
        }
        Map<String, String> reduced = new LinkedHashMap<>();
        for (String code : profiles.get(event.kind())) {
            String value = event.field(code);
            if (value != null) {
                reduced.put(code, value);
            }
        }
        return event.withFields(reduced);
    }

    public List<String> profileOf(DataKind kind) {
        return profiles.get(kind);
    }
}
