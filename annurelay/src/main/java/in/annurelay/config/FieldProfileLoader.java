package in.annurelay.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads per-kind field profile overrides from {@code field-profiles.json} in the config directory.
 *
 * Format: {@code {"0B": ["20", "10", "15"], "0D": ["21", "41", "51"]}}. A missing
 * or unreadable file means no overrides.
 */
public final class FieldProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(FieldProfileLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String FILE_NAME = "field-profiles.json";

    private FieldProfileLoader() {}

    public static Map<String, List<String>> load(Path configDir) {
        Path file = configDir.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            log.info("No field profile overrides at {}, using built-in profiles", file);
            return Map.of();
        }
        try {
            Map<String, List<String>> overrides = MAPPER.readValue(
                Files.readString(file), new TypeReference<Map<String, List<String>>>() { });
            log.info("✓ Loaded field profile overrides for kinds {} from {}", overrides.keySet(), file);
            return overrides;
        } catch (IOException e) {
            log.error("Failed to read {}, using built-in profiles: {}", file, e.getMessage());
            return Map.of();
        }
    }
}
