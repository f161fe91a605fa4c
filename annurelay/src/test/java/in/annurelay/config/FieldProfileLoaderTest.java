package in.annurelay.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldProfileLoaderTest {

    @TempDir
    Path configDir;

    @Test
    void testMissingFileMeansNoOverrides() {
        assertTrue(FieldProfileLoader.load(configDir).isEmpty());
    }

    @Test
    void testLoadsOverrides() throws Exception {
        Files.writeString(configDir.resolve(FieldProfileLoader.FILE_NAME), "{\"0B\": [\"20\", \"10\"]}");

        assertEquals(List.of("20", "10"), FieldProfileLoader.load(configDir).get("0B"));
    }

    @Test
    void testInvalidFileIgnored() throws Exception {
        Files.writeString(configDir.resolve(FieldProfileLoader.FILE_NAME), "{not json");

        assertTrue(FieldProfileLoader.load(configDir).isEmpty());
    }
}
