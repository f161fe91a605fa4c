package in.annurelay.service.push;

import in.annurelay.domain.realtime.DataKind;
import in.annurelay.domain.realtime.PushEvent;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldExtractorTest {

    private static PushEvent event(String code, Map<String, String> fields) {
        return new PushEvent(code, DataKind.fromCode(code), "005930", fields);
    }

    @Test
    void testReduceKeepsProfileFieldsOnly() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("20", "090001");
        fields.put("10", "+71000");
        fields.put("9999", "noise");
        fields.put("15", "+12");

        PushEvent reduced = new FieldExtractor().reduce(event("0B", fields));

        assertEquals(Map.of("20", "090001", "10", "+71000", "15", "+12"), reduced.fields());
        assertEquals("005930", reduced.instrumentId());
        assertEquals("0B", reduced.kindCode());
    }

    @Test
    void testMissingProfileFieldsSkipped() {
        PushEvent reduced = new FieldExtractor().reduce(event("0D", Map.of("41", "71100")));

        assertEquals(Map.of("41", "71100"), reduced.fields());
    }

    @Test
    void testUnknownKindPassesThrough() {
        PushEvent original = event("ZZ", Map.of("1", "a", "2", "b"));

        assertSame(original, new FieldExtractor().reduce(original));
    }

    @Test
    void testOverrideReplacesProfile() {
        FieldExtractor extractor = new FieldExtractor(Map.of("0B", List.of("10"), "XX", List.of("1")));

        assertEquals(List.of("10"), extractor.profileOf(DataKind.STOCK_EXECUTION));
        assertEquals(DataKind.ORDER_BOOK.defaultFields(), extractor.profileOf(DataKind.ORDER_BOOK));
        assertEquals(Map.of("10", "+71000"),
            extractor.reduce(event("0B", Map.of("10", "+71000", "20", "090001"))).fields());
    }
}
