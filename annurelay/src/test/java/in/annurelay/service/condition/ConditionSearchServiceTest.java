package in.annurelay.service.condition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annurelay.domain.upstream.UpstreamErrorKind;
import in.annurelay.domain.upstream.UpstreamResult;
import in.annurelay.service.correlation.RequestCorrelator;
import in.annurelay.service.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConditionSearchServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration SEARCH_TIMEOUT = Duration.ofSeconds(20);

    @Mock
    private RequestCorrelator correlator;

    private SubscriptionRegistry registry;
    private ConditionSearchService service;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
        service = new ConditionSearchService(correlator, registry, REQUEST_TIMEOUT, SEARCH_TIMEOUT);
    }

    private static UpstreamResult reply(String tag, int returnCode) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("trnm", tag);
        payload.put("return_code", returnCode);
        payload.put("return_msg", returnCode == 0 ? "" : "rejected");
        return UpstreamResult.success(tag, payload);
    }

    @Test
    void listUsesRequestTimeout() {
        when(correlator.sendAndAwait(any(), eq("CNSRLST"), eq(REQUEST_TIMEOUT))).thenReturn(reply("CNSRLST", 0));

        assertTrue(service.listConditions().success());
    }

    @Test
    void searchAppliesDefaultsAndLongerTimeout() {
        ArgumentCaptor<Object> frame = ArgumentCaptor.forClass(Object.class);
        when(correlator.sendAndAwait(frame.capture(), eq("CNSRREQ"), eq(SEARCH_TIMEOUT)))
            .thenReturn(reply("CNSRREQ", 0));

        service.search("5", null, null, null);

        ObjectNode sent = (ObjectNode) frame.getValue();
        assertEquals("5", sent.path("seq").asText());
        assertEquals("0", sent.path("search_type").asText());
        assertEquals("K", sent.path("stex_tp").asText());
        assertEquals("N", sent.path("cont_yn").asText());
        assertEquals("", sent.path("next_key").asText());
        assertTrue(registry.conditions().isEmpty(), "One-shot search is not replayed");
    }

    @Test
    void startRealtimeRegistersSeqOnAcceptedReply() {
        when(correlator.sendAndAwait(any(), eq("CNSRREQ"), eq(REQUEST_TIMEOUT))).thenReturn(reply("CNSRREQ", 0));

        service.startRealtime("3", null);

        assertEquals(Set.of("3"), registry.conditions());
    }

    @Test
    void startRealtimeSkipsSeqOnRejectedReply() {
        when(correlator.sendAndAwait(any(), eq("CNSRREQ"), eq(REQUEST_TIMEOUT))).thenReturn(reply("CNSRREQ", 1));

        UpstreamResult result = service.startRealtime("3", "K");

        assertTrue(result.isUpstreamError());
        assertTrue(registry.conditions().isEmpty());
    }

    @Test
    void startRealtimeSkipsSeqOnTimeout() {
        when(correlator.sendAndAwait(any(), eq("CNSRREQ"), eq(REQUEST_TIMEOUT)))
            .thenReturn(UpstreamResult.failure("CNSRREQ", UpstreamErrorKind.TIMEOUT, "timed out"));

        service.startRealtime("3", "K");

        assertTrue(registry.conditions().isEmpty());
    }

    @Test
    void cancelRemovesSeqEvenWhenVenueFails() {
        registry.addCondition("3");
        when(correlator.sendAndAwait(any(), eq("CNSRCNC"), eq(REQUEST_TIMEOUT)))
            .thenReturn(UpstreamResult.failure("CNSRCNC", UpstreamErrorKind.TRANSPORT, "not connected"));

        UpstreamResult result = service.cancelRealtime("3");

        assertFalse(result.success());
        assertTrue(registry.conditions().isEmpty());
    }

    @Test
    void blankSeqRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.search(" ", null, null, null));
        assertThrows(IllegalArgumentException.class, () -> service.startRealtime(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.cancelRealtime(""));
        verifyNoInteractions(correlator);
    }

    @Test
    void groupForCondition() {
        assertEquals("cond_3", ConditionSearchService.groupFor("3"));
    }
}
