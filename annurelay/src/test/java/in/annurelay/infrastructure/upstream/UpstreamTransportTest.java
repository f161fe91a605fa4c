package in.annurelay.infrastructure.upstream;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annurelay.domain.upstream.ConnectionState;
import in.annurelay.infrastructure.metrics.RelayMetrics;
import in.annurelay.infrastructure.upstream.auth.CredentialProvider;
import in.annurelay.infrastructure.upstream.common.ReconnectionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static in.annurelay.support.Eventually.holds;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests UpstreamTransport against in-memory sockets.
 *
 * Tests:
 * - Login and replay on connect
 * - Receive loop dispatch
 * - Reconnect after remote close, send failure and explicit drop
 * - Exhaustion into FAILED, including repeated login rejection
 * - Disconnect stops reconnecting
 */
class UpstreamTransportTest {

    private static final URI ENDPOINT = URI.create("wss://venue.test/websocket");

    private FakeUpstreamConnector connector;
    private CredentialProvider credentials;
    private RelayMetrics metrics;
    private List<ObjectNode> replay;
    private UpstreamTransport transport;

    @BeforeEach
    void setUp() {
        connector = new FakeUpstreamConnector();
        credentials = mock(CredentialProvider.class);
        when(credentials.getToken()).thenReturn("tok-1");
        metrics = mock(RelayMetrics.class);
        replay = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.shutdown();
        }
    }

    private UpstreamTransport newTransport(int maxAttempts) {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .baseDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(50))
            .maxAttempts(maxAttempts)
            .build();
        transport = new UpstreamTransport(connector, ENDPOINT, credentials, () -> replay, policy, metrics);
        return transport;
    }

    /** Answers LOGIN the way the correlator does: accept or drop. */
    private void handleLoginReplies() {
        transport.setFrameHandler((raw, frame) -> {
            if (!WireProtocol.LOGIN.equals(WireProtocol.tagOf(frame))) {
                return;
            }
            if (frame.path("return_code").asInt(0) == 0) {
                transport.onLoginAccepted();
            } else {
                transport.dropConnection("login rejected");
            }
        });
    }

    @Test
    void testStartLogsInThenReplays() {
        replay.add(WireProtocol.register("1", List.of("005930"), List.of("0B"), true));
        replay.add(WireProtocol.conditionRealtime("3", "K"));
        newTransport(3);

        assertTrue(transport.start());

        assertEquals(ConnectionState.CONNECTED, transport.getState());
        assertTrue(transport.isConnected());
        assertNotNull(transport.getConnectedSince());

        List<String> sent = connector.last().sent();
        assertEquals(3, sent.size());
        assertTrue(sent.get(0).contains("\"trnm\":\"LOGIN\""));
        assertTrue(sent.get(0).contains("\"token\":\"tok-1\""));
        assertTrue(sent.get(1).contains("\"trnm\":\"REG\""));
        assertTrue(sent.get(2).contains("\"trnm\":\"CNSRREQ\""));
        verify(metrics).recordConnectionEvent("connected");
    }

    @Test
    void testFramesDispatchedInOrder() throws InterruptedException {
        newTransport(3);
        List<String> tags = new CopyOnWriteArrayList<>();
        CountDownLatch received = new CountDownLatch(3);
        transport.setFrameHandler((raw, frame) -> {
            String tag = WireProtocol.tagOf(frame);
            tags.add(tag);
            received.countDown();
            if ("BOOM".equals(tag)) {
                throw new IllegalStateException("handler failure");
            }
        });
        transport.start();

        FakeUpstreamSocket socket = connector.last();
        socket.push("{\"trnm\":\"BOOM\"}");
        socket.push("not json");
        socket.push("{\"trnm\":\"REAL\",\"data\":[]}");
        socket.push("{\"trnm\":\"CNSRLST\"}");

        assertTrue(received.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("BOOM", "REAL", "CNSRLST"), tags, "Malformed frame skipped, handler failure contained");
        assertTrue(transport.isConnected());
    }

    @Test
    void testSendWritesToSocket() {
        newTransport(3);
        transport.start();

        assertTrue(transport.send(WireProtocol.conditionList()));
        assertTrue(transport.send("{\"trnm\":\"PING\"}"));

        List<String> sent = connector.last().sent();
        assertEquals("{\"trnm\":\"CNSRLST\"}", sent.get(1));
        assertEquals("{\"trnm\":\"PING\"}", sent.get(2));
    }

    @Test
    void testReconnectAfterRemoteCloseReplaysAgain() throws InterruptedException {
        replay.add(WireProtocol.register("1", List.of("005930"), List.of("0D"), true));
        newTransport(3);
        transport.start();
        FakeUpstreamSocket first = connector.last();

        first.remoteClose();

        assertTrue(holds(() -> connector.opened.size() == 2 && transport.isConnected(), 2000));
        FakeUpstreamSocket second = connector.last();
        assertNotSame(first, second);
        List<String> sent = second.sent();
        assertTrue(sent.get(0).contains("LOGIN"));
        assertTrue(sent.get(1).contains("\"grp_no\":\"1\""));
        verify(metrics, atLeastOnce()).recordConnectionEvent("lost");
    }

    @Test
    void testSendFailureTriggersReconnect() throws InterruptedException {
        newTransport(3);
        transport.start();
        connector.last().failSends(true);

        assertFalse(transport.send(WireProtocol.conditionList()));

        assertTrue(holds(() -> connector.opened.size() == 2 && transport.isConnected(), 2000));
        assertTrue(transport.send(WireProtocol.conditionList()));
    }

    @Test
    void testDropConnectionReconnects() throws InterruptedException {
        newTransport(3);
        transport.start();
        FakeUpstreamSocket first = connector.last();

        transport.dropConnection("heartbeat timeout");

        assertTrue(first.isClosed());
        assertTrue(holds(() -> connector.opened.size() == 2 && transport.isConnected(), 2000));
    }

    @Test
    void testInitialFailureEntersReconnectCycle() throws InterruptedException {
        connector.failing = true;
        connector.loginReply = "{\"trnm\":\"LOGIN\",\"return_code\":0}";
        newTransport(5);
        handleLoginReplies();

        assertFalse(transport.start());
        assertTrue(transport.getState() == ConnectionState.RECONNECTING
            || transport.getState() == ConnectionState.CONNECTING);

        connector.failing = false;
        assertTrue(holds(transport::isConnected, 2000));
        assertTrue(holds(() -> transport.getReconnectAttempts() == 0, 2000), "Accepted login resets the attempt count");
    }

    @Test
    void testOpenSocketWithoutLoginDoesNotResetAttempts() throws InterruptedException {
        connector.failing = true;
        newTransport(5);

        transport.start();
        assertTrue(holds(() -> transport.getReconnectAttempts() >= 1, 2000));
        connector.failing = false;

        assertTrue(holds(transport::isConnected, 2000));
        assertTrue(transport.getReconnectAttempts() >= 1, "No LOGIN reply yet");
    }

    @Test
    void testRepeatedLoginRejectionEntersFailed() throws InterruptedException {
        connector.loginReply = "{\"trnm\":\"LOGIN\",\"return_code\":1,\"return_msg\":\"invalid token\"}";
        newTransport(3);
        handleLoginReplies();
        AtomicInteger fatalCalls = new AtomicInteger();
        transport.setFatalListener(reason -> fatalCalls.incrementAndGet());

        assertTrue(transport.start());

        assertTrue(holds(() -> transport.getState() == ConnectionState.FAILED, 3000));
        assertTrue(holds(() -> fatalCalls.get() == 1, 1000));
        Thread.sleep(100);
        assertEquals(3, connector.opened.size(), "Each rejected login uses one attempt");
        assertFalse(transport.isConnected());
    }

    @Test
    void testExhaustionEntersFailed() throws InterruptedException {
        connector.failing = true;
        newTransport(2);
        AtomicInteger fatalCalls = new AtomicInteger();
        transport.setFatalListener(reason -> fatalCalls.incrementAndGet());

        transport.start();

        assertTrue(holds(() -> transport.getState() == ConnectionState.FAILED, 2000));
        assertTrue(holds(() -> fatalCalls.get() == 1, 1000));
        assertEquals(3, connector.attempts.get(), "Initial attempt plus two retries");
        verify(metrics).recordConnectionEvent("exhausted");
        assertNull(transport.getConnectedSince());
    }

    @Test
    void testTokenFailureCountsAsConnectFailure() {
        when(credentials.getToken()).thenThrow(new IllegalStateException("token endpoint down"));
        newTransport(1);

        assertFalse(transport.connect());
        assertEquals(0, connector.attempts.get(), "Socket not opened without a token");
        assertFalse(transport.isConnected());
    }

    @Test
    void testDisconnectStopsReconnecting() throws InterruptedException {
        newTransport(3);
        transport.start();
        FakeUpstreamSocket first = connector.last();

        transport.disconnect();

        assertTrue(first.isClosed());
        assertEquals(ConnectionState.DISCONNECTED, transport.getState());
        Thread.sleep(100);
        assertEquals(1, connector.opened.size(), "No reconnect after explicit disconnect");
        assertFalse(transport.send(WireProtocol.conditionList()));
    }

    @Test
    void testSendWhileDisconnectedTriesOneConnect() {
        newTransport(3);
        transport.start();
        transport.dropConnection("test");
        // the reconnect loop may already have connected; either way send must succeed
        assertTrue(transport.send(WireProtocol.conditionList()));
        assertTrue(transport.isConnected());
    }
}
