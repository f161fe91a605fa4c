package in.annurelay.infrastructure.upstream;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out fresh {@link FakeUpstreamSocket}s, or fails while {@code failing} is set.
 * When {@code loginReply} is set every socket answers LOGIN with it.
 */
final class FakeUpstreamConnector implements UpstreamConnector {
    final List<FakeUpstreamSocket> opened = new CopyOnWriteArrayList<>();
    final AtomicInteger attempts = new AtomicInteger();
    volatile boolean failing;
    volatile String loginReply;

    @Override
    public UpstreamSocket open(URI uri) throws TransportException {
        attempts.incrementAndGet();
        if (failing) {
            throw new TransportException(uri.toString(), "connection refused");
        }
        FakeUpstreamSocket socket = new FakeUpstreamSocket(loginReply);
        opened.add(socket);
        return socket;
    }

    FakeUpstreamSocket last() {
        return opened.get(opened.size() - 1);
    }
}
