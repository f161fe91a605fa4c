package in.annurelay.support;

import in.annurelay.transport.ws.ListenerChannel;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener channel that keeps what it was sent, or fails every send once broken.
 */
public final class RecordingChannel implements ListenerChannel {
    private final String address;
    private final List<String> messages = new CopyOnWriteArrayList<>();
    private volatile boolean broken;
    private volatile boolean closed;

    public RecordingChannel(String address) {
        this.address = address;
    }

    public void breakChannel() {
        broken = true;
    }

    public List<String> messages() {
        return messages;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void send(String message) throws IOException {
        if (broken) {
            throw new IOException("broken pipe");
        }
        messages.add(message);
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String remoteAddress() {
        return address;
    }
}
