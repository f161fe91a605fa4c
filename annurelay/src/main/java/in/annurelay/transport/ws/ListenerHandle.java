package in.annurelay.transport.ws;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered downstream listener. Group membership is owned by {@link ListenerRegistry}
 * and only changed under its lock.
 */
public final class ListenerHandle {
    private final String id;
    private final ListenerChannel channel;
    private final Instant connectedAt;
    private final List<String> groups = new ArrayList<>();

    ListenerHandle(String id, ListenerChannel channel, Instant connectedAt) {
        this.id = id;
        this.channel = channel;
        this.connectedAt = connectedAt;
    }

    public String getId() {
        return id;
    }

    public ListenerChannel getChannel() {
        return channel;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    List<String> groups() {
        return groups;
    }

    @Override
    public String toString() {
        return "Listener[" + id + "@" + channel.remoteAddress() + "]";
    }
}
