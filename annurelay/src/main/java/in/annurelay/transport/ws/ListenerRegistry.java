package in.annurelay.transport.ws;

import in.annurelay.infrastructure.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connected downstream listeners and their group memberships.
 *
 * Membership changes happen under one lock; sends happen outside it on a copy of
 * the target list. A listener whose send fails is removed from every group and
 * from the registry, and delivery carries on to the rest.
 */
public final class ListenerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ListenerRegistry.class);

    /** Broadcast target meaning every listener, whatever its groups. */
    public static final String ALL = "*";

    private final Object lock = new Object();
    private final Map<String, ListenerHandle> listeners = new LinkedHashMap<>();
    private final Map<String, Set<ListenerHandle>> groups = new HashMap<>();
    private final RelayMetrics metrics;

    public ListenerRegistry(RelayMetrics metrics) {
        this.metrics = metrics;
    }

    public ListenerHandle addListener(String id, ListenerChannel channel) {
        ListenerHandle handle = new ListenerHandle(id, channel, Instant.now());
        int count;
        synchronized (lock) {
            if (listeners.containsKey(id)) {
                throw new IllegalArgumentException("Listener already registered: " + id);
            }
            listeners.put(id, handle);
            count = listeners.size();
        }
        metrics.setListenerCount(count);
        log.info("[LISTENERS] + {} ({} connected)", handle, count);
        return handle;
    }

    /**
     * @return the groups the listener was in, in join order; empty if it was not registered
     */
    public List<String> removeListener(ListenerHandle handle) {
        List<String> left = unregister(handle);
        return left == null ? List.of() : left;
    }

    /**
     * @return false if the listener is not registered
     */
    public boolean joinGroup(ListenerHandle handle, String groupId) {
        synchronized (lock) {
            if (listeners.get(handle.getId()) != handle) {
                return false;
            }
            if (groups.computeIfAbsent(groupId, k -> new LinkedHashSet<>()).add(handle)) {
                handle.groups().add(groupId);
            }
            return true;
        }
    }

    public boolean leaveGroup(ListenerHandle handle, String groupId) {
        synchronized (lock) {
            if (!handle.groups().remove(groupId)) {
                return false;
            }
            detach(handle, groupId);
            return true;
        }
    }

    /**
     * @param target a group id, or {@link #ALL}
     * @return number of listeners the message was handed to
     */
    public int broadcast(String target, String message) {
        List<ListenerHandle> recipients;
        synchronized (lock) {
            if (ALL.equals(target)) {
                recipients = new ArrayList<>(listeners.values());
            } else {
                Set<ListenerHandle> members = groups.get(target);
                recipients = members == null ? List.of() : new ArrayList<>(members);
            }
        }

        int delivered = 0;
        for (ListenerHandle handle : recipients) {
            if (deliver(handle, message)) {
                delivered++;
            }
        }
        metrics.recordBroadcast(target, delivered);
        return delivered;
    }

    /**
     * Send to one listener with the same failure policy as a broadcast.
     */
    public boolean sendTo(ListenerHandle handle, String message) {
        return deliver(handle, message);
    }

    public List<String> groupsOf(ListenerHandle handle) {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(handle.groups()));
        }
    }

    public List<String> membersOf(String groupId) {
        synchronized (lock) {
            Set<ListenerHandle> members = groups.get(groupId);
            List<String> ids = new ArrayList<>();
            if (members != null) {
                members.forEach(h -> ids.add(h.getId()));
            }
            return ids;
        }
    }

    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    /**
     * Called by channels whose asynchronous send failed after {@code send} returned.
     */
    public void onChannelFailure(ListenerHandle handle, Throwable error) {
        log.warn("[LISTENERS] {} send failed asynchronously: {}", handle, error.toString());
        evict(handle, "async_send_failed");
    }

    private boolean deliver(ListenerHandle handle, String message) {
        try {
            handle.getChannel().send(message);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[LISTENERS] {} send failed, removing: {}", handle, e.toString());
            evict(handle, "send_failed");
            return false;
        }
    }

    private void evict(ListenerHandle handle, String reason) {
        if (unregister(handle) != null) {
            metrics.recordListenerRemoved(reason);
        }
        handle.getChannel().close();
    }

    private List<String> unregister(ListenerHandle handle) {
        List<String> left;
        int count;
        synchronized (lock) {
            if (listeners.get(handle.getId()) != handle) {
                return null;
            }
            listeners.remove(handle.getId());
            left = new ArrayList<>(handle.groups());
            for (String groupId : left) {
                detach(handle, groupId);
            }
            handle.groups().clear();
            count = listeners.size();
        }
        metrics.setListenerCount(count);
        log.info("[LISTENERS] - {} left groups {} ({} connected)", handle, left, count);
        return left;
    }

    private void detach(ListenerHandle handle, String groupId) {
        Set<ListenerHandle> members = groups.get(groupId);
        if (members != null) {
            members.remove(handle);
            if (members.isEmpty()) {
                groups.remove(groupId);
            }
        }
    }
}
