package in.annurelay.service.subscription;

import in.annurelay.infrastructure.upstream.UpstreamSender;
import in.annurelay.infrastructure.upstream.WireProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Realtime price subscriptions: updates the registry, then tells the venue.
 *
 * The registry is updated first and is never rolled back when the frame cannot
 * be sent; the next reconnect replays it.
 */
public final class SubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionRegistry registry;
    private final UpstreamSender sender;

    public SubscriptionService(SubscriptionRegistry registry, UpstreamSender sender) {
        this.registry = registry;
        this.sender = sender;
    }

    public MutationResult registerInstruments(String groupId, Collection<String> instruments,
                                              Collection<String> kinds, boolean refresh) {
        requireGroup(groupId);
        List<String> items = distinct(instruments, "instruments");
        List<String> types = distinct(kinds, "kinds");

        registry.register(groupId, items, types, refresh);
        boolean delivered = sender.send(WireProtocol.register(groupId, items, types, refresh));

        log.info("[SUBSCRIPTION] REG group={} items={} kinds={} refresh={} delivered={}",
            groupId, items, types, refresh, delivered);
        return new MutationResult(groupId, delivered, registry.group(groupId));
    }

    /**
     * @param kinds kinds to drop, or null for everything registered on those instruments
     */
    public MutationResult unregisterInstruments(String groupId, Collection<String> instruments,
                                                Collection<String> kinds) {
        requireGroup(groupId);
        List<String> items = distinct(instruments, "instruments");
        Set<String> types = kinds != null
            ? new LinkedHashSet<>(distinct(kinds, "kinds"))
            : registry.kindsOf(groupId, items);

        registry.unregister(groupId, items, kinds == null ? null : types);

        boolean delivered;
        if (types.isEmpty()) {
            log.info("[SUBSCRIPTION] Nothing registered for {} in group {}, no REMOVE sent", items, groupId);
            delivered = true;
        } else {
            delivered = sender.send(WireProtocol.remove(groupId, items, types));
        }

        log.info("[SUBSCRIPTION] REMOVE group={} items={} kinds={} delivered={}", groupId, items, types, delivered);
        return new MutationResult(groupId, delivered, registry.group(groupId));
    }

    public MutationResult unregisterGroup(String groupId) {
        requireGroup(groupId);
        boolean existed = registry.unregisterGroup(groupId);
        boolean delivered = sender.send(WireProtocol.unregisterGroup(groupId));

        log.info("[SUBSCRIPTION] UNREG group={} existed={} delivered={}", groupId, existed, delivered);
        return new MutationResult(groupId, delivered, Map.of());
    }

    public Map<String, Map<String, Set<String>>> subscriptions() {
        return registry.snapshot();
    }

    public Set<String> conditionSubscriptions() {
        return registry.conditions();
    }

    private static void requireGroup(String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("group id is required");
        }
    }

    private static List<String> distinct(Collection<String> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        List<String> out = new ArrayList<>(new LinkedHashSet<>(values));
        for (String value : out) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not contain blank values");
            }
        }
        return out;
    }

    /**
     * @param delivered  whether the wire frame reached the socket
     * @param groupState the group's registry content after the change
     */
    public record MutationResult(String groupId, boolean delivered, Map<String, Set<String>> groupState) {}
}
