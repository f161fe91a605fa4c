package in.annurelay.service.subscription;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.annurelay.infrastructure.upstream.ReplaySource;
import in.annurelay.infrastructure.upstream.WireProtocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Intended venue subscription state: group → instrument → data kinds, plus the
 * condition seqs running in realtime mode.
 *
 * This is what the relay wants registered, not what the venue acknowledged; it
 * is replayed in full on every new connection. Instruments without kinds and
 * groups without instruments are pruned. All access goes through one lock.
 */
public final class SubscriptionRegistry implements ReplaySource {

    private final Object lock = new Object();
    private final Map<String, Map<String, Set<String>>> groups = new LinkedHashMap<>();
    private final Set<String> conditionSeqs = new LinkedHashSet<>();

    /**
     * @param replace true drops the group's current content before adding
     */
    public void register(String groupId, Collection<String> instruments, Collection<String> kinds, boolean replace) {
        synchronized (lock) {
            if (replace) {
                groups.remove(groupId);
            }
            if (instruments.isEmpty() || kinds.isEmpty()) {
                return;
            }
            Map<String, Set<String>> group = groups.computeIfAbsent(groupId, k -> new LinkedHashMap<>());
            for (String instrument : instruments) {
                group.computeIfAbsent(instrument, k -> new LinkedHashSet<>()).addAll(kinds);
            }
        }
    }

    /**
     * @param kinds kinds to remove, or null for every kind of the given instruments
     */
    public void unregister(String groupId, Collection<String> instruments, Collection<String> kinds) {
        synchronized (lock) {
            Map<String, Set<String>> group = groups.get(groupId);
            if (group == null) {
                return;
            }
            for (String instrument : instruments) {
                if (kinds == null) {
                    group.remove(instrument);
                    continue;
                }
                Set<String> registered = group.get(instrument);
                if (registered != null) {
                    registered.removeAll(kinds);
                    if (registered.isEmpty()) {
                        group.remove(instrument);
                    }
                }
            }
            if (group.isEmpty()) {
                groups.remove(groupId);
            }
        }
    }

    /**
     * @return true if the group existed
     */
    public boolean unregisterGroup(String groupId) {
        synchronized (lock) {
            return groups.remove(groupId) != null;
        }
    }

    /**
     * Union of the kinds registered for the given instruments in a group.
     */
    public Set<String> kindsOf(String groupId, Collection<String> instruments) {
        synchronized (lock) {
            Set<String> kinds = new LinkedHashSet<>();
            Map<String, Set<String>> group = groups.get(groupId);
            if (group != null) {
                for (String instrument : instruments) {
                    Set<String> registered = group.get(instrument);
                    if (registered != null) {
                        kinds.addAll(registered);
                    }
                }
            }
            return kinds;
        }
    }

    /**
     * @return copy of one group, empty when the group is not registered
     */
    public Map<String, Set<String>> group(String groupId) {
        synchronized (lock) {
            Map<String, Set<String>> group = groups.get(groupId);
            return group == null ? Map.of() : copyGroup(group);
        }
    }

    public Map<String, Map<String, Set<String>>> snapshot() {
        synchronized (lock) {
            Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
            groups.forEach((groupId, group) -> copy.put(groupId, copyGroup(group)));
            return Collections.unmodifiableMap(copy);
        }
    }

    public boolean addCondition(String seq) {
        synchronized (lock) {
            return conditionSeqs.add(seq);
        }
    }

    public boolean removeCondition(String seq) {
        synchronized (lock) {
            return conditionSeqs.remove(seq);
        }
    }

    public Set<String> conditions() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(conditionSeqs));
        }
    }

    /**
     * One replacing REG per group, instruments sharing a kind set batched into one
     * data entry, followed by one realtime CNSRREQ per condition seq.
     */
    @Override
    public List<ObjectNode> replayFrames() {
        synchronized (lock) {
            List<ObjectNode> frames = new ArrayList<>();
            groups.forEach((groupId, group) -> {
                Map<Set<String>, List<String>> byKinds = new LinkedHashMap<>();
                group.forEach((instrument, kinds) ->
                    byKinds.computeIfAbsent(new TreeSet<>(kinds), k -> new ArrayList<>()).add(instrument));

                ArrayNode entries = WireProtocol.MAPPER.createArrayNode();
                byKinds.forEach((kinds, instruments) -> entries.add(WireProtocol.entry(instruments, kinds)));
                frames.add(WireProtocol.registerEntries(groupId, entries, true));
            });
            for (String seq : conditionSeqs) {
                frames.add(WireProtocol.conditionRealtime(seq, WireProtocol.DEFAULT_MARKET));
            }
            return frames;
        }
    }

    private static Map<String, Set<String>> copyGroup(Map<String, Set<String>> group) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        group.forEach((instrument, kinds) ->
            copy.put(instrument, Collections.unmodifiableSet(new LinkedHashSet<>(kinds))));
        return Collections.unmodifiableMap(copy);
    }
}
