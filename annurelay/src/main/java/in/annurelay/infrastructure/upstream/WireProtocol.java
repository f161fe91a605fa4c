package in.annurelay.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * Venue frame names and builders for the frames the relay sends.
 *
 * Every frame carries its transaction name in {@code trnm}. Replies reuse the
 * request's transaction name, which is how replies are correlated.
 */
public final class WireProtocol {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TAG_FIELD = "trnm";

    public static final String LOGIN = "LOGIN";
    public static final String PING = "PING";
    public static final String REAL = "REAL";
    public static final String REG = "REG";
    public static final String REMOVE = "REMOVE";
    public static final String UNREG = "UNREG";
    public static final String CONDITION_LIST = "CNSRLST";
    public static final String CONDITION_REQUEST = "CNSRREQ";
    public static final String CONDITION_CANCEL = "CNSRCNC";

    /** search_type for a one-shot condition search. */
    public static final String SEARCH_TYPE_GENERAL = "0";
    /** search_type for a realtime condition subscription. */
    public static final String SEARCH_TYPE_REALTIME = "1";
    public static final String DEFAULT_MARKET = "K";

    private WireProtocol() {}

    public static String tagOf(JsonNode frame) {
        return frame.path(TAG_FIELD).asText("");
    }

    public static ObjectNode login(String token) {
        ObjectNode node = frame(LOGIN);
        node.put("token", token);
        return node;
    }

    /**
     * REG frame. The venue's REG {@code refresh} field reads "0" as "replace the
     * group's registered items" and "1" as "keep registered items and add", so
     * {@code replace} maps to "0".
     */
    public static ObjectNode register(String groupId, Collection<String> instruments,
                                      Collection<String> kinds, boolean replace) {
        ObjectNode node = frame(REG);
        node.put("grp_no", groupId);
        node.put("refresh", replace ? "0" : "1");
        ArrayNode data = node.putArray("data");
        data.add(entry(instruments, kinds));
        return node;
    }

    /**
     * REG frame carrying several (instruments, kinds) entries for one group.
     * {@code refresh} follows {@link #register}: "0" replaces, "1" adds.
     */
    public static ObjectNode registerEntries(String groupId, ArrayNode entries, boolean replace) {
        ObjectNode node = frame(REG);
        node.put("grp_no", groupId);
        node.put("refresh", replace ? "0" : "1");
        node.set("data", entries);
        return node;
    }

    public static ObjectNode remove(String groupId, Collection<String> instruments, Collection<String> kinds) {
        ObjectNode node = frame(REMOVE);
        node.put("grp_no", groupId);
        ArrayNode data = node.putArray("data");
        data.add(entry(instruments, kinds));
        return node;
    }

    public static ObjectNode unregisterGroup(String groupId) {
        ObjectNode node = frame(UNREG);
        node.put("grp_no", groupId);
        return node;
    }

    public static ObjectNode conditionList() {
        return frame(CONDITION_LIST);
    }

    public static ObjectNode conditionSearch(String seq, String marketType, String contYn, String nextKey) {
        ObjectNode node = frame(CONDITION_REQUEST);
        node.put("seq", seq);
        node.put("search_type", SEARCH_TYPE_GENERAL);
        node.put("stex_tp", marketType);
        node.put("cont_yn", contYn);
        node.put("next_key", nextKey);
        return node;
    }

    public static ObjectNode conditionRealtime(String seq, String marketType) {
        ObjectNode node = frame(CONDITION_REQUEST);
        node.put("seq", seq);
        node.put("search_type", SEARCH_TYPE_REALTIME);
        node.put("stex_tp", marketType);
        return node;
    }

    public static ObjectNode conditionCancel(String seq) {
        ObjectNode node = frame(CONDITION_CANCEL);
        node.put("seq", seq);
        return node;
    }

    public static ObjectNode entry(Collection<String> instruments, Collection<String> kinds) {
        ObjectNode entry = MAPPER.createObjectNode();
        ArrayNode items = entry.putArray("item");
        instruments.forEach(items::add);
        ArrayNode types = entry.putArray("type");
        kinds.forEach(types::add);
        return entry;
    }

    private static ObjectNode frame(String tag) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(TAG_FIELD, tag);
        return node;
    }
}
