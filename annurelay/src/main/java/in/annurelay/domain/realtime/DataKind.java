package in.annurelay.domain.realtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Realtime data kinds pushed by the venue.
 *
 * Each kind carries its cache policy and the default set of field codes kept
 * when a push is reduced before caching. Kinds the relay does not know resolve
 * to {@link #UNKNOWN}: cached as snapshots and never reduced.
 */
public enum DataKind {
    ORDER_EXECUTION("00", CachePolicy.TIME_SERIES,
        List.of("9201", "9203", "9001", "913", "302", "900", "901", "902", "910", "911", "908")),
    CONDITION_HIT("02", CachePolicy.TIME_SERIES,
        List.of("841", "9001", "843", "20", "907")),
    BALANCE("04", CachePolicy.SNAPSHOT,
        List.of("9201", "9001", "302", "10", "930", "931", "932", "933", "8019")),
    STOCK_EXECUTION("0B", CachePolicy.TIME_SERIES,
        List.of("20", "10", "11", "12", "27", "28", "15", "13", "14", "228", "290")),
    ORDER_BOOK("0D", CachePolicy.SNAPSHOT, orderBookFields()),
    UNKNOWN("", CachePolicy.SNAPSHOT, List.of());

    /** Condition seq carried by condition-hit pushes. */
    public static final String CONDITION_SEQ_FIELD = "841";

    private static final Map<String, DataKind> BY_CODE = new HashMap<>();

    static {
        for (DataKind kind : values()) {
            if (kind != UNKNOWN) {
                BY_CODE.put(kind.code, kind);
            }
        }
    }

    private final String code;
    private final CachePolicy cachePolicy;
    private final List<String> defaultFields;

    DataKind(String code, CachePolicy cachePolicy, List<String> defaultFields) {
        this.code = code;
        this.cachePolicy = cachePolicy;
        this.defaultFields = defaultFields;
    }

    public static DataKind fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }

    public String code() {
        return code;
    }

    public CachePolicy cachePolicy() {
        return cachePolicy;
    }

    public List<String> defaultFields() {
        return defaultFields;
    }

    // Time, 10 ask/bid levels with quantities (41..80), total ask/bid quantity.
    private static List<String> orderBookFields() {
        List<String> fields = new ArrayList<>();
        fields.add("21");
        for (int code = 41; code <= 80; code++) {
            fields.add(String.valueOf(code));
        }
        fields.add("121");
        fields.add("125");
        return Collections.unmodifiableList(fields);
    }
}
