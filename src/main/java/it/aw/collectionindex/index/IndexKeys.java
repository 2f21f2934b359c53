package it.aw.collectionindex.index;

import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;

/**
 * Layout delle chiavi dello store. Tutte le chiavi dell'indice derivano da qui.
 */
public final class IndexKeys {

    public static final String INDEX_PREFIX     = "collection_index:";
    public static final String SORTED_PREFIX    = INDEX_PREFIX + "sorted:";
    public static final String DATA_PREFIX      = INDEX_PREFIX + "data:";
    public static final String STATE_PREFIX     = INDEX_PREFIX + "state:";
    public static final String THUMBNAIL_PREFIX = INDEX_PREFIX + "thumb:";
    public static final String LAST_REBUILD     = INDEX_PREFIX + "last_rebuild";
    public static final String STATS_TOTAL      = INDEX_PREFIX + "stats:total";

    public static final String DASHBOARD_STATISTICS = "dashboard:statistics";
    public static final String DASHBOARD_ACTIVITY   = "dashboard:activity";

    private IndexKeys() {}

    public static String sortedSet(IndexScope scope, SortField field, SortDirection direction) {
        String suffix = field.key() + ":" + direction.key();
        return switch (scope.kind()) {
            case GLOBAL -> SORTED_PREFIX + suffix;
            case LIBRARY -> SORTED_PREFIX + "by_library:" + scope.value() + ":" + suffix;
            case TYPE -> SORTED_PREFIX + "by_type:" + scope.value() + ":" + suffix;
        };
    }

    public static String summary(String collectionId) {
        return DATA_PREFIX + collectionId;
    }

    public static String state(String collectionId) {
        return STATE_PREFIX + collectionId;
    }

    public static String thumbnail(String collectionId) {
        return THUMBNAIL_PREFIX + collectionId;
    }

    /** Campo di ordinamento di una chiave di sorted set: penultimo segmento, prima della direzione. */
    public static SortField fieldOf(String sortedKey) {
        int directionStart = sortedKey.lastIndexOf(':');
        int fieldStart = sortedKey.lastIndexOf(':', directionStart - 1);
        if (!sortedKey.startsWith(SORTED_PREFIX) || fieldStart < 0) {
            throw new IllegalArgumentException("Chiave di sorted set non valida: " + sortedKey);
        }
        return SortField.fromKey(sortedKey.substring(fieldStart + 1, directionStart));
    }

    /** Id della collection da una chiave {@code data:} o {@code state:}. */
    public static String idFromKey(String key, String prefix) {
        return key.substring(prefix.length());
    }
}
