package it.aw.collectionindex.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregato per la dashboard, memorizzato in {@code dashboard:statistics}.
 * <p>
 * {@code computedAt} è il momento dell'ultimo ricalcolo completo e governa la
 * freschezza; le patch incrementali aggiornano solo {@code patchedAt}.
 */
public record DashboardStatistics(
        long                          totalCollections,
        long                          totalImages,
        long                          totalThumbnails,
        long                          totalCacheImages,
        long                          totalSize,
        double                        averageImagesPerCollection,
        double                        averageSizePerCollection,
        Map<CollectionType, Long>     collectionsByType,
        Instant                       computedAt,
        Instant                       patchedAt
) {
    public DashboardStatistics {
        EnumMap<CollectionType, Long> copy = new EnumMap<>(CollectionType.class);
        if (collectionsByType != null) {
            copy.putAll(collectionsByType);
        }
        collectionsByType = copy;
    }

    public static DashboardStatistics of(long collections, long images, long thumbnails, long cacheImages,
                                         long size, Map<CollectionType, Long> byType,
                                         Instant computedAt, Instant patchedAt) {
        double avgImages = collections > 0 ? (double) images / collections : 0;
        double avgSize = collections > 0 ? (double) size / collections : 0;
        return new DashboardStatistics(collections, images, thumbnails, cacheImages, size,
                avgImages, avgSize, byType, computedAt, patchedAt);
    }

    /** Applica una variazione incrementale ricalcolando le medie; {@code computedAt} resta invariato. */
    public DashboardStatistics apply(DashboardDelta delta, Instant now) {
        Map<CollectionType, Long> byType = new EnumMap<>(CollectionType.class);
        byType.putAll(collectionsByType);
        delta.typeChanges().forEach((type, change) -> {
            long updated = byType.getOrDefault(type, 0L) + change;
            if (updated > 0) {
                byType.put(type, updated);
            } else {
                byType.remove(type);
            }
        });
        return of(
                Math.max(0, totalCollections + delta.collections()),
                Math.max(0, totalImages + delta.images()),
                Math.max(0, totalThumbnails + delta.thumbnails()),
                Math.max(0, totalCacheImages + delta.cacheImages()),
                Math.max(0, totalSize + delta.size()),
                byType, computedAt, now);
    }
}
