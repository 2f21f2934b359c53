package it.aw.collectionindex.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Variazione dell'aggregato dashboard prodotta da una singola mutazione.
 */
public record DashboardDelta(
        long                      collections,
        long                      images,
        long                      thumbnails,
        long                      cacheImages,
        long                      size,
        Map<CollectionType, Long> typeChanges
) {
    public DashboardDelta {
        typeChanges = typeChanges == null ? Map.of() : Map.copyOf(typeChanges);
    }

    /**
     * Differenza tra due versioni dello stesso summary; {@code null} indica assenza
     * (creazione se {@code previous} è null, cancellazione se {@code current} è null).
     */
    public static DashboardDelta between(CollectionSummary previous, CollectionSummary current) {
        Map<CollectionType, Long> types = new EnumMap<>(CollectionType.class);
        long collections = 0, images = 0, thumbnails = 0, cacheImages = 0, size = 0;
        if (previous != null) {
            collections--;
            images -= previous.imageCount();
            thumbnails -= previous.thumbnailCount();
            cacheImages -= previous.cacheCount();
            size -= previous.totalSize();
            types.merge(previous.type(), -1L, Long::sum);
        }
        if (current != null) {
            collections++;
            images += current.imageCount();
            thumbnails += current.thumbnailCount();
            cacheImages += current.cacheCount();
            size += current.totalSize();
            types.merge(current.type(), 1L, Long::sum);
        }
        types.values().removeIf(v -> v == 0);
        return new DashboardDelta(collections, images, thumbnails, cacheImages, size, types);
    }

    public boolean isEmpty() {
        return collections == 0 && images == 0 && thumbnails == 0
                && cacheImages == 0 && size == 0 && typeChanges.isEmpty();
    }
}
