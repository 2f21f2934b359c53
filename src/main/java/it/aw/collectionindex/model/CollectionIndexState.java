package it.aw.collectionindex.model;

import java.time.Instant;

/**
 * Stato di indicizzazione di una collection ({@code collection_index:state:{id}}).
 * <p>
 * Il summary è aggiornato se e solo se {@code indexedAt >= updatedAt} della sorgente:
 * il rebuild incrementale si basa esclusivamente su questo confronto.
 */
public record CollectionIndexState(
        String  collectionId,
        Instant indexedAt,
        Instant collectionUpdatedAt,
        int     imageCount,
        int     thumbnailCount,
        int     cacheCount,
        boolean hasFirstThumbnail,
        String  firstThumbnailPath,
        String  indexVersion
) {
    public static final String CURRENT_VERSION = "v1.0";

    public boolean isFreshFor(Collection collection) {
        return !indexedAt.isBefore(collection.updatedAt());
    }
}
