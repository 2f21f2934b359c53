package it.aw.collectionindex.model;

import java.time.Instant;
import java.util.List;

/**
 * Vista leggera di una collection, memorizzata in {@code collection_index:data:{id}}
 * e restituita da liste, pagine e navigazione.
 * <p>
 * Ogni campo è funzione pura della {@link Collection} al momento della proiezione;
 * il record viene sempre sostituito per intero, mai aggiornato a pezzi.
 */
public record CollectionSummary(
        String         id,
        String         name,
        String         firstImageId,
        String         firstImageThumbnailUrl,  // null se la collection non ha thumbnail
        int            imageCount,
        int            thumbnailCount,
        int            cacheCount,
        long           totalSize,
        Instant        createdAt,
        Instant        updatedAt,
        String         libraryId,               // null se fuori da ogni libreria
        String         description,
        CollectionType type,
        List<String>   tags,
        String         path,
        String         thumbnailBase64          // data URL precalcolato, null se non in cache
) {
    public CollectionSummary {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public CollectionSummary withThumbnail(String dataUrl) {
        return new CollectionSummary(id, name, firstImageId, firstImageThumbnailUrl,
                imageCount, thumbnailCount, cacheCount, totalSize, createdAt, updatedAt,
                libraryId, description, type, tags, path, dataUrl);
    }

    public boolean hasThumbnail() {
        return thumbnailBase64 != null;
    }
}
