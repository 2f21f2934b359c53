package it.aw.collectionindex.index;

import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.CollectionSummary;

import java.time.Instant;

/**
 * Proiezione pura {@link Collection} → {@link CollectionSummary}: nessun I/O,
 * definita per ogni input valido. I campi opzionali mancanti prendono i default
 * (tag vuoti, nessun riferimento alla thumbnail, nome e path vuoti).
 */
public final class CollectionSummaryProjector {

    static final String THUMBNAIL_URL_TEMPLATE = "/api/collections/%s/thumbnail";

    private CollectionSummaryProjector() {}

    public static CollectionSummary project(Collection collection) {
        String thumbnailUrl = collection.firstThumbnailPath() != null
                ? String.format(THUMBNAIL_URL_TEMPLATE, collection.id())
                : null;
        return new CollectionSummary(
                collection.id(),
                collection.name() != null ? collection.name() : "",
                collection.firstImageId(),
                thumbnailUrl,
                Math.max(0, collection.imageCount()),
                Math.max(0, collection.thumbnailCount()),
                Math.max(0, collection.cacheCount()),
                Math.max(0, collection.totalSize()),
                collection.createdAt(),
                collection.updatedAt(),
                collection.libraryId(),
                collection.description(),
                collection.type(),
                collection.tags(),
                collection.path() != null ? collection.path() : "",
                null
        );
    }

    /**
     * Stato di indicizzazione corrispondente a un summary appena scritto.
     * {@code indexedAt} non è mai anteriore a {@code updatedAt}, anche con orologi sfasati.
     */
    public static CollectionIndexState stateFor(Collection collection, CollectionSummary summary, Instant now) {
        Instant indexedAt = now.isBefore(collection.updatedAt()) ? collection.updatedAt() : now;
        return new CollectionIndexState(
                collection.id(),
                indexedAt,
                collection.updatedAt(),
                summary.imageCount(),
                summary.thumbnailCount(),
                summary.cacheCount(),
                summary.hasThumbnail(),
                collection.firstThumbnailPath(),
                CollectionIndexState.CURRENT_VERSION
        );
    }
}
