package it.aw.collectionindex.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Collection così come è memorizzata nel registry (sorgente di verità).
 * <p>
 * L'indice non modifica mai questo record: lo legge e lo proietta in un
 * {@link CollectionSummary}. Contratto: {@code updatedAt} avanza ogni volta che
 * cambia un campo proiettato, altrimenti il rebuild ChangedOnly non se ne accorge.
 * I timestamp sono troncati al millisecondo, la stessa risoluzione degli score.
 */
public record Collection(
        String         id,
        String         libraryId,           // null se la collection non appartiene a una libreria
        String         name,
        String         description,
        String         path,
        CollectionType type,
        List<String>   tags,
        int            imageCount,
        int            thumbnailCount,
        int            cacheCount,
        long           totalSize,           // byte
        String         firstImageId,        // null se la collection è vuota
        String         firstThumbnailPath,  // file della prima thumbnail, null se non generata
        Instant        createdAt,
        Instant        updatedAt
) {
    public Collection {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id della collection vuoto");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        type = type == null ? CollectionType.FOLDER : type;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt.truncatedTo(ChronoUnit.MILLIS);
        updatedAt = updatedAt == null ? createdAt : updatedAt.truncatedTo(ChronoUnit.MILLIS);
    }

    /** Copia con un nuovo {@code updatedAt}; usata dal write path per far avanzare il timestamp. */
    public Collection withUpdatedAt(Instant newUpdatedAt) {
        return new Collection(id, libraryId, name, description, path, type, tags,
                imageCount, thumbnailCount, cacheCount, totalSize,
                firstImageId, firstThumbnailPath, createdAt, newUpdatedAt);
    }
}
