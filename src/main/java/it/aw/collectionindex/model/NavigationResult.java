package it.aw.collectionindex.model;

/**
 * Risultato di una richiesta di navigazione: precedente/successiva e posizione.
 * {@code found == false} se la collection non è (ancora) indicizzata.
 */
public record NavigationResult(
        boolean found,
        String  previousCollectionId,
        String  nextCollectionId,
        long    currentPosition,   // 1-based, 0 se non trovata
        long    totalCollections,
        boolean hasPrevious,
        boolean hasNext
) {
    public static NavigationResult notFound(long totalCollections) {
        return new NavigationResult(false, null, null, 0, totalCollections, false, false);
    }

    public static NavigationResult of(String previousId, String nextId, long position, long total) {
        return new NavigationResult(true, previousId, nextId, position, total,
                previousId != null, nextId != null);
    }
}
