package it.aw.collectionindex.model;

import java.util.List;

/**
 * Pagina di collection vicine a quella corrente, con metadati di paginazione.
 */
public record SiblingsResult(
        boolean                 found,
        List<CollectionSummary> siblings,
        long                    currentPosition,  // 1-based, 0 se non trovata
        int                     currentPage,
        int                     pageSize,
        long                    totalCount,
        int                     totalPages
) {
    public static SiblingsResult notFound(int pageSize, long totalCount) {
        return new SiblingsResult(false, List.of(), 0, 0, pageSize, totalCount,
                PageRequest.totalPages(totalCount, pageSize));
    }
}
