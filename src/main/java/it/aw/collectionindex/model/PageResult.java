package it.aw.collectionindex.model;

import java.util.List;

/**
 * Pagina di summary ordinati. Uno scope vuoto produce una pagina vuota, mai un errore.
 */
public record PageResult(
        List<CollectionSummary> collections,
        int                     currentPage,
        int                     pageSize,
        long                    totalCount,
        int                     totalPages,
        boolean                 hasNext,
        boolean                 hasPrevious
) {
    public static PageResult of(List<CollectionSummary> collections, PageRequest request, long totalCount) {
        int totalPages = PageRequest.totalPages(totalCount, request.pageSize());
        return new PageResult(collections, request.page(), request.pageSize(), totalCount, totalPages,
                request.page() < totalPages, request.page() > 1);
    }
}
