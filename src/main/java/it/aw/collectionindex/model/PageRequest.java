package it.aw.collectionindex.model;

/**
 * Parametri di paginazione (pagine 1-based).
 * <p>
 * La validazione avviene nel costruttore compatto: valori fuori range
 * producono {@link IllegalArgumentException}, tradotta in 400 dai controller.
 */
public record PageRequest(int page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE     = 500;

    public PageRequest {
        if (page < 1) {
            throw new IllegalArgumentException("page deve essere >= 1 (ricevuto: " + page + ")");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                    "pageSize deve essere tra 1 e " + MAX_PAGE_SIZE + " (ricevuto: " + pageSize + ")");
        }
    }

    /** Rank 0-based del primo elemento della pagina. */
    public long startRank() {
        return (long) (page - 1) * pageSize;
    }

    /** Rank 0-based dell'ultimo elemento della pagina (incluso). */
    public long endRank() {
        return startRank() + pageSize - 1;
    }

    public static int totalPages(long totalCount, int pageSize) {
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }
}
