package it.aw.collectionindex.index;

import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.CollectionType;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.IndexStats;
import it.aw.collectionindex.model.NavigationResult;
import it.aw.collectionindex.model.PageRequest;
import it.aw.collectionindex.model.PageResult;
import it.aw.collectionindex.model.SiblingsResult;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;
import it.aw.collectionindex.store.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Unico componente sul percorso interattivo: navigazione, vicini, pagine, ricerca e conteggi.
 * <p>
 * Solo letture. Tutti i sorted set si leggono per rank crescente (la direzione è già
 * codificata negli elementi). Le collection non indicizzate producono risultati
 * "non trovato", mai eccezioni; gli id senza summary vengono saltati.
 */
@Service
public class CollectionIndexReader {

    private static final Logger log = LoggerFactory.getLogger(CollectionIndexReader.class);

    static final int SEARCH_CHUNK_SIZE = 500;

    private final IndexStore store;
    private final IndexJson json;

    public CollectionIndexReader(IndexStore store, IndexJson json) {
        this.store = store;
        this.json = json;
    }

    // -------------------------------------------------------------------------
    // Navigazione
    // -------------------------------------------------------------------------

    public NavigationResult getNavigation(String collectionId, SortField field, SortDirection direction) {
        return getNavigation(collectionId, field, direction, IndexScope.global());
    }

    /** Precedente, successiva e posizione 1-based della collection nello scope. */
    public NavigationResult getNavigation(String collectionId, SortField field, SortDirection direction,
                                          IndexScope scope) {
        String key = IndexKeys.sortedSet(scope, field, direction);
        long total = store.cardinality(key);
        Optional<Long> rank = memberFor(collectionId, field, direction).flatMap(m -> toOptional(store.rank(key, m)));
        if (rank.isEmpty()) {
            return NavigationResult.notFound(total);
        }
        long r = rank.get();
        String previous = r > 0 ? idAt(key, r - 1, field) : null;
        String next = idAt(key, r + 1, field);
        return NavigationResult.of(previous, next, r + 1, total);
    }

    /**
     * Pagina di vicini. Con {@code page == null} restituisce la pagina che contiene
     * la collection, altrimenti la pagina assoluta richiesta; oltre la fine si ferma all'ultima.
     */
    public SiblingsResult getSiblings(String collectionId, Integer page, int pageSize,
                                      SortField field, SortDirection direction) {
        PageRequest sizeCheck = new PageRequest(page != null ? page : 1, pageSize);
        String key = IndexKeys.sortedSet(IndexScope.global(), field, direction);
        long total = store.cardinality(key);
        Optional<Long> rank = memberFor(collectionId, field, direction).flatMap(m -> toOptional(store.rank(key, m)));
        if (rank.isEmpty()) {
            return SiblingsResult.notFound(pageSize, total);
        }
        int lastPage = Math.max(1, PageRequest.totalPages(total, pageSize));
        int currentPage = page != null ? Math.min(sizeCheck.page(), lastPage) : (int) (rank.get() / pageSize) + 1;
        PageRequest request = new PageRequest(currentPage, pageSize);
        List<CollectionSummary> siblings = summariesAt(key, request.startRank(), request.endRank(), field);
        return new SiblingsResult(true, siblings, rank.get() + 1, currentPage, pageSize, total,
                PageRequest.totalPages(total, pageSize));
    }

    // -------------------------------------------------------------------------
    // Paginazione
    // -------------------------------------------------------------------------

    public PageResult getPage(IndexScope scope, PageRequest request, SortField field, SortDirection direction) {
        String key = IndexKeys.sortedSet(scope, field, direction);
        long total = store.cardinality(key);
        if (request.startRank() >= total) {
            return PageResult.of(List.of(), request, total);
        }
        return PageResult.of(summariesAt(key, request.startRank(), request.endRank(), field), request, total);
    }

    public PageResult getPage(PageRequest request, SortField field, SortDirection direction) {
        return getPage(IndexScope.global(), request, field, direction);
    }

    public PageResult getPageByLibrary(String libraryId, PageRequest request, SortField field, SortDirection direction) {
        return getPage(IndexScope.library(libraryId), request, field, direction);
    }

    public PageResult getPageByType(CollectionType type, PageRequest request,
                                    SortField field, SortDirection direction) {
        return getPage(IndexScope.type(type), request, field, direction);
    }

    /**
     * Ricerca testuale su nome, path, descrizione e tag (case-insensitive), poi paginazione
     * nell'ordine richiesto. Scorre l'intero sorted set a blocchi: costo lineare nello scope.
     */
    public PageResult searchPage(String query, PageRequest request, SortField field, SortDirection direction,
                                 IndexScope scope) {
        if (query == null || query.isBlank()) {
            return getPage(scope, request, field, direction);
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        String key = IndexKeys.sortedSet(scope, field, direction);
        long total = store.cardinality(key);
        List<CollectionSummary> matches = new ArrayList<>();
        for (long start = 0; start < total; start += SEARCH_CHUNK_SIZE) {
            for (CollectionSummary summary : summariesAt(key, start, start + SEARCH_CHUNK_SIZE - 1, field)) {
                if (matches(summary, needle)) {
                    matches.add(summary);
                }
            }
        }
        log.debug("Ricerca '{}' su {}: {} risultati su {}", query, key, matches.size(), total);
        int from = (int) Math.min(request.startRank(), matches.size());
        int to = (int) Math.min(request.startRank() + request.pageSize(), matches.size());
        return PageResult.of(new ArrayList<>(matches.subList(from, to)), request, matches.size());
    }

    public PageResult searchPage(String query, PageRequest request, SortField field, SortDirection direction) {
        return searchPage(query, request, field, direction, IndexScope.global());
    }

    // -------------------------------------------------------------------------
    // Conteggi e stato
    // -------------------------------------------------------------------------

    /** Numero di collection nello scope, O(1). */
    public long getCount(IndexScope scope) {
        return store.cardinality(IndexKeys.sortedSet(scope, SortField.UPDATED_AT, SortDirection.DESC));
    }

    public Optional<CollectionSummary> getSummary(String collectionId) {
        return store.get(IndexKeys.summary(collectionId)).map(s -> json.read(s, CollectionSummary.class));
    }

    public Optional<CollectionIndexState> getIndexState(String collectionId) {
        return store.get(IndexKeys.state(collectionId)).map(s -> json.read(s, CollectionIndexState.class));
    }

    public Optional<Instant> getLastRebuildTime() {
        return store.get(IndexKeys.LAST_REBUILD).map(v -> Instant.ofEpochMilli(Long.parseLong(v)));
    }

    public IndexStats getIndexStats() {
        Map<String, Long> sizes = globalSetSizes();
        return new IndexStats(getCount(IndexScope.global()), getLastRebuildTime().orElse(null),
                isValid(sizes), sizes);
    }

    /**
     * L'indice è valido se è stato ricostruito almeno una volta e tutti i sorted set
     * globali hanno la stessa cardinalità.
     */
    public boolean isIndexValid() {
        return isValid(globalSetSizes());
    }

    private boolean isValid(Map<String, Long> sizes) {
        return getLastRebuildTime().isPresent() && sizes.values().stream().distinct().count() <= 1;
    }

    private Map<String, Long> globalSetSizes() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        for (SortField field : SortField.values()) {
            for (SortDirection direction : SortDirection.values()) {
                String key = IndexKeys.sortedSet(IndexScope.global(), field, direction);
                sizes.put(key, store.cardinality(key));
            }
        }
        return sizes;
    }

    // -------------------------------------------------------------------------
    // Supporto
    // -------------------------------------------------------------------------

    /** Member della collection nel sorted set; per il nome serve il summary. */
    private Optional<String> memberFor(String collectionId, SortField field, SortDirection direction) {
        if (!field.isLexical()) {
            return Optional.of(collectionId);
        }
        return getSummary(collectionId).map(s -> ScoreCodec.nameMember(s.name(), s.id(), direction));
    }

    private String idAt(String key, long rank, SortField field) {
        List<String> members = store.rangeByRank(key, rank, rank);
        return members.isEmpty() ? null : ScoreCodec.idOf(members.get(0), field);
    }

    private List<CollectionSummary> summariesAt(String key, long start, long stop, SortField field) {
        List<String> members = store.rangeByRank(key, start, stop);
        if (members.isEmpty()) {
            return List.of();
        }
        List<String> keys = new ArrayList<>(members.size());
        for (String member : members) {
            keys.add(IndexKeys.summary(ScoreCodec.idOf(member, field)));
        }
        List<String> values = store.multiGet(keys);
        List<CollectionSummary> summaries = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            if (value == null) {
                log.debug("Summary mancante per {}, saltato", keys.get(i));
                continue;
            }
            summaries.add(json.read(value, CollectionSummary.class));
        }
        return summaries;
    }

    static boolean matches(CollectionSummary summary, String needle) {
        if (contains(summary.name(), needle) || contains(summary.path(), needle)
                || contains(summary.description(), needle)) {
            return true;
        }
        return summary.tags().stream().anyMatch(tag -> contains(tag, needle));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static Optional<Long> toOptional(OptionalLong value) {
        return value.isPresent() ? Optional.of(value.getAsLong()) : Optional.empty();
    }
}
