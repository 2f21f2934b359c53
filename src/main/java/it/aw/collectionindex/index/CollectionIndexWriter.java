package it.aw.collectionindex.index;

import it.aw.collectionindex.cache.ThumbnailCache;
import it.aw.collectionindex.cache.ThumbnailData;
import it.aw.collectionindex.cache.ThumbnailSource;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;
import it.aw.collectionindex.store.IndexStore;
import it.aw.collectionindex.store.StoreUnavailableException;
import it.aw.collectionindex.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Scrive summary, elementi dei sorted set e stato di indicizzazione di una collection.
 * <p>
 * Ogni upsert/remove è un unico {@link WriteBatch}: su Redis una transazione MULTI/EXEC,
 * in memoria una sequenza di scritture atomiche per chiave (i lettori possono vedere
 * uno stato intermedio solo per la durata del batch). Gli elementi rimasti da una
 * versione precedente (cambio di nome, libreria o tipo) sono rimossi nello stesso batch.
 * <p>
 * Upsert e remove su id diversi possono girare in parallelo; la serializzazione sullo
 * stesso id è responsabilità del chiamante. {@link StoreUnavailableException} viene
 * ritentata fino a {@code index.write.max-attempts} volte, poi propagata.
 */
@Service
public class CollectionIndexWriter {

    private static final Logger log = LoggerFactory.getLogger(CollectionIndexWriter.class);

    /** Esito di {@link #upsertAll}: quante collection e thumbnail sono state scritte. */
    public record BatchOutcome(int upserted, int thumbnailsCached, boolean cancelled) {}

    private final IndexStore store;
    private final IndexJson json;
    private final ThumbnailCache thumbnailCache;
    private final ThumbnailSource thumbnailSource;
    private final Clock clock;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public CollectionIndexWriter(IndexStore store,
                                 IndexJson json,
                                 ThumbnailCache thumbnailCache,
                                 ThumbnailSource thumbnailSource,
                                 Clock clock,
                                 @Value("${index.write.max-attempts:3}") int maxAttempts,
                                 @Value("${index.write.retry-backoff-ms:200}") long retryBackoffMs) {
        this.store = store;
        this.json = json;
        this.thumbnailCache = thumbnailCache;
        this.thumbnailSource = thumbnailSource;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
    }

    /** Upsert dal write path: riusa la thumbnail già in cache, se presente. */
    public CollectionSummary upsert(Collection collection) {
        ThumbnailData cached = thumbnailCache.get(collection.id()).orElse(null);
        return upsert(collection, cached);
    }

    /**
     * Upsert con thumbnail esplicita ({@code null} = summary senza anteprima).
     *
     * @return il summary scritto
     */
    public CollectionSummary upsert(Collection collection, ThumbnailData thumbnail) {
        return withRetry("upsert " + collection.id(), () -> {
            Optional<CollectionSummary> previous = readSummary(collection.id());
            CollectionSummary summary = CollectionSummaryProjector.project(collection)
                    .withThumbnail(thumbnail != null ? thumbnail.toDataUrl() : null);
            CollectionIndexState state = CollectionSummaryProjector.stateFor(collection, summary, clock.instant());
            Map<String, IndexEntry> entries = entriesOf(summary);

            WriteBatch batch = new WriteBatch();
            batch.set(IndexKeys.summary(summary.id()), json.write(summary));
            previous.ifPresent(prev -> entriesOf(prev).forEach((key, entry) -> {
                IndexEntry current = entries.get(key);
                if (current == null || !current.member().equals(entry.member())) {
                    batch.sortedRemove(key, entry.member());
                }
            }));
            entries.forEach((key, entry) -> batch.sortedAdd(key, entry.member(), entry.score()));
            batch.set(IndexKeys.state(summary.id()), json.write(state));
            store.apply(batch);

            log.debug("Collection {} indicizzata ({} elementi di sorted set{})", summary.id(), entries.size(),
                    previous.isPresent() ? ", sostituisce la versione precedente" : "");
            return summary;
        });
    }

    /**
     * Percorso batch di rebuild e verify. Con {@code cacheThumbnails} carica le thumbnail
     * dalla {@link ThumbnailSource} e le scrive in cache con un solo batch, poi indicizza
     * ogni collection con la sua anteprima. L'annullamento è controllato tra un upsert e l'altro.
     */
    public BatchOutcome upsertAll(List<Collection> collections, boolean cacheThumbnails, CancellationSignal cancellation) {
        Map<String, ThumbnailData> thumbnails = new HashMap<>();
        if (cacheThumbnails) {
            for (Collection collection : collections) {
                thumbnailSource.load(collection).ifPresent(t -> thumbnails.put(collection.id(), t));
            }
            if (!thumbnails.isEmpty()) {
                withRetry("cache thumbnail", () -> {
                    thumbnailCache.putAll(thumbnails);
                    return null;
                });
            }
        }
        int upserted = 0;
        for (Collection collection : collections) {
            if (cancellation.isCancelled()) {
                log.info("Indicizzazione batch annullata dopo {}/{} collection", upserted, collections.size());
                return new BatchOutcome(upserted, thumbnails.size(), true);
            }
            ThumbnailData thumbnail = cacheThumbnails ? thumbnails.get(collection.id()) : null;
            upsert(collection, thumbnail);
            upserted++;
        }
        return new BatchOutcome(upserted, thumbnails.size(), false);
    }

    /**
     * Rimuove summary, elementi in ogni scope, stato e thumbnail. Idempotente.
     *
     * @return il summary rimosso, vuoto se la collection non era indicizzata
     */
    public Optional<CollectionSummary> remove(String collectionId) {
        return withRetry("remove " + collectionId, () -> {
            Optional<CollectionSummary> previous = readSummary(collectionId);
            WriteBatch batch = new WriteBatch();
            if (previous.isPresent()) {
                entriesOf(previous.get()).forEach((key, entry) -> batch.sortedRemove(key, entry.member()));
            } else {
                // senza summary non si conoscono scope e member del nome: si cerca in tutti i sorted set
                int found = addStrayRemovals(batch, collectionId);
                if (found > 0) {
                    log.info("Collection {} senza summary: {} elementi residui rimossi dai sorted set",
                            collectionId, found);
                }
            }
            batch.delete(IndexKeys.summary(collectionId));
            batch.delete(IndexKeys.state(collectionId));
            batch.delete(IndexKeys.thumbnail(collectionId));
            store.apply(batch);
            if (previous.isPresent()) {
                log.debug("Collection {} rimossa dall'indice", collectionId);
            }
            return previous;
        });
    }

    /**
     * Rimuove elementi specifici dai sorted set (chiave → member) in un solo batch.
     * Usato dalla verifica per gli elementi rimasti in scope che la collection non ha più.
     */
    public void removeMembers(Map<String, List<String>> membersByKey) {
        if (membersByKey.isEmpty()) {
            return;
        }
        withRetry("remove members", () -> {
            WriteBatch batch = new WriteBatch();
            membersByKey.forEach((key, members) -> members.forEach(member -> batch.sortedRemove(key, member)));
            store.apply(batch);
            return null;
        });
    }

    /**
     * Cancella tutti i sorted set, summary e stati dell'indice (rebuild FULL).
     * Le thumbnail restano in cache fino alla loro scadenza.
     *
     * @return numero di chiavi eliminate
     */
    public long clear() {
        return withRetry("clear", () -> {
            List<String> keys = new ArrayList<>();
            keys.addAll(store.keys(IndexKeys.SORTED_PREFIX));
            keys.addAll(store.keys(IndexKeys.DATA_PREFIX));
            keys.addAll(store.keys(IndexKeys.STATE_PREFIX));
            keys.add(IndexKeys.LAST_REBUILD);
            keys.add(IndexKeys.STATS_TOTAL);
            long deleted = store.delete(keys);
            log.info("Indice svuotato: {} chiavi eliminate", deleted);
            return deleted;
        });
    }

    /** Registra la fine di un rebuild riuscito. */
    public void markRebuilt(long totalCollections) {
        withRetry("mark rebuilt", () -> {
            store.apply(new WriteBatch()
                    .set(IndexKeys.LAST_REBUILD, String.valueOf(clock.instant().toEpochMilli()))
                    .set(IndexKeys.STATS_TOTAL, String.valueOf(totalCollections)));
            return null;
        });
    }

    /** Chiave del sorted set → elemento, per ogni campo, direzione e scope del summary. */
    public static Map<String, IndexEntry> entriesOf(CollectionSummary summary) {
        Map<String, IndexEntry> entries = new LinkedHashMap<>();
        for (IndexScope scope : IndexScope.of(summary)) {
            for (SortField field : SortField.values()) {
                for (SortDirection direction : SortDirection.values()) {
                    entries.put(IndexKeys.sortedSet(scope, field, direction),
                            ScoreCodec.entryFor(summary, field, direction));
                }
            }
        }
        return entries;
    }

    private int addStrayRemovals(WriteBatch batch, String collectionId) {
        int found = 0;
        for (String key : store.keys(IndexKeys.SORTED_PREFIX)) {
            SortField field = IndexKeys.fieldOf(key);
            if (!field.isLexical()) {
                if (store.rank(key, collectionId).isPresent()) {
                    batch.sortedRemove(key, collectionId);
                    found++;
                }
                continue;
            }
            for (String member : store.rangeByRank(key, 0, -1)) {
                if (ScoreCodec.idOf(member, field).equals(collectionId)) {
                    batch.sortedRemove(key, member);
                    found++;
                }
            }
        }
        return found;
    }

    private Optional<CollectionSummary> readSummary(String collectionId) {
        return store.get(IndexKeys.summary(collectionId)).map(s -> json.read(s, CollectionSummary.class));
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        StoreUnavailableException failure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                failure = e;
                log.warn("Store non disponibile durante {} (tentativo {}/{}): {}",
                        operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(retryBackoffMs * attempt, e);
                }
            }
        }
        log.error("Scrittura indice fallita dopo {} tentativi: {}", maxAttempts, operation);
        throw failure;
    }

    private static void pause(long millis, StoreUnavailableException cause) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
