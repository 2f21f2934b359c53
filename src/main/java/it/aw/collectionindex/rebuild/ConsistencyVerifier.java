package it.aw.collectionindex.rebuild;

import it.aw.collectionindex.index.CancellationSignal;
import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.index.CollectionIndexWriter;
import it.aw.collectionindex.index.CollectionSummaryProjector;
import it.aw.collectionindex.index.IndexEntry;
import it.aw.collectionindex.index.IndexKeys;
import it.aw.collectionindex.index.ScoreCodec;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.RebuildOptions;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;
import it.aw.collectionindex.model.VerifyResult;
import it.aw.collectionindex.registry.CollectionSource;
import it.aw.collectionindex.store.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Confronta la sorgente con l'indice e, se non in dry run, corregge le differenze.
 * <p>
 * Fase 1, sulla sorgente: collection senza stato (mancanti), con {@code indexedAt < updatedAt}
 * (obsolete), indicizzate senza thumbnail pur avendone una, assenti dal sorted set della
 * propria libreria o del proprio tipo. Fase 2, sull'indice: id presenti come summary o nel
 * sorted set globale ma non più nella sorgente (orfani).
 * Se la verifica viene annullata durante la fase 1 la fase 2 non parte: senza l'elenco
 * completo degli id della sorgente ogni id indicizzato sembrerebbe orfano.
 */
@Component
public class ConsistencyVerifier {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyVerifier.class);

    private final CollectionSource source;
    private final CollectionIndexReader reader;
    private final CollectionIndexWriter writer;
    private final IndexStore store;
    private final int batchSize;

    public ConsistencyVerifier(CollectionSource source,
                               CollectionIndexReader reader,
                               CollectionIndexWriter writer,
                               IndexStore store,
                               @Value("${index.rebuild.batch-size:100}") int batchSize) {
        this.source = source;
        this.reader = reader;
        this.writer = writer;
        this.store = store;
        this.batchSize = Math.max(1, batchSize);
    }

    public VerifyResult verify(RebuildOptions options, CancellationSignal cancellation) {
        long started = System.currentTimeMillis();
        List<String> missing = new ArrayList<>();
        List<String> outdated = new ArrayList<>();
        List<String> missingThumbnails = new ArrayList<>();
        List<String> scopeMismatches = new ArrayList<>();
        List<Collection> toFix = new ArrayList<>();
        Set<String> toFixIds = new HashSet<>();
        Map<String, Collection> sourceById = new HashMap<>();
        boolean cancelled = false;

        // --- Fase 1: sorgente → indice ---
        String afterId = null;
        List<Collection> page;
        scan:
        do {
            page = source.findPage(afterId, batchSize);
            for (Collection collection : page) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    break scan;
                }
                sourceById.put(collection.id(), collection);
                Optional<CollectionIndexState> state = reader.getIndexState(collection.id());
                List<String> target = null;
                if (state.isEmpty() || reader.getSummary(collection.id()).isEmpty()) {
                    target = missing;
                } else if (!state.get().isFreshFor(collection)) {
                    target = outdated;
                } else if (!state.get().hasFirstThumbnail() && collection.firstThumbnailPath() != null) {
                    target = missingThumbnails;
                } else if (!inEveryScope(collection)) {
                    target = scopeMismatches;
                }
                if (target != null) {
                    target.add(collection.id());
                    toFix.add(collection);
                    toFixIds.add(collection.id());
                }
            }
            if (!page.isEmpty()) {
                afterId = page.get(page.size() - 1).id();
            }
        } while (page.size() == batchSize);

        // --- Fase 2: indice → sorgente ---
        Set<String> indexedIds = new TreeSet<>();
        List<String> orphaned = new ArrayList<>();
        Map<String, List<String>> strays = new LinkedHashMap<>();
        if (!cancelled) {
            for (String key : store.keys(IndexKeys.DATA_PREFIX)) {
                indexedIds.add(IndexKeys.idFromKey(key, IndexKeys.DATA_PREFIX));
            }
            Map<String, Map<String, IndexEntry>> expected = new HashMap<>();
            for (String key : store.keys(IndexKeys.SORTED_PREFIX)) {
                SortField field = IndexKeys.fieldOf(key);
                for (String member : store.rangeByRank(key, 0, -1)) {
                    String id = ScoreCodec.idOf(member, field);
                    indexedIds.add(id);
                    Collection owner = sourceById.get(id);
                    if (owner == null) {
                        continue;
                    }
                    IndexEntry entry = expected.computeIfAbsent(id, k -> expectedEntries(owner)).get(key);
                    if (entry == null || !entry.member().equals(member)) {
                        strays.computeIfAbsent(key, k -> new ArrayList<>()).add(member);
                        if (!toFixIds.contains(id) && !scopeMismatches.contains(id)) {
                            scopeMismatches.add(id);
                        }
                    }
                }
            }
            for (String id : indexedIds) {
                if (!sourceById.containsKey(id)) {
                    orphaned.add(id);
                }
            }
        }

        boolean consistent = !cancelled && toFix.isEmpty() && orphaned.isEmpty() && strays.isEmpty();
        log.info("Verifica indice: sorgente={}, indice={}, mancanti={}, obsolete={}, senza thumbnail={}, " +
                        "scope errati={}, orfani={}{}",
                sourceById.size(), indexedIds.size(), missing.size(), outdated.size(), missingThumbnails.size(),
                scopeMismatches.size(), orphaned.size(), cancelled ? " (annullata)" : "");

        boolean applied = false;
        if (!options.dryRun() && !cancelled && !consistent) {
            cancelled = !fix(toFix, strays, orphaned, options, cancellation);
            applied = !cancelled;
        }

        return new VerifyResult(consistent, options.dryRun(), applied, cancelled,
                sourceById.size(), indexedIds.size(), missing, outdated, missingThumbnails,
                scopeMismatches, orphaned, Duration.ofMillis(System.currentTimeMillis() - started));
    }

    /** @return {@code false} se annullata a metà */
    private boolean fix(List<Collection> toFix, Map<String, List<String>> strays, List<String> orphaned,
                        RebuildOptions options, CancellationSignal cancellation) {
        for (int from = 0; from < toFix.size(); from += batchSize) {
            List<Collection> batch = toFix.subList(from, Math.min(from + batchSize, toFix.size()));
            if (writer.upsertAll(batch, !options.skipThumbnailCaching(), cancellation).cancelled()) {
                return false;
            }
        }
        writer.removeMembers(strays);
        for (String id : orphaned) {
            if (cancellation.isCancelled()) {
                return false;
            }
            writer.remove(id);
        }
        log.info("Correzioni applicate: {} collection reindicizzate, {} orfani rimossi", toFix.size(), orphaned.size());
        return true;
    }

    private boolean inEveryScope(Collection collection) {
        for (IndexScope scope : IndexScope.of(CollectionSummaryProjector.project(collection))) {
            String key = IndexKeys.sortedSet(scope, SortField.UPDATED_AT, SortDirection.DESC);
            if (store.rank(key, collection.id()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /** Chiave del sorted set → elemento atteso per la versione corrente della collection. */
    private static Map<String, IndexEntry> expectedEntries(Collection collection) {
        return CollectionIndexWriter.entriesOf(CollectionSummaryProjector.project(collection));
    }
}
