package it.aw.collectionindex.rebuild;

import it.aw.collectionindex.cache.DashboardStatisticsService;
import it.aw.collectionindex.index.CancellationSignal;
import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.index.CollectionIndexWriter;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.RebuildMode;
import it.aw.collectionindex.model.RebuildOptions;
import it.aw.collectionindex.model.RebuildOutcome;
import it.aw.collectionindex.model.RebuildStatistics;
import it.aw.collectionindex.model.VerifyResult;
import it.aw.collectionindex.registry.CollectionSource;
import it.aw.collectionindex.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ricostruzione dell'indice dalla sorgente, a pagine keyset di {@code index.rebuild.batch-size}.
 * <ul>
 *   <li>{@code CHANGED_ONLY}: solo le collection senza stato o con {@code indexedAt < updatedAt};</li>
 *   <li>{@code FULL}: svuota l'indice e lo ricostruisce (le thumbnail in cache restano);</li>
 *   <li>{@code FORCE_REBUILD_ALL}: riproietta tutto senza svuotare;</li>
 *   <li>{@code VERIFY}: delega al {@link ConsistencyVerifier}.</li>
 * </ul>
 * Il rebuild non è atomico: un lettore concorrente vede un misto di vecchio e nuovo.
 * L'annullamento è controllato tra una collection e l'altra. Un errore dello store o della
 * sorgente chiude il rebuild come {@code FAILED} con i contatori raggiunti fino a quel punto.
 */
@Service
public class RebuildOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RebuildOrchestrator.class);

    private final CollectionSource source;
    private final CollectionIndexReader reader;
    private final CollectionIndexWriter writer;
    private final ConsistencyVerifier verifier;
    private final DashboardStatisticsService dashboard;
    private final Clock clock;
    private final int batchSize;

    public RebuildOrchestrator(CollectionSource source,
                               CollectionIndexReader reader,
                               CollectionIndexWriter writer,
                               ConsistencyVerifier verifier,
                               DashboardStatisticsService dashboard,
                               Clock clock,
                               @Value("${index.rebuild.batch-size:100}") int batchSize) {
        this.source = source;
        this.reader = reader;
        this.writer = writer;
        this.verifier = verifier;
        this.dashboard = dashboard;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
    }

    /** Contatori di un rebuild in corso, restituiti anche quando si interrompe. */
    private static final class Progress {
        int total;
        int skipped;
        int rebuilt;
        int removed;
        int thumbnails;
    }

    public RebuildStatistics rebuild(RebuildMode mode, RebuildOptions options, CancellationSignal cancellation) {
        Instant startedAt = clock.instant();
        log.info("Rebuild indice avviato: modalità={}, skipThumbnail={}, dryRun={}",
                mode, options.skipThumbnailCaching(), options.dryRun());
        Progress progress = new Progress();
        VerifyResult verify = null;
        RebuildOutcome outcome;
        String failure = null;
        try {
            if (mode == RebuildMode.VERIFY) {
                verify = verifier.verify(options, cancellation);
                progress.total = verify.totalInSource();
                if (verify.applied()) {
                    progress.rebuilt = verify.toAdd() + verify.toUpdate();
                    progress.removed = verify.toRemove();
                }
                progress.skipped = progress.total - verify.toAdd() - verify.toUpdate();
                outcome = verify.cancelled() ? RebuildOutcome.CANCELLED : RebuildOutcome.COMPLETED;
            } else {
                if (mode == RebuildMode.FULL && !options.dryRun()) {
                    writer.clear();
                }
                boolean cancelled = processSource(mode, options, cancellation, progress);
                outcome = cancelled ? RebuildOutcome.CANCELLED : RebuildOutcome.COMPLETED;
            }
            if (outcome == RebuildOutcome.COMPLETED && !options.dryRun()
                    && (mode != RebuildMode.VERIFY || progress.rebuilt > 0 || progress.removed > 0)) {
                writer.markRebuilt(reader.getCount(IndexScope.global()));
            }
        } catch (StoreUnavailableException e) {
            log.error("Rebuild {} interrotto: store non disponibile ({} collection ricostruite)",
                    mode, progress.rebuilt, e);
            outcome = RebuildOutcome.FAILED;
            failure = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Rebuild {} interrotto: errore leggendo la sorgente dopo {} collection esaminate",
                    mode, progress.total, e);
            outcome = RebuildOutcome.FAILED;
            failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }

        if (outcome == RebuildOutcome.COMPLETED && !options.dryRun()) {
            refreshDashboard(mode, progress);
        }

        Instant completedAt = clock.instant();
        RebuildStatistics statistics = new RebuildStatistics(mode, outcome, options.dryRun(),
                progress.total, progress.skipped, progress.rebuilt, progress.removed, progress.thumbnails,
                startedAt, completedAt, Duration.between(startedAt, completedAt), failure, verify);
        log.info("Rebuild indice {}: modalità={}, totale={}, ricostruite={}, saltate={}, rimosse={}, " +
                        "thumbnail={}, durata={} ms",
                outcome, mode, progress.total, progress.rebuilt, progress.skipped, progress.removed,
                progress.thumbnails, statistics.duration().toMillis());
        return statistics;
    }

    /** @return {@code true} se annullato */
    private boolean processSource(RebuildMode mode, RebuildOptions options, CancellationSignal cancellation,
                                  Progress progress) {
        String afterId = null;
        List<Collection> page;
        do {
            if (cancellation.isCancelled()) {
                return true;
            }
            page = source.findPage(afterId, batchSize);
            List<Collection> toIndex = new ArrayList<>(page.size());
            for (Collection collection : page) {
                progress.total++;
                if (mode == RebuildMode.CHANGED_ONLY && isFresh(collection)) {
                    progress.skipped++;
                } else {
                    toIndex.add(collection);
                }
            }
            if (options.dryRun()) {
                progress.rebuilt += toIndex.size();
            } else if (!toIndex.isEmpty()) {
                CollectionIndexWriter.BatchOutcome batch =
                        writer.upsertAll(toIndex, !options.skipThumbnailCaching(), cancellation);
                progress.rebuilt += batch.upserted();
                progress.thumbnails += batch.thumbnailsCached();
                if (batch.cancelled()) {
                    return true;
                }
            }
            if (!page.isEmpty()) {
                afterId = page.get(page.size() - 1).id();
                log.debug("Rebuild {}: {} collection esaminate", mode, progress.total);
            }
        } while (page.size() == batchSize);
        return false;
    }

    private boolean isFresh(Collection collection) {
        Optional<CollectionIndexState> state = reader.getIndexState(collection.id());
        return state.isPresent() && state.get().isFreshFor(collection);
    }

    private void refreshDashboard(RebuildMode mode, Progress progress) {
        try {
            dashboard.recompute();
            dashboard.recordSystemEvent("index_rebuilt",
                    "Indice ricostruito (" + mode + "): " + progress.rebuilt + " collection");
        } catch (RuntimeException e) {
            log.warn("Rebuild completato ma aggiornamento statistiche dashboard fallito: {}", e.getMessage());
        }
    }
}
