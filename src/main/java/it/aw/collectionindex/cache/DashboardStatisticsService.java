package it.aw.collectionindex.cache;

import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.CollectionType;
import it.aw.collectionindex.model.DashboardActivity;
import it.aw.collectionindex.model.DashboardDelta;
import it.aw.collectionindex.model.DashboardStatistics;
import it.aw.collectionindex.registry.CollectionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistiche della dashboard: lettura dalla cache, ricalcolo completo dalla sorgente
 * quando mancano o non sono fresche, patch incrementali dal write path.
 */
@Service
public class DashboardStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(DashboardStatisticsService.class);

    private final DashboardStatisticsCache cache;
    private final CollectionSource source;
    private final Clock clock;
    private final int batchSize;

    public DashboardStatisticsService(DashboardStatisticsCache cache,
                                      CollectionSource source,
                                      Clock clock,
                                      @Value("${index.rebuild.batch-size:100}") int batchSize) {
        this.cache = cache;
        this.source = source;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
    }

    public DashboardStatistics getStatistics() {
        return cache.get()
                .filter(cache::isFresh)
                .orElseGet(this::recompute);
    }

    /** Ricalcola l'aggregato scorrendo la sorgente a pagine e lo salva in cache. */
    public DashboardStatistics recompute() {
        long started = System.currentTimeMillis();
        long collections = 0, images = 0, thumbnails = 0, cacheImages = 0, size = 0;
        Map<CollectionType, Long> byType = new EnumMap<>(CollectionType.class);
        String afterId = null;
        List<Collection> page;
        do {
            page = source.findPage(afterId, batchSize);
            for (Collection c : page) {
                collections++;
                images += Math.max(0, c.imageCount());
                thumbnails += Math.max(0, c.thumbnailCount());
                cacheImages += Math.max(0, c.cacheCount());
                size += Math.max(0, c.totalSize());
                byType.merge(c.type(), 1L, Long::sum);
            }
            if (!page.isEmpty()) {
                afterId = page.get(page.size() - 1).id();
            }
        } while (page.size() == batchSize);

        Instant now = clock.instant();
        DashboardStatistics statistics = DashboardStatistics.of(collections, images, thumbnails, cacheImages,
                size, byType, now, now);
        cache.store(statistics);
        log.info("Statistiche dashboard ricalcolate: {} collection, {} immagini in {} ms",
                collections, images, System.currentTimeMillis() - started);
        return statistics;
    }

    /** Variazione di una collection creata ({@code previous == null}) o modificata. */
    public void onUpsert(CollectionSummary previous, CollectionSummary current) {
        cache.applyDelta(DashboardDelta.between(previous, current));
        cache.recordActivity(new DashboardActivity(
                previous == null ? "collection_created" : "collection_updated",
                (previous == null ? "Collection creata: " : "Collection aggiornata: ") + current.name(),
                current.id(), current.name(), clock.instant()));
    }

    public void onRemove(CollectionSummary previous) {
        cache.applyDelta(DashboardDelta.between(previous, null));
        cache.recordActivity(new DashboardActivity("collection_deleted",
                "Collection eliminata: " + previous.name(), previous.id(), previous.name(), clock.instant()));
    }

    /** Evento di sistema (es. rebuild completato). */
    public void recordSystemEvent(String type, String message) {
        cache.recordActivity(new DashboardActivity(type, message, null, null, clock.instant()));
    }

    public List<DashboardActivity> recentActivity(int limit) {
        return cache.recentActivity(limit);
    }
}
