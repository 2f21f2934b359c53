package it.aw.collectionindex.support;

import it.aw.collectionindex.cache.DashboardStatisticsCache;
import it.aw.collectionindex.cache.DashboardStatisticsService;
import it.aw.collectionindex.cache.ThumbnailCache;
import it.aw.collectionindex.index.CollectionIndexReader;
import it.aw.collectionindex.index.CollectionIndexWriter;
import it.aw.collectionindex.index.IndexJson;
import it.aw.collectionindex.rebuild.ConsistencyVerifier;
import it.aw.collectionindex.rebuild.RebuildOrchestrator;
import it.aw.collectionindex.store.InMemoryIndexStore;
import it.aw.collectionindex.store.IndexStore;

import java.time.Duration;

/**
 * Componenti dell'indice collegati a mano su uno store in memoria, senza contesto Spring.
 */
public class IndexFixture {

    public static final int BATCH_SIZE = 3;

    public final MutableClock clock = new MutableClock(TestCollections.T0.plusSeconds(3600));
    public final InMemoryCollectionSource source = new InMemoryCollectionSource();
    public final MapThumbnailSource thumbnailSource = new MapThumbnailSource();
    public final IndexJson json = new IndexJson(TestCollections.objectMapper());
    public final IndexStore store;
    public final ThumbnailCache thumbnailCache;
    public final CollectionIndexWriter writer;
    public final CollectionIndexReader reader;
    public final DashboardStatisticsCache dashboardCache;
    public final DashboardStatisticsService dashboard;
    public final ConsistencyVerifier verifier;
    public final RebuildOrchestrator orchestrator;

    public IndexFixture() {
        this(null);
    }

    /** @param store store da usare, {@code null} per uno in memoria sull'orologio del fixture */
    public IndexFixture(IndexStore store) {
        this.store = store != null ? store : new InMemoryIndexStore(clock);
        this.thumbnailCache = new ThumbnailCache(this.store, Duration.ofDays(30));
        this.writer = new CollectionIndexWriter(this.store, json, thumbnailCache, thumbnailSource, clock, 3, 0);
        this.reader = new CollectionIndexReader(this.store, json);
        this.dashboardCache = new DashboardStatisticsCache(this.store, json, clock,
                Duration.ofMinutes(5), Duration.ofMinutes(1));
        this.dashboard = new DashboardStatisticsService(dashboardCache, source, clock, BATCH_SIZE);
        this.verifier = new ConsistencyVerifier(source, reader, writer, this.store, BATCH_SIZE);
        this.orchestrator = new RebuildOrchestrator(source, reader, writer, verifier, dashboard, clock, BATCH_SIZE);
    }
}
