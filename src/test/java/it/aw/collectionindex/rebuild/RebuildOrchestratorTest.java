package it.aw.collectionindex.rebuild;

import it.aw.collectionindex.cache.ThumbnailData;
import it.aw.collectionindex.index.CancellationSignal;
import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.DashboardActivity;
import it.aw.collectionindex.model.IndexScope;
import it.aw.collectionindex.model.RebuildMode;
import it.aw.collectionindex.model.RebuildOptions;
import it.aw.collectionindex.model.RebuildOutcome;
import it.aw.collectionindex.model.RebuildStatistics;
import it.aw.collectionindex.support.FlakyIndexStore;
import it.aw.collectionindex.support.IndexFixture;
import it.aw.collectionindex.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static it.aw.collectionindex.support.TestCollections.T0;
import static it.aw.collectionindex.support.TestCollections.collection;
import static it.aw.collectionindex.support.TestCollections.renamed;
import static it.aw.collectionindex.support.TestCollections.withThumbnailPath;
import static org.assertj.core.api.Assertions.assertThat;

class RebuildOrchestratorTest {

    private final IndexFixture fx = new IndexFixture();

    private void seed(int n) {
        for (int i = 0; i < n; i++) {
            fx.source.put(collection(String.format("c%02d", i), "Name " + i, i * 1_000L));
        }
    }

    private RebuildStatistics run(RebuildMode mode) {
        return fx.orchestrator.rebuild(mode, RebuildOptions.defaults(), CancellationSignal.none());
    }

    @Test
    void fullRebuildLeavesNothingToVerify() {
        seed(8);

        RebuildStatistics full = run(RebuildMode.FULL);
        RebuildStatistics verify = fx.orchestrator.rebuild(RebuildMode.VERIFY, new RebuildOptions(false, true),
                CancellationSignal.none());

        assertThat(full.outcome()).isEqualTo(RebuildOutcome.COMPLETED);
        assertThat(full.totalCollections()).isEqualTo(8);
        assertThat(full.rebuiltCollections()).isEqualTo(8);
        assertThat(verify.verify().consistent()).isTrue();
        assertThat(verify.verify().toAdd() + verify.verify().toUpdate() + verify.verify().toRemove()).isZero();
        assertThat(fx.reader.isIndexValid()).isTrue();
        assertThat(fx.reader.getIndexStats().totalCollections()).isEqualTo(8);
    }

    @Test
    void changedOnlyAfterFullRebuildsNothing() {
        seed(7);
        run(RebuildMode.FULL);

        RebuildStatistics changed = run(RebuildMode.CHANGED_ONLY);

        assertThat(changed.rebuiltCollections()).isZero();
        assertThat(changed.skippedCollections()).isEqualTo(7);
    }

    @Test
    void changedOnlyPicksUpModifiedCollections() {
        seed(5);
        run(RebuildMode.FULL);
        Collection c = fx.source.findById("c02").orElseThrow();
        fx.clock.advance(Duration.ofHours(1));
        fx.source.put(renamed(c, "Renamed", fx.clock.instant()));

        RebuildStatistics changed = run(RebuildMode.CHANGED_ONLY);

        assertThat(changed.rebuiltCollections()).isEqualTo(1);
        assertThat(fx.reader.getSummary("c02")).hasValueSatisfying(s -> assertThat(s.name()).isEqualTo("Renamed"));
    }

    @Test
    void fullRebuildRemovesEntriesMissingFromTheSource() {
        seed(4);
        run(RebuildMode.FULL);
        fx.source.remove("c01");

        run(RebuildMode.FULL);

        assertThat(fx.reader.getCount(IndexScope.global())).isEqualTo(3);
        assertThat(fx.reader.getSummary("c01")).isEmpty();
    }

    @Test
    void dryRunWritesNothing() {
        seed(4);

        RebuildStatistics stats = fx.orchestrator.rebuild(RebuildMode.CHANGED_ONLY, new RebuildOptions(false, true),
                CancellationSignal.none());

        assertThat(stats.dryRun()).isTrue();
        assertThat(stats.rebuiltCollections()).isEqualTo(4);
        assertThat(fx.reader.getCount(IndexScope.global())).isZero();
        assertThat(fx.reader.getLastRebuildTime()).isEmpty();
    }

    @Test
    void thumbnailsAreCachedUnlessSkipped() {
        fx.source.put(withThumbnailPath(collection("t1", "Thumb", 0), "t1.jpg"));
        fx.thumbnailSource.put("t1", new ThumbnailData(new byte[] {9}, "image/jpeg"));

        RebuildStatistics skipped = fx.orchestrator.rebuild(RebuildMode.FORCE_REBUILD_ALL,
                new RebuildOptions(true, false), CancellationSignal.none());
        assertThat(skipped.cachedThumbnails()).isZero();
        assertThat(fx.reader.getSummary("t1")).hasValueSatisfying(s -> assertThat(s.hasThumbnail()).isFalse());

        RebuildStatistics cached = run(RebuildMode.FORCE_REBUILD_ALL);
        assertThat(cached.cachedThumbnails()).isEqualTo(1);
        assertThat(fx.reader.getSummary("t1")).hasValueSatisfying(s -> assertThat(s.hasThumbnail()).isTrue());
    }

    @Test
    void cancelledRunReturnsPartialStatistics() {
        seed(10);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        RebuildStatistics stats = fx.orchestrator.rebuild(RebuildMode.FULL, RebuildOptions.defaults(), signal);

        assertThat(stats.outcome()).isEqualTo(RebuildOutcome.CANCELLED);
        assertThat(stats.rebuiltCollections()).isLessThan(10);
        assertThat(fx.reader.getLastRebuildTime()).isEmpty();
    }

    @Test
    void unavailableStoreFailsTheRun() {
        FlakyIndexStore flaky = new FlakyIndexStore(new MutableClock(T0));
        IndexFixture fixture = new IndexFixture(flaky);
        fixture.source.put(collection("c1", "A", 0)).put(collection("c2", "B", 1));
        flaky.failNextWrites(100);

        RebuildStatistics stats = fixture.orchestrator.rebuild(RebuildMode.FORCE_REBUILD_ALL,
                RebuildOptions.defaults(), CancellationSignal.none());

        assertThat(stats.outcome()).isEqualTo(RebuildOutcome.FAILED);
        assertThat(stats.failureMessage()).contains("connessione rifiutata");
        assertThat(stats.rebuiltCollections()).isZero();
    }

    @Test
    void sourceFailureMidRunFailsWithPartialStatistics() {
        seed(8);
        fx.source.failAfterPages(1);

        RebuildStatistics stats = run(RebuildMode.FORCE_REBUILD_ALL);

        assertThat(stats.outcome()).isEqualTo(RebuildOutcome.FAILED);
        assertThat(stats.failureMessage()).isEqualTo("Errore lettura pagina del registry");
        assertThat(stats.totalCollections()).isEqualTo(IndexFixture.BATCH_SIZE);
        assertThat(stats.rebuiltCollections()).isEqualTo(IndexFixture.BATCH_SIZE);
        assertThat(fx.reader.getCount(IndexScope.global())).isEqualTo(IndexFixture.BATCH_SIZE);
        assertThat(fx.reader.getLastRebuildTime()).isEmpty();
    }

    @Test
    void sourceFailureDuringVerifyFailsTheRun() {
        seed(4);
        fx.source.failAfterPages(0);

        RebuildStatistics stats = run(RebuildMode.VERIFY);

        assertThat(stats.outcome()).isEqualTo(RebuildOutcome.FAILED);
        assertThat(stats.verify()).isNull();
    }

    @Test
    void successfulRebuildRefreshesDashboard() {
        seed(6);

        run(RebuildMode.FULL);

        assertThat(fx.dashboardCache.get()).hasValueSatisfying(s -> assertThat(s.totalCollections()).isEqualTo(6));
        assertThat(fx.dashboard.recentActivity(5)).extracting(DashboardActivity::type).contains("index_rebuilt");
    }
}
