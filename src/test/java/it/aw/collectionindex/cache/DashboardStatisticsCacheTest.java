package it.aw.collectionindex.cache;

import it.aw.collectionindex.model.CollectionType;
import it.aw.collectionindex.model.DashboardActivity;
import it.aw.collectionindex.model.DashboardDelta;
import it.aw.collectionindex.model.DashboardStatistics;
import it.aw.collectionindex.support.IndexFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DashboardStatisticsCacheTest {

    private final IndexFixture fx = new IndexFixture();
    private final DashboardStatisticsCache cache = fx.dashboardCache;

    private DashboardStatistics stats(long collections, long images) {
        return DashboardStatistics.of(collections, images, images, 0, images * 100,
                Map.of(CollectionType.FOLDER, collections), fx.clock.instant(), fx.clock.instant());
    }

    @Test
    void freshnessFollowsComputedAt() {
        cache.store(stats(2, 10));
        DashboardStatistics stored = cache.get().orElseThrow();
        assertThat(cache.isFresh(stored)).isTrue();

        fx.clock.advance(Duration.ofSeconds(61));
        assertThat(cache.isFresh(stored)).isFalse();

        fx.clock.advance(Duration.ofMinutes(5));
        assertThat(cache.get()).isEmpty();
    }

    @Test
    void deltaPatchesTotalsButNotFreshness() {
        cache.store(stats(2, 10));
        Instant computedAt = fx.clock.instant();
        fx.clock.advance(Duration.ofSeconds(30));

        DashboardStatistics patched = cache.applyDelta(
                new DashboardDelta(1, 5, 5, 0, 500, Map.of(CollectionType.ZIP, 1L))).orElseThrow();

        assertThat(patched.totalCollections()).isEqualTo(3);
        assertThat(patched.totalImages()).isEqualTo(15);
        assertThat(patched.averageImagesPerCollection()).isEqualTo(5.0);
        assertThat(patched.collectionsByType()).containsEntry(CollectionType.ZIP, 1L);
        assertThat(patched.computedAt()).isEqualTo(computedAt);
        assertThat(patched.patchedAt()).isEqualTo(fx.clock.instant());
    }

    @Test
    void deltaWithoutCachedStatisticsIsIgnored() {
        assertThat(cache.applyDelta(new DashboardDelta(1, 1, 1, 1, 1, Map.of()))).isEmpty();
        assertThat(cache.get()).isEmpty();
    }

    @Test
    void activityIsBoundedAndNewestFirst() {
        for (int i = 0; i < DashboardStatisticsCache.MAX_ACTIVITY + 5; i++) {
            cache.recordActivity(new DashboardActivity("collection_created", "n" + i, "c" + i, "n" + i,
                    fx.clock.instant()));
        }

        List<DashboardActivity> recent = cache.recentActivity(1_000);

        assertThat(recent).hasSize(DashboardStatisticsCache.MAX_ACTIVITY);
        assertThat(recent.get(0).collectionId()).isEqualTo("c104");
        assertThat(cache.recentActivity(3)).extracting(DashboardActivity::collectionId)
                .containsExactly("c104", "c103", "c102");
    }
}
