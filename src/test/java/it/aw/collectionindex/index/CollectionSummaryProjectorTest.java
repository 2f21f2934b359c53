package it.aw.collectionindex.index;

import it.aw.collectionindex.model.Collection;
import it.aw.collectionindex.model.CollectionIndexState;
import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.CollectionType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static it.aw.collectionindex.support.TestCollections.T0;
import static it.aw.collectionindex.support.TestCollections.collection;
import static it.aw.collectionindex.support.TestCollections.withThumbnailPath;
import static org.assertj.core.api.Assertions.assertThat;

class CollectionSummaryProjectorTest {

    @Test
    void projectsAllFields() {
        Collection c = new Collection("c1", "lib", "Vacanze", "estate", "/media/vacanze", CollectionType.ZIP,
                List.of("mare", "2024"), 120, 110, 5, 4_096, "img-1", "thumbs/c1.webp", T0, T0.plusSeconds(60));

        CollectionSummary s = CollectionSummaryProjector.project(c);

        assertThat(s.id()).isEqualTo("c1");
        assertThat(s.name()).isEqualTo("Vacanze");
        assertThat(s.firstImageThumbnailUrl()).isEqualTo("/api/collections/c1/thumbnail");
        assertThat(s.imageCount()).isEqualTo(120);
        assertThat(s.thumbnailCount()).isEqualTo(110);
        assertThat(s.cacheCount()).isEqualTo(5);
        assertThat(s.totalSize()).isEqualTo(4_096);
        assertThat(s.type()).isEqualTo(CollectionType.ZIP);
        assertThat(s.tags()).containsExactly("mare", "2024");
        assertThat(s.updatedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(s.hasThumbnail()).isFalse();
    }

    @Test
    void missingOptionalsGetDefaults() {
        Collection c = new Collection("c2", null, null, null, null, null, null,
                -1, 0, 0, -5, null, null, null, null);

        CollectionSummary s = CollectionSummaryProjector.project(c);

        assertThat(s.name()).isEmpty();
        assertThat(s.path()).isEmpty();
        assertThat(s.tags()).isEmpty();
        assertThat(s.type()).isEqualTo(CollectionType.FOLDER);
        assertThat(s.firstImageThumbnailUrl()).isNull();
        assertThat(s.imageCount()).isZero();
        assertThat(s.totalSize()).isZero();
        assertThat(s.createdAt()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void projectionIsDeterministic() {
        Collection c = collection("c3", "Same", 10);
        assertThat(CollectionSummaryProjector.project(c)).isEqualTo(CollectionSummaryProjector.project(c));
    }

    @Test
    void indexedAtIsNeverBeforeUpdatedAt() {
        Collection c = withThumbnailPath(collection("c4", "Future", 10_000), "t.jpg");
        CollectionSummary s = CollectionSummaryProjector.project(c).withThumbnail("data:image/jpeg;base64,AA==");

        CollectionIndexState lagging = CollectionSummaryProjector.stateFor(c, s, T0);
        CollectionIndexState current = CollectionSummaryProjector.stateFor(c, s, T0.plusSeconds(60));

        assertThat(lagging.indexedAt()).isEqualTo(c.updatedAt());
        assertThat(lagging.isFreshFor(c)).isTrue();
        assertThat(current.indexedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(current.hasFirstThumbnail()).isTrue();
        assertThat(current.indexVersion()).isEqualTo(CollectionIndexState.CURRENT_VERSION);
    }
}
