package it.aw.collectionindex.index;

import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import static it.aw.collectionindex.support.TestCollections.collection;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreCodecTest {

    private static CollectionSummary summary(String id, String name, long updatedOffsetMs) {
        return CollectionSummaryProjector.project(collection(id, name, updatedOffsetMs));
    }

    @Test
    void numericDescendingNegatesScore() {
        CollectionSummary s = summary("a", "Alpha", 500);

        IndexEntry asc = ScoreCodec.entryFor(s, SortField.UPDATED_AT, SortDirection.ASC);
        IndexEntry desc = ScoreCodec.entryFor(s, SortField.UPDATED_AT, SortDirection.DESC);

        assertThat(asc.member()).isEqualTo("a");
        assertThat(asc.score()).isEqualTo((double) s.updatedAt().toEpochMilli());
        assertThat(desc.score()).isEqualTo(-asc.score());
    }

    @Test
    void nameHasNoNumericScore() {
        assertThatThrownBy(() -> ScoreCodec.numericScore(summary("a", "x", 0), SortField.NAME))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nameKeyPreservesCaseInsensitiveOrderInBothDirections() {
        List<String> names = List.of("", "a", "A", "ab", "abc", "abd", "b", "Zeta", "zz", "ä", "日本", "1999", "a b");
        List<String> byName = new ArrayList<>(names);
        byName.sort(Comparator.comparing((String n) -> n.toLowerCase(Locale.ROOT)));

        for (int i = 0; i + 1 < byName.size(); i++) {
            String lower = byName.get(i).toLowerCase(Locale.ROOT);
            String higher = byName.get(i + 1).toLowerCase(Locale.ROOT);
            if (lower.equals(higher)) {
                continue;
            }
            assertThat(ScoreCodec.nameKey(lower, SortDirection.ASC))
                    .isLessThan(ScoreCodec.nameKey(higher, SortDirection.ASC));
            assertThat(ScoreCodec.nameKey(lower, SortDirection.DESC))
                    .isGreaterThan(ScoreCodec.nameKey(higher, SortDirection.DESC));
        }
    }

    @Test
    void prefixSortsBeforeLongerNameAscendingAndAfterDescending() {
        String abAsc = ScoreCodec.nameMember("ab", "zzz", SortDirection.ASC);
        String abcAsc = ScoreCodec.nameMember("abc", "000", SortDirection.ASC);
        String abDesc = ScoreCodec.nameMember("ab", "000", SortDirection.DESC);
        String abcDesc = ScoreCodec.nameMember("abc", "zzz", SortDirection.DESC);

        assertThat(abAsc).isLessThan(abcAsc);
        assertThat(abcDesc).isLessThan(abDesc);
    }

    @Test
    void equalNamesAreOrderedById() {
        assertThat(ScoreCodec.nameMember("Same", "id-1", SortDirection.ASC))
                .isLessThan(ScoreCodec.nameMember("same", "id-2", SortDirection.ASC));
        assertThat(ScoreCodec.nameMember("Same", "id-1", SortDirection.DESC))
                .isLessThan(ScoreCodec.nameMember("same", "id-2", SortDirection.DESC));
    }

    @Test
    void idIsRecoveredFromEveryMember() {
        CollectionSummary s = summary("col~with!chars", "Name", 0);
        for (SortField field : SortField.values()) {
            for (SortDirection direction : SortDirection.values()) {
                IndexEntry entry = ScoreCodec.entryFor(s, field, direction);
                assertThat(ScoreCodec.idOf(entry.member(), field)).isEqualTo("col~with!chars");
            }
        }
    }
}
