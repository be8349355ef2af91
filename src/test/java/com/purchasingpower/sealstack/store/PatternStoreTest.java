package com.purchasingpower.sealstack.store;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.exception.DuplicateCoordinateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.sealstack.PatternFixtures.pattern;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pattern store")
class PatternStoreTest {

    private final List<Pattern> patterns = List.of(
        pattern("L1.Q1.TECH.PYTHON.FUNCTION.BASIC[C3]", "function"),
        pattern("L1.Q2.TECH.PYTHON.ENUM[C2]", "enum"),
        pattern("L4.Q3.AUTH.JWT[C3]", "auth", "jwt"));

    @Test
    @DisplayName("Should return the unique pattern stored at each coordinate")
    void lookupFindsEveryLoadedPattern() {
        PatternStore store = PatternStore.load(patterns);

        for (Pattern p : patterns) {
            assertThat(store.get(p.getCoordinate())).containsSame(p);
        }
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should return empty for coordinates not in the table")
    void lookupMissesUnknownCoordinates() {
        PatternStore store = PatternStore.load(patterns);

        assertThat(store.get(Coordinate.parse("L1.Q1.TECH.PYTHON.FUNCTION.BASIC[C2]"))).isEmpty();
        assertThat(store.get(Coordinate.parse("L5.Q1.TECH.NOTHING[C3]"))).isEmpty();
    }

    @Test
    @DisplayName("Should refuse two patterns with the same coordinate")
    void duplicateCoordinateFailsLoad() {
        List<Pattern> withDuplicate = List.of(
            pattern("L2.Q1.TECH.MODEL[C3]", "model"),
            pattern("L2.Q1.TECH.MODEL[C3]", "schema"));

        assertThatThrownBy(() -> PatternStore.load(withDuplicate))
            .isInstanceOfSatisfying(DuplicateCoordinateException.class,
                e -> assertThat(e.getCoordinate()).isEqualTo(Coordinate.parse("L2.Q1.TECH.MODEL[C3]")));
    }

    @Test
    @DisplayName("all() is restartable")
    void allIsRestartable() {
        PatternStore store = PatternStore.load(patterns);

        assertThat(store.all()).hasSize(3);
        assertThat(store.all()).containsExactlyInAnyOrderElementsOf(patterns);
    }

    @Test
    @DisplayName("Should count patterns per layer and lexicon")
    void countsByLayerAndLexicon() {
        PatternStore store = PatternStore.load(patterns);

        assertThat(store.countByLayer())
            .hasSize(7)
            .containsEntry(SealLayer.IDENTITY, 2L)
            .containsEntry(SealLayer.AUTHORITY, 1L)
            .containsEntry(SealLayer.WISDOM, 0L);
        assertThat(store.countByLexicon())
            .containsEntry("TECH", 2L)
            .containsEntry("AUTH", 1L);
    }

    @Test
    @DisplayName("Empty table gives an empty store")
    void emptyStore() {
        PatternStore store = PatternStore.load(List.of());

        assertThat(store.size()).isZero();
        assertThat(store.all()).isEmpty();
    }
}
