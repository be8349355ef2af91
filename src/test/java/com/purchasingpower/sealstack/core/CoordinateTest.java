package com.purchasingpower.sealstack.core;

import com.purchasingpower.sealstack.exception.MalformedCoordinateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Coordinate parsing and serialization")
class CoordinateTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "L1.Q1.TECH.PYTHON.FUNCTION.BASIC[C3]",
        "L2.Q3.TECH.PYTHON.CONFIG.DATACLASS[C3]",
        "L7.Q4.AUTH.JWT[C0]",
        "L4.Q2.DATA.sql.Migration_v2[C1]",
        "L3.Q1.TECH.PYTHON.ASYNC:with timeout[C2]"
    })
    @DisplayName("Should serialize back to the exact text it was parsed from")
    void roundTrip(String text) {
        assertThat(Coordinate.parse(text).toString()).isEqualTo(text);
    }

    @Test
    @DisplayName("Should split the address into its fields")
    void parsesFields() {
        Coordinate c = Coordinate.parse("L1.Q1.TECH.PYTHON.FUNCTION.BASIC[C3]");

        assertThat(c.getLayer()).isEqualTo(1);
        assertThat(c.getQuadrant()).isEqualTo(1);
        assertThat(c.getLexicon()).isEqualTo("TECH");
        assertThat(c.getEntity()).isEqualTo("PYTHON.FUNCTION.BASIC");
        assertThat(c.variant()).isEmpty();
        assertThat(c.getCoherenceClass()).isEqualTo(3);
        assertThat(c.sealLayer()).isEqualTo(SealLayer.IDENTITY);
        assertThat(c.entitySegments()).containsExactly("PYTHON", "FUNCTION", "BASIC");
    }

    @Test
    @DisplayName("Should read the variant after the colon")
    void parsesVariant() {
        Coordinate c = Coordinate.parse("L3.Q2.TECH.PYTHON.ASYNC:RETRY[C2]");

        assertThat(c.getEntity()).isEqualTo("PYTHON.ASYNC");
        assertThat(c.variant()).contains("RETRY");
    }

    @Test
    @DisplayName("Should accept lower-case field prefixes and normalize them")
    void prefixesAreCaseInsensitive() {
        Coordinate c = Coordinate.parse("l2.q3.TECH.PYTHON.CONFIG[c1]");

        assertThat(c.toString()).isEqualTo("L2.Q3.TECH.PYTHON.CONFIG[C1]");
        assertThat(c).isEqualTo(Coordinate.parse("L2.Q3.TECH.PYTHON.CONFIG[C1]"));
    }

    @Test
    @DisplayName("Lexicon and entity are case-sensitive")
    void segmentsAreCaseSensitive() {
        assertThat(Coordinate.parse("L1.Q1.TECH.PYTHON[C3]"))
            .isNotEqualTo(Coordinate.parse("L1.Q1.tech.PYTHON[C3]"))
            .isNotEqualTo(Coordinate.parse("L1.Q1.TECH.python[C3]"));
    }

    @Test
    @DisplayName("Equality covers every field")
    void equalityCoversAllFields() {
        Coordinate base = Coordinate.parse("L1.Q1.TECH.PYTHON[C3]");

        assertThat(base).isEqualTo(Coordinate.of(1, 1, "TECH", "PYTHON", 3));
        assertThat(base).hasSameHashCodeAs(Coordinate.of(1, 1, "TECH", "PYTHON", 3));
        assertThat(base).isNotEqualTo(Coordinate.parse("L1.Q1.TECH.PYTHON[C2]"));
        assertThat(base).isNotEqualTo(Coordinate.parse("L1.Q2.TECH.PYTHON[C3]"));
        assertThat(base).isNotEqualTo(Coordinate.parse("L1.Q1.TECH.PYTHON:X[C3]"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "bogus",
        "",
        "L1.Q1.TECH[C3]",
        "L1.Q1.TECH.PYTHON",
        "L1.Q1.TECH.PYTHON[C]",
        "L1.Q1..PYTHON[C3]",
        "L1.Q1.TECH.PYTHON.[C3]",
        "X1.Q1.TECH.PYTHON[C3]",
        "L1.Q1.TECH.PYTHON[C3] ",
        "L10.Q1.TECH.PYTHON[C3]"
    })
    @DisplayName("Should reject text outside the grammar")
    void rejectsMalformedText(String text) {
        assertThatThrownBy(() -> Coordinate.parse(text))
            .isInstanceOf(MalformedCoordinateException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "L0.Q1.TECH.PYTHON[C3]",
        "L8.Q1.TECH.PYTHON[C3]",
        "L1.Q0.TECH.PYTHON[C3]",
        "L1.Q5.TECH.PYTHON[C3]",
        "L1.Q1.TECH.PYTHON[C4]"
    })
    @DisplayName("Should reject out-of-range layer, quadrant or class")
    void rejectsOutOfRangeFields(String text) {
        assertThatThrownBy(() -> Coordinate.parse(text))
            .isInstanceOf(MalformedCoordinateException.class)
            .hasMessageContaining("must be");
    }

    @Test
    @DisplayName("Factory applies the same validation as parse")
    void factoryValidates() {
        assertThatThrownBy(() -> Coordinate.of(9, 1, "TECH", "PYTHON", 3))
            .isInstanceOf(MalformedCoordinateException.class);
        assertThatThrownBy(() -> Coordinate.of(1, 1, "TE.CH", "PYTHON", 3))
            .isInstanceOf(MalformedCoordinateException.class);
        assertThatThrownBy(() -> Coordinate.of(1, 1, "TECH", "PYTHON..X", 3))
            .isInstanceOf(MalformedCoordinateException.class);
    }

    @Test
    @DisplayName("Malformed coordinate keeps the offending text")
    void malformedCarriesText() {
        assertThatThrownBy(() -> Coordinate.parse("bogus"))
            .isInstanceOfSatisfying(MalformedCoordinateException.class,
                e -> assertThat(e.getCoordinateText()).isEqualTo("bogus"));
    }

    @Test
    @DisplayName("Natural order follows the textual form")
    void ordersByText() {
        assertThat(Coordinate.parse("L1.Q1.TECH.A[C3]"))
            .isLessThan(Coordinate.parse("L1.Q1.TECH.B[C3]"));
    }

    @Test
    @DisplayName("Distance is zero for the same address and ignores variant and class")
    void distanceIgnoresVariantAndClass() {
        Coordinate a = Coordinate.parse("L1.Q1.TECH.PYTHON.FUNCTION[C3]");

        assertThat(a.distanceTo(a)).isZero();
        assertThat(a.distanceTo(Coordinate.parse("L1.Q1.TECH.PYTHON.FUNCTION:ASYNC[C0]"))).isZero();
    }

    @Test
    @DisplayName("Each component contributes its weight")
    void distanceComponents() {
        Coordinate base = Coordinate.parse("L1.Q1.TECH.SORT[C3]");

        // Given - far ends of the layer axis
        assertThat(base.distanceTo(Coordinate.parse("L7.Q1.TECH.SORT[C3]"))).isCloseTo(0.3, within(1e-9));
        // quadrants wrap around: Q1 and Q4 are adjacent, Q1 and Q3 opposite
        assertThat(base.distanceTo(Coordinate.parse("L1.Q4.TECH.SORT[C3]"))).isCloseTo(0.15, within(1e-9));
        assertThat(base.distanceTo(Coordinate.parse("L1.Q3.TECH.SORT[C3]"))).isCloseTo(0.3, within(1e-9));
        assertThat(base.distanceTo(Coordinate.parse("L1.Q1.DATA.SORT[C3]"))).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("Entity distance: containment scores 0.3, otherwise normalized edit distance")
    void entityDistance() {
        assertThat(Coordinate.entityDistance("WEB.MIDDLEWARE.AUTH", "WEB.MIDDLEWARE")).isEqualTo(0.3);
        assertThat(Coordinate.entityDistance("ALGORITHM.SORT", "ALGORITHM.PORT")).isCloseTo(1.0 / 14, within(1e-9));
        assertThat(Coordinate.entityDistance("AB", "XY")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Distance combines all components and is symmetric")
    void distanceCombinedAndSymmetric() {
        Coordinate a = Coordinate.parse("L1.Q1.TECH.PYTHON.FUNCTION.BASIC[C3]");
        Coordinate b = Coordinate.parse("L4.Q2.DATA.PYTHON.FUNCTION[C3]");

        assertThat(a.distanceTo(b)).isCloseTo(0.56, within(1e-9));
        assertThat(b.distanceTo(a)).isCloseTo(a.distanceTo(b), within(1e-12));
    }

    @Test
    @DisplayName("Neighbors stay within two layers and the radius, excluding the coordinate itself")
    void neighborsWithinRadius() {
        Coordinate c = Coordinate.parse("L3.Q1.TECH.SORT[C2]");

        assertThat(c.neighbors(0.12)).extracting(Coordinate::toString).containsExactly(
            "L1.Q1.TECH.SORT[C2]",
            "L2.Q1.TECH.SORT[C2]",
            "L4.Q1.TECH.SORT[C2]",
            "L5.Q1.TECH.SORT[C2]");
        assertThat(c.neighbors(0.0)).isEmpty();
    }

    @Test
    @DisplayName("Neighbors near the bottom layer do not leave the 1-7 range")
    void neighborsClampedToLayers() {
        Coordinate c = Coordinate.parse("L1.Q2.TECH.SORT[C3]");

        assertThat(c.neighbors(1.0))
            .hasSize(11)
            .allMatch(n -> n.getLayer() >= 1 && n.getLayer() <= 3);
    }
}
