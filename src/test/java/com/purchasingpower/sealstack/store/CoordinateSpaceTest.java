package com.purchasingpower.sealstack.store;

import com.purchasingpower.sealstack.core.Coordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.sealstack.PatternFixtures.pattern;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Coordinate space")
class CoordinateSpaceTest {

    private static final String MIDDLEWARE_AUTH = "L4.Q3.TECH.WEB.MIDDLEWARE.AUTH[C3]";

    private final CoordinateSpace space = new CoordinateSpace(PatternStore.load(List.of(
        pattern("L1.Q1.DATA.SQL.MIGRATION[C1]", "migration"),
        pattern("L4.Q1.TECH.WEB.FLASK.APP[C3]", "flask"),
        pattern("L4.Q4.TECH.WEB.CORS[C3]", "cors"),
        pattern(MIDDLEWARE_AUTH, "auth"),
        pattern("L5.Q1.TECH.AUTH.JWT.GENERATE[C3]", "jwt"))));

    @Test
    @DisplayName("Nearest patterns come back closest first")
    void nearestOrderedByDistance() {
        // Given - same address as a stored pattern, but a different variant and class
        Coordinate target = Coordinate.parse("L4.Q3.TECH.WEB.MIDDLEWARE.AUTH:V2[C1]");

        // When
        List<CoordinateSpace.Neighbor> nearest = space.nearest(target, 4);

        // Then
        assertThat(coordinates(nearest)).containsExactly(
            MIDDLEWARE_AUTH,
            "L4.Q4.TECH.WEB.CORS[C3]",
            "L4.Q1.TECH.WEB.FLASK.APP[C3]",
            "L5.Q1.TECH.AUTH.JWT.GENERATE[C3]");
        assertThat(nearest.get(0).getDistance()).isZero();
        assertThat(nearest.get(1).getDistance()).isCloseTo(0.2974, within(1e-4));
    }

    @Test
    @DisplayName("A stored target is not its own neighbour")
    void nearestSkipsTarget() {
        List<CoordinateSpace.Neighbor> nearest = space.nearest(Coordinate.parse(MIDDLEWARE_AUTH), 10);

        assertThat(coordinates(nearest))
            .hasSize(4)
            .doesNotContain(MIDDLEWARE_AUTH)
            .startsWith("L4.Q4.TECH.WEB.CORS[C3]");
    }

    @Test
    @DisplayName("Equal distances fall back to coordinate order")
    void nearestTieBreak() {
        CoordinateSpace tied = new CoordinateSpace(PatternStore.load(List.of(
            pattern("L2.Q1.TECH.Y[C3]"),
            pattern("L2.Q1.TECH.X[C3]"))));

        assertThat(coordinates(tied.nearest(Coordinate.parse("L2.Q1.TECH.Z[C3]"), 2)))
            .containsExactly("L2.Q1.TECH.X[C3]", "L2.Q1.TECH.Y[C3]");
    }

    @Test
    @DisplayName("k must be positive")
    void nearestRejectsNonPositiveK() {
        assertThatThrownBy(() -> space.nearest(Coordinate.parse(MIDDLEWARE_AUTH), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Density counts stored patterns within the radius, the target included")
    void densityWithinRadius() {
        Coordinate target = Coordinate.parse(MIDDLEWARE_AUTH);

        assertThat(space.densityAt(target, 0.0)).isEqualTo(1);
        assertThat(space.densityAt(target, 0.3)).isEqualTo(2);
        assertThat(space.densityAt(target, 0.5)).isEqualTo(3);
        assertThat(space.densityAt(target, 1.0)).isEqualTo(5);
    }

    private static List<String> coordinates(List<CoordinateSpace.Neighbor> neighbors) {
        List<String> result = new ArrayList<>();
        neighbors.forEach(n -> result.add(n.getPattern().getCoordinate().toString()));
        return result;
    }
}
