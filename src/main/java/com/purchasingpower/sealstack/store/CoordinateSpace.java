package com.purchasingpower.sealstack.store;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Geometric view of the stored coordinates, using {@link Coordinate#distanceTo}.
 *
 * <p>Answers "what is stored near this address", which exact lookup cannot. The
 * target itself never has to be stored.
 *
 * @since 1.0.0
 */
@Slf4j
public class CoordinateSpace {

    private final List<Pattern> patterns;

    public CoordinateSpace(PatternStore store) {
        this.patterns = store.all()
            .sorted(Comparator.comparing(Pattern::getCoordinate))
            .collect(Collectors.toUnmodifiableList());
        log.debug("Coordinate space built over {} patterns", patterns.size());
    }

    /**
     * Up to {@code k} stored patterns closest to {@code target}, nearest first,
     * ties by coordinate text. A pattern stored at the target itself is skipped.
     */
    public List<Neighbor> nearest(Coordinate target, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }

        List<Neighbor> neighbors = new ArrayList<>();
        for (Pattern pattern : patterns) {
            if (!pattern.getCoordinate().equals(target)) {
                neighbors.add(new Neighbor(pattern, target.distanceTo(pattern.getCoordinate())));
            }
        }
        // stable sort keeps coordinate order for equal distances
        neighbors.sort(Comparator.comparingDouble(Neighbor::getDistance));
        return Collections.unmodifiableList(neighbors.subList(0, Math.min(k, neighbors.size())));
    }

    /**
     * Number of stored patterns within {@code radius} of {@code target}, the target included.
     */
    public int densityAt(Coordinate target, double radius) {
        int count = 0;
        for (Pattern pattern : patterns) {
            if (target.distanceTo(pattern.getCoordinate()) <= radius) {
                count++;
            }
        }
        return count;
    }

    @Value
    public static class Neighbor {
        Pattern pattern;
        double distance;
    }
}
