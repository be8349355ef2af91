package com.purchasingpower.sealstack.store;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.store.impl.InMemoryPatternStore;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only mapping from {@link Coordinate} to {@link Pattern}.
 *
 * <p>Populated once from the pattern table and never mutated afterwards, so
 * any number of requests may read it concurrently.
 *
 * @since 1.0.0
 */
public interface PatternStore {

    /**
     * Build a store from a fixed pattern table.
     *
     * @param patterns every pattern to hold
     * @return immutable store
     * @throws com.purchasingpower.sealstack.exception.DuplicateCoordinateException
     *         when two patterns share a coordinate
     */
    static PatternStore load(Collection<Pattern> patterns) {
        return new InMemoryPatternStore(patterns);
    }

    /**
     * Exact lookup, no fuzzy matching.
     */
    Optional<Pattern> get(Coordinate coordinate);

    /**
     * Every stored pattern. Each call returns a fresh stream.
     */
    Stream<Pattern> all();

    int size();

    Map<SealLayer, Long> countByLayer();

    Map<String, Long> countByLexicon();
}
