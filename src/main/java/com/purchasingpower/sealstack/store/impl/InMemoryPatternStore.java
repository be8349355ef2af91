package com.purchasingpower.sealstack.store.impl;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.exception.DuplicateCoordinateException;
import com.purchasingpower.sealstack.store.PatternStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Hash-backed {@link PatternStore}. Built once, read-only afterwards.
 *
 * @since 1.0.0
 */
@Slf4j
public class InMemoryPatternStore implements PatternStore {

    private final Map<Coordinate, Pattern> patterns;

    public InMemoryPatternStore(Collection<Pattern> source) {
        Map<Coordinate, Pattern> byCoordinate = new HashMap<>();
        for (Pattern pattern : source) {
            if (byCoordinate.putIfAbsent(pattern.getCoordinate(), pattern) != null) {
                throw new DuplicateCoordinateException(pattern.getCoordinate());
            }
        }
        this.patterns = Collections.unmodifiableMap(byCoordinate);
        log.debug("Pattern store built with {} patterns", patterns.size());
    }

    @Override
    public Optional<Pattern> get(Coordinate coordinate) {
        return Optional.ofNullable(patterns.get(coordinate));
    }

    @Override
    public Stream<Pattern> all() {
        return patterns.values().stream();
    }

    @Override
    public int size() {
        return patterns.size();
    }

    @Override
    public Map<SealLayer, Long> countByLayer() {
        Map<SealLayer, Long> counts = new EnumMap<>(SealLayer.class);
        for (SealLayer layer : SealLayer.values()) {
            counts.put(layer, 0L);
        }
        patterns.keySet().forEach(c -> counts.merge(c.sealLayer(), 1L, Long::sum));
        return counts;
    }

    @Override
    public Map<String, Long> countByLexicon() {
        Map<String, Long> counts = new TreeMap<>();
        patterns.keySet().forEach(c -> counts.merge(c.getLexicon(), 1L, Long::sum));
        return counts;
    }
}
