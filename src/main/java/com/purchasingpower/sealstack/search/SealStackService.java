package com.purchasingpower.sealstack.search;

import com.purchasingpower.sealstack.assembly.ModuleResult;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.store.CoordinateSpace;

import java.util.List;
import java.util.Map;

/**
 * Entry point to pattern retrieval for callers such as the REST layer.
 *
 * <p>Main operations:
 * <ul>
 *   <li>{@link #retrieve} - exact lookup by coordinate</li>
 *   <li>{@link #search} - list-style search through the seal layer index</li>
 *   <li>{@link #buildModule} - interpret, route, score and assemble</li>
 *   <li>{@link #nearest} - closest stored coordinates by semantic distance</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface SealStackService {

    /**
     * Exact lookup.
     *
     * @param coordinateText coordinate in textual form
     * @return stored pattern
     * @throws com.purchasingpower.sealstack.exception.MalformedCoordinateException if the text does not parse
     * @throws com.purchasingpower.sealstack.exception.PatternNotFoundException if nothing is stored there
     */
    Pattern retrieve(String coordinateText);

    /**
     * Look up several coordinates, reporting a per-item outcome instead of failing the batch.
     */
    List<RetrievalOutcome> retrieveAll(List<String> coordinateTexts);

    /**
     * Search patterns matching a free-text query.
     *
     * @param query free text
     * @param layer only this layer, or null for all seven
     * @param lexicon only this lexicon, or null for any
     * @return matches, layer 1 first, best first within a layer
     */
    List<Pattern> search(String query, SealLayer layer, String lexicon);

    /**
     * Build a coherent multi-layer module for a free-text query.
     *
     * @throws com.purchasingpower.sealstack.exception.EmptyModuleException when no layer yields a pattern
     */
    ModuleResult buildModule(String query);

    /**
     * Stored patterns closest to a coordinate, which need not be stored itself.
     *
     * @param coordinateText coordinate in textual form
     * @param k maximum number of neighbours, at least 1
     * @return nearest first
     * @throws com.purchasingpower.sealstack.exception.MalformedCoordinateException if the text does not parse
     */
    List<CoordinateSpace.Neighbor> nearest(String coordinateText, int k);

    /**
     * Number of stored patterns within {@code radius} of a coordinate.
     */
    int density(String coordinateText, double radius);

    StoreStats stats();

    /**
     * Pattern counts for monitoring.
     */
    interface StoreStats {
        int getTotalPatterns();
        Map<SealLayer, Long> getPatternsByLayer();
        Map<String, Long> getPatternsByLexicon();
    }
}
