package com.purchasingpower.sealstack.store;

import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Secondary index over a {@link PatternStore} snapshot, grouping patterns by
 * seal layer and by tag.
 *
 * <p>Candidate ordering is a strict total order:
 * <ol>
 *   <li>tag overlap with the request, descending</li>
 *   <li>coherence class, descending</li>
 *   <li>coordinate text, ascending</li>
 * </ol>
 *
 * <p>The store never changes after load, so the index is built once and shared.
 *
 * @since 1.0.0
 */
@Slf4j
public class SealLayerIndex {

    /** Class desc, then coordinate text asc. */
    static final Comparator<Pattern> LAYER_ORDER = Comparator
        .comparingInt(Pattern::getCoherenceClass).reversed()
        .thenComparing(Pattern::getCoordinate);

    private final Map<SealLayer, List<Pattern>> byLayer = new EnumMap<>(SealLayer.class);
    private final Map<String, List<Pattern>> byTag = new HashMap<>();

    public SealLayerIndex(PatternStore store) {
        for (SealLayer layer : SealLayer.values()) {
            byLayer.put(layer, new ArrayList<>());
        }
        store.all().forEach(pattern -> {
            byLayer.get(pattern.getSealLayer()).add(pattern);
            for (String tag : pattern.getTags()) {
                byTag.computeIfAbsent(tag, t -> new ArrayList<>()).add(pattern);
            }
        });
        byLayer.replaceAll((layer, patterns) -> sorted(patterns));
        byTag.replaceAll((tag, patterns) -> sorted(patterns));

        log.info("Seal layer index built: {} patterns, {} distinct tags", store.size(), byTag.size());
    }

    /**
     * Patterns on {@code layer} whose tags intersect {@code tags}, best first.
     * With no tags, every pattern on the layer in class-then-coordinate order.
     */
    public List<Pattern> candidates(SealLayer layer, Set<String> tags) {
        List<Pattern> onLayer = byLayer.get(layer);
        if (tags == null || tags.isEmpty()) {
            return onLayer;
        }

        Map<Pattern, Integer> overlaps = new HashMap<>();
        for (Pattern pattern : onLayer) {
            int overlap = pattern.overlap(tags);
            if (overlap > 0) {
                overlaps.put(pattern, overlap);
            }
        }

        return overlaps.keySet().stream()
            .sorted(Comparator.<Pattern>comparingInt(overlaps::get).reversed().thenComparing(LAYER_ORDER))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Every pattern on a layer in class-then-coordinate order.
     */
    public List<Pattern> layer(SealLayer layer) {
        return byLayer.get(layer);
    }

    /**
     * Every pattern carrying {@code tag}, across all layers.
     */
    public List<Pattern> byTag(String tag) {
        return byTag.getOrDefault(tag, List.of());
    }

    private static List<Pattern> sorted(Collection<Pattern> patterns) {
        return patterns.stream().sorted(LAYER_ORDER).collect(Collectors.toUnmodifiableList());
    }
}
