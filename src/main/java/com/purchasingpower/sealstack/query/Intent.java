package com.purchasingpower.sealstack.query;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.SealLayer;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Coarse reading of a {@link ModuleRequest}: which layers to route, with which tags.
 *
 * <p>Layers missing from {@link #getLayerTags()} are not routed at all. A layer mapped
 * to an empty tag set is routed with the "every pattern on the layer" fallback.
 * When {@link #getCoordinate()} is set the router skips tag matching and does an
 * exact lookup instead.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Intent {

    /** Entity name for placeholder substitution, empty when nothing was recognised. */
    @Builder.Default
    String entityName = "";

    /** Tags extracted from the request before per-layer expansion. */
    @Singular
    Set<String> globalTags;

    @Singular("layer")
    Map<SealLayer, Set<String>> layerTags;

    Coordinate coordinate;

    public boolean isExactLookup() {
        return coordinate != null;
    }

    public boolean routes(SealLayer layer) {
        return layerTags.containsKey(layer);
    }

    public Set<String> tagsFor(SealLayer layer) {
        return layerTags.getOrDefault(layer, Set.of());
    }
}
