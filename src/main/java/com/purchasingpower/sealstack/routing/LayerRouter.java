package com.purchasingpower.sealstack.routing;

import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.query.Intent;
import com.purchasingpower.sealstack.store.PatternStore;
import com.purchasingpower.sealstack.store.SealLayerIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Walks the seven seal layers in ascending order and picks the best candidate on each.
 *
 * <p>A layer with no candidate becomes an absent selection; the request as a whole
 * never fails for lack of coverage. Because candidate ordering is a strict total
 * order, the same intent always routes to the same selections.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LayerRouter {

    private final PatternStore patternStore;
    private final SealLayerIndex sealLayerIndex;

    /**
     * Route an intent.
     *
     * @param intent interpreted request
     * @return exactly seven selections, layer 1 first
     */
    public List<LayerSelection> route(Intent intent) {
        List<LayerSelection> selections = new ArrayList<>(SealLayer.COUNT);

        for (SealLayer layer : SealLayer.values()) {
            if (!intent.routes(layer)) {
                selections.add(LayerSelection.absent(layer));
                continue;
            }

            LayerSelection selection = intent.isExactLookup()
                ? patternStore.get(intent.getCoordinate())
                    .map(p -> LayerSelection.of(layer, p))
                    .orElseGet(() -> LayerSelection.absent(layer))
                : pickFirst(layer, sealLayerIndex.candidates(layer, intent.tagsFor(layer)));

            log.debug("Seal {} ({}) -> {}", layer.getNumber(), layer.name(),
                selection.pattern().map(p -> p.getCoordinate().toString()).orElse("<absent>"));
            selections.add(selection);
        }

        return Collections.unmodifiableList(selections);
    }

    private LayerSelection pickFirst(SealLayer layer, List<Pattern> candidates) {
        return candidates.isEmpty()
            ? LayerSelection.absent(layer)
            : LayerSelection.of(layer, candidates.get(0));
    }
}
