package com.purchasingpower.sealstack.search.impl;

import com.purchasingpower.sealstack.assembly.ModuleAssembler;
import com.purchasingpower.sealstack.assembly.ModuleResult;
import com.purchasingpower.sealstack.config.SealStackProperties;
import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.exception.EmptyModuleException;
import com.purchasingpower.sealstack.exception.MalformedCoordinateException;
import com.purchasingpower.sealstack.exception.PatternNotFoundException;
import com.purchasingpower.sealstack.query.Intent;
import com.purchasingpower.sealstack.query.ModuleRequest;
import com.purchasingpower.sealstack.query.QueryInterpreter;
import com.purchasingpower.sealstack.routing.LayerRouter;
import com.purchasingpower.sealstack.routing.LayerSelection;
import com.purchasingpower.sealstack.search.RetrievalOutcome;
import com.purchasingpower.sealstack.search.SealStackService;
import com.purchasingpower.sealstack.store.CoordinateSpace;
import com.purchasingpower.sealstack.store.PatternStore;
import com.purchasingpower.sealstack.store.SealLayerIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of SealStackService.
 *
 * Wires interpretation, routing, scoring and assembly over the shared
 * read-only pattern store and index.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SealStackServiceImpl implements SealStackService {

    private final PatternStore patternStore;
    private final SealLayerIndex sealLayerIndex;
    private final CoordinateSpace coordinateSpace;
    private final QueryInterpreter queryInterpreter;
    private final LayerRouter layerRouter;
    private final ModuleAssembler moduleAssembler;
    private final SealStackProperties properties;

    @Override
    public Pattern retrieve(String coordinateText) {
        log.info("Retrieving pattern at {}", coordinateText);

        Coordinate coordinate = Coordinate.parse(coordinateText);
        return patternStore.get(coordinate)
            .orElseThrow(() -> new PatternNotFoundException(coordinate));
    }

    @Override
    public List<RetrievalOutcome> retrieveAll(List<String> coordinateTexts) {
        log.info("Batch retrieval of {} coordinates", coordinateTexts.size());

        List<RetrievalOutcome> outcomes = new ArrayList<>();
        for (String text : coordinateTexts) {
            try {
                outcomes.add(RetrievalOutcome.found(text, retrieve(text)));
            } catch (MalformedCoordinateException | PatternNotFoundException e) {
                log.warn("Batch item {} failed: {}", text, e.getMessage());
                outcomes.add(RetrievalOutcome.failed(text, e.getMessage()));
            }
        }
        return outcomes;
    }

    @Override
    public List<Pattern> search(String query, SealLayer layer, String lexicon) {
        log.info("Searching patterns: query='{}', layer={}, lexicon={}", query, layer, lexicon);

        Intent intent = queryInterpreter.interpret(ModuleRequest.ofText(query));
        List<SealLayer> layers = layer != null ? List.of(layer) : List.of(SealLayer.values());

        List<Pattern> results = new ArrayList<>();
        for (SealLayer sealLayer : layers) {
            for (Pattern pattern : sealLayerIndex.candidates(sealLayer, intent.tagsFor(sealLayer))) {
                if (results.size() >= properties.getMaxSearchResults()) {
                    return results;
                }
                if (lexicon == null || lexicon.isBlank()
                    || pattern.getCoordinate().getLexicon().equalsIgnoreCase(lexicon)) {
                    results.add(pattern);
                }
            }
        }

        log.debug("Search '{}' matched {} patterns", query, results.size());
        return results;
    }

    @Override
    public ModuleResult buildModule(String query) {
        log.info("Building module for: {}", query);

        Intent intent = queryInterpreter.interpret(ModuleRequest.ofText(query));
        List<LayerSelection> selections = layerRouter.route(intent);
        try {
            return moduleAssembler.assemble(selections, intent.getEntityName());
        } catch (EmptyModuleException e) {
            throw new EmptyModuleException(query, e.getEntityName());
        }
    }

    @Override
    public List<CoordinateSpace.Neighbor> nearest(String coordinateText, int k) {
        log.info("Finding {} nearest patterns to {}", k, coordinateText);

        return coordinateSpace.nearest(Coordinate.parse(coordinateText), Math.min(k, properties.getMaxSearchResults()));
    }

    @Override
    public int density(String coordinateText, double radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must not be negative, got " + radius);
        }
        return coordinateSpace.densityAt(Coordinate.parse(coordinateText), radius);
    }

    @Override
    public StoreStats stats() {
        return new DefaultStoreStats(
            patternStore.size(),
            patternStore.countByLayer(),
            patternStore.countByLexicon());
    }
}
