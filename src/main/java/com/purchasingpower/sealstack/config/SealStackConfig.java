package com.purchasingpower.sealstack.config;

import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.query.QueryInterpreter;
import com.purchasingpower.sealstack.query.impl.KeywordQueryInterpreter;
import com.purchasingpower.sealstack.store.CoordinateSpace;
import com.purchasingpower.sealstack.store.PatternStore;
import com.purchasingpower.sealstack.store.SealLayerIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the shared read-only pattern store, its index, the coordinate space and
 * the query interpreter.
 *
 * <p>All of them are singletons created once at startup and handed to request paths
 * by injection.
 *
 * @since 1.0.0
 */
@Slf4j
@Configuration
public class SealStackConfig {

    @Bean
    public PatternStore patternStore(PatternTableLoader loader, SealStackProperties properties) {
        PatternStore store = PatternStore.load(loader.load(properties.getPatternTable()));
        log.info("Pattern store ready: {} patterns, by layer {}", store.size(), store.countByLayer());
        return store;
    }

    @Bean
    public SealLayerIndex sealLayerIndex(PatternStore patternStore) {
        return new SealLayerIndex(patternStore);
    }

    @Bean
    public CoordinateSpace coordinateSpace(PatternStore patternStore) {
        return new CoordinateSpace(patternStore);
    }

    @Bean
    public QueryInterpreter queryInterpreter(SealStackProperties properties) {
        if (properties.getEntityNouns().isEmpty()) {
            log.warn("No entity nouns configured, falling back to longest-token entity detection");
        }

        Map<String, Map<SealLayer, Set<String>>> concepts = new HashMap<>();
        properties.getConcepts().forEach((concept, layers) -> {
            Map<SealLayer, Set<String>> byLayer = new EnumMap<>(SealLayer.class);
            layers.forEach((layer, tags) -> byLayer.put(layer, Set.copyOf(tags)));
            concepts.put(concept, byLayer);
        });

        return new KeywordQueryInterpreter(properties.getEntityNouns(), properties.getStopWords(), concepts);
    }
}
