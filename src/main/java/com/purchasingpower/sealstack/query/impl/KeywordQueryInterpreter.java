package com.purchasingpower.sealstack.query.impl;

import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.query.Intent;
import com.purchasingpower.sealstack.query.ModuleRequest;
import com.purchasingpower.sealstack.query.QueryInterpreter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Keyword heuristic for free-text queries.
 *
 * <p>Free text is split on non-alphanumeric boundaries, lower-cased, and stripped of
 * short tokens and stop words. The survivors are the global tags. The entity is the
 * longest token naming a known noun (singular or plural), otherwise the longest
 * token. When the entity is a known concept, its per-layer vocabulary is added to
 * that layer's tags so e.g. "user" reaches model/schema patterns on STRUCTURE.
 *
 * @since 1.0.0
 */
@Slf4j
public class KeywordQueryInterpreter implements QueryInterpreter {

    static final int MIN_TOKEN_LENGTH = 3;

    private static final Comparator<String> LONGEST_FIRST = Comparator
        .comparingInt(String::length).reversed()
        .thenComparing(Comparator.naturalOrder());

    private final Set<String> entityNouns;
    private final Set<String> stopWords;
    private final Map<String, Map<SealLayer, Set<String>>> concepts;

    public KeywordQueryInterpreter(Collection<String> entityNouns,
                                   Collection<String> stopWords,
                                   Map<String, Map<SealLayer, Set<String>>> concepts) {
        this.entityNouns = lowerCase(entityNouns);
        this.stopWords = lowerCase(stopWords);
        this.concepts = normalizeConcepts(concepts);
    }

    @Override
    public Intent interpret(ModuleRequest request) {
        return switch (request.getShape()) {
            case COORDINATE -> Intent.builder()
                .coordinate(request.getCoordinate())
                .layer(request.getLayer(), Set.of())
                .build();
            case LAYER_TAGS -> Intent.builder()
                .globalTags(lowerCase(request.getTags()))
                .layer(request.getLayer(), lowerCase(request.getTags()))
                .build();
            case FREE_TEXT -> interpretText(request.getQuery());
        };
    }

    private Intent interpretText(String query) {
        Set<String> tokens = tokenize(query);
        String entity = resolveEntity(tokens);
        Map<SealLayer, Set<String>> expansion = concepts.getOrDefault(entity, Map.of());

        Intent.IntentBuilder intent = Intent.builder()
            .entityName(entity)
            .globalTags(tokens);

        for (SealLayer layer : SealLayer.values()) {
            Set<String> tags = new TreeSet<>(tokens);
            if (!entity.isEmpty()) {
                tags.add(entity);
            }
            tags.addAll(expansion.getOrDefault(layer, Set.of()));
            intent.layer(layer, Set.copyOf(tags));
        }

        log.debug("Interpreted '{}' -> entity='{}', tags={}", query, entity, tokens);
        return intent.build();
    }

    Set<String> tokenize(String query) {
        Set<String> tokens = new TreeSet<>();
        if (query == null) {
            return tokens;
        }
        for (String raw : query.split("[^A-Za-z0-9]+")) {
            String token = raw.toLowerCase(Locale.ROOT);
            if (token.length() >= MIN_TOKEN_LENGTH && !stopWords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    String resolveEntity(Set<String> tokens) {
        Optional<String> nounToken = tokens.stream()
            .filter(token -> matchNoun(token).isPresent())
            .min(LONGEST_FIRST);
        if (nounToken.isPresent()) {
            return matchNoun(nounToken.get()).orElseThrow();
        }
        return tokens.stream().min(LONGEST_FIRST).orElse("");
    }

    private Optional<String> matchNoun(String token) {
        if (entityNouns.contains(token)) {
            return Optional.of(token);
        }
        if (token.endsWith("s") && entityNouns.contains(token.substring(0, token.length() - 1))) {
            return Optional.of(token.substring(0, token.length() - 1));
        }
        return Optional.empty();
    }

    private static Set<String> lowerCase(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(v -> v.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(TreeSet::new));
    }

    private static Map<String, Map<SealLayer, Set<String>>> normalizeConcepts(
        Map<String, Map<SealLayer, Set<String>>> concepts) {
        Map<String, Map<SealLayer, Set<String>>> normalized = new HashMap<>();
        if (concepts == null) {
            return normalized;
        }
        concepts.forEach((concept, layers) -> {
            Map<SealLayer, Set<String>> byLayer = new EnumMap<>(SealLayer.class);
            layers.forEach((layer, tags) -> byLayer.put(layer, lowerCase(tags)));
            normalized.put(concept.toLowerCase(Locale.ROOT), byLayer);
        });
        return normalized;
    }
}
