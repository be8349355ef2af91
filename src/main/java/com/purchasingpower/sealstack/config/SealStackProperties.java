package com.purchasingpower.sealstack.config;

import com.purchasingpower.sealstack.core.SealLayer;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for pattern loading and query interpretation.
 *
 * <p>Properties are loaded from the {@code app.seal-stack} namespace in
 * application.yml. Example configuration:
 * <pre>
 * app:
 *   seal-stack:
 *     pattern-table: classpath:patterns/tech-lexicon.json
 *     max-search-results: 50
 *     entity-nouns: [user, order, product]
 *     stop-words: [the, and, with]
 *     concepts:
 *       user:
 *         structure: [model, schema, dataclass]
 *         authority: [auth, jwt, permission]
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.seal-stack")
public class SealStackProperties {

    /**
     * Spring resource location of the JSON pattern table read at startup.
     */
    @NotBlank(message = "Pattern table location is required")
    private String patternTable = "classpath:patterns/tech-lexicon.json";

    /**
     * Upper bound on patterns returned by a single search.
     */
    @Min(1)
    private int maxSearchResults = 50;

    /**
     * Known nouns preferred as the entity name of a free-text query.
     * When empty the longest remaining token is used.
     */
    private List<String> entityNouns = new ArrayList<>();

    /**
     * Tokens dropped from free-text queries before tag matching.
     */
    private List<String> stopWords = new ArrayList<>();

    /**
     * Per-concept vocabulary added to each seal layer's tags when the query's
     * entity names that concept.
     */
    private Map<String, Map<SealLayer, List<String>>> concepts = new LinkedHashMap<>();
}
