package com.purchasingpower.sealstack.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pattern store statistics.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {

    private int totalPatterns;

    @Builder.Default
    private Map<String, Long> patternsByLayer = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> patternsByLexicon = new LinkedHashMap<>();
}
