package com.purchasingpower.sealstack.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Search response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private boolean success;
    private String error;
    private String query;
    private int count;

    @Builder.Default
    private List<PatternDto> results = new ArrayList<>();

    public static SearchResponse success(String query, List<PatternDto> results) {
        return SearchResponse.builder()
            .success(true)
            .query(query)
            .count(results.size())
            .results(results)
            .build();
    }

    public static SearchResponse error(String error) {
        return SearchResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
