package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.search.RetrievalOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Batch lookup response. One item per requested coordinate, in request order.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRetrieveResponse {

    private boolean success;
    private String error;
    private int count;

    @Builder.Default
    private List<Item> results = new ArrayList<>();

    public static BatchRetrieveResponse success(List<RetrievalOutcome> outcomes) {
        return BatchRetrieveResponse.builder()
            .success(true)
            .count(outcomes.size())
            .results(outcomes.stream().map(Item::from).collect(Collectors.toList()))
            .build();
    }

    public static BatchRetrieveResponse error(String error) {
        return BatchRetrieveResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String coordinate;
        private boolean found;
        private PatternDto pattern;
        private String error;

        static Item from(RetrievalOutcome outcome) {
            return Item.builder()
                .coordinate(outcome.getCoordinate())
                .found(outcome.isFound())
                .pattern(outcome.isFound() ? PatternDto.from(outcome.getPattern()) : null)
                .error(outcome.getError())
                .build();
        }
    }
}
