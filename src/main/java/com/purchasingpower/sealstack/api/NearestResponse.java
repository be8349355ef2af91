package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.store.CoordinateSpace;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stored patterns near a coordinate, nearest first.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NearestResponse {

    private boolean success;
    private String coordinate;
    private int count;

    /** Stored patterns within the requested radius of the coordinate. */
    private int density;

    @Builder.Default
    private List<Neighbor> neighbors = new ArrayList<>();

    public static NearestResponse success(String coordinate, int density, List<CoordinateSpace.Neighbor> neighbors) {
        return NearestResponse.builder()
            .success(true)
            .coordinate(coordinate)
            .count(neighbors.size())
            .density(density)
            .neighbors(neighbors.stream().map(Neighbor::from).collect(Collectors.toList()))
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Neighbor {
        private String coordinate;
        private String title;
        private double distance;

        static Neighbor from(CoordinateSpace.Neighbor neighbor) {
            return Neighbor.builder()
                .coordinate(neighbor.getPattern().getCoordinate().toString())
                .title(neighbor.getPattern().getTitle())
                .distance(neighbor.getDistance())
                .build();
        }
    }
}
