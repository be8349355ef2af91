package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.assembly.ModuleResult;
import com.purchasingpower.sealstack.routing.LayerSelection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembled module response with its coverage report.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleResponse {

    private boolean success;
    private String error;
    private String query;
    private String entity;
    private int coherence;
    private double completeness;
    private String code;

    @Builder.Default
    private List<Seal> seals = new ArrayList<>();

    @Builder.Default
    private List<String> missingLayers = new ArrayList<>();

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    public static ModuleResponse success(String query, ModuleResult result) {
        return ModuleResponse.builder()
            .success(true)
            .query(query)
            .entity(result.getEntityName())
            .coherence(result.getCoherence())
            .completeness(result.getCompleteness())
            .code(result.getOutput())
            .seals(result.getSelections().stream().map(Seal::from).collect(Collectors.toList()))
            .missingLayers(result.getAbsentLayers().stream().map(Enum::name).collect(Collectors.toList()))
            .dependencies(new ArrayList<>(result.getDependencies()))
            .build();
    }

    public static ModuleResponse error(String error) {
        return ModuleResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Seal {
        private int layer;
        private String seal;
        private String description;
        private boolean present;
        private String coordinate;
        private String title;

        static Seal from(LayerSelection selection) {
            return Seal.builder()
                .layer(selection.getLayer().getNumber())
                .seal(selection.getLayer().name())
                .description(selection.getLayer().getDescription())
                .present(selection.isPresent())
                .coordinate(selection.pattern().map(p -> p.getCoordinate().toString()).orElse(null))
                .title(selection.pattern().map(p -> p.getTitle()).orElse(null))
                .build();
        }
    }
}
