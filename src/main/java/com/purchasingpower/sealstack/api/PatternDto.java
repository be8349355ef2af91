package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Pattern as exposed over the API.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternDto {

    private String coordinate;
    private int layer;
    private String seal;
    private int quadrant;
    private String lexicon;
    private String entity;
    private String variant;
    private int coherenceClass;
    private String title;
    private String body;
    private String language;
    private String tests;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    public static PatternDto from(Pattern pattern) {
        Coordinate c = pattern.getCoordinate();
        return PatternDto.builder()
            .coordinate(c.toString())
            .layer(c.getLayer())
            .seal(c.sealLayer().name())
            .quadrant(c.getQuadrant())
            .lexicon(c.getLexicon())
            .entity(c.getEntity())
            .variant(c.getVariant())
            .coherenceClass(c.getCoherenceClass())
            .title(pattern.getTitle())
            .body(pattern.getBody())
            .language(pattern.getLanguage())
            .tests(pattern.getTests())
            .tags(new ArrayList<>(pattern.getTags()))
            .dependencies(new ArrayList<>(pattern.getDependencies()))
            .build();
    }
}
