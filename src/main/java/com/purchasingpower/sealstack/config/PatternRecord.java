package com.purchasingpower.sealstack.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of the JSON pattern table, as stored on disk.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternRecord {

    private String coordinate;
    private String title;
    private String body;
    private String language;
    private String tests;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
}
