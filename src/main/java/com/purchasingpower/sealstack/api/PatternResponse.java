package com.purchasingpower.sealstack.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single pattern lookup response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternResponse {

    private boolean success;
    private String error;
    private PatternDto pattern;

    public static PatternResponse success(PatternDto pattern) {
        return PatternResponse.builder()
            .success(true)
            .pattern(pattern)
            .build();
    }
}
