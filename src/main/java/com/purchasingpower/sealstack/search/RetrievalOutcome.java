package com.purchasingpower.sealstack.search;

import com.purchasingpower.sealstack.core.Pattern;
import lombok.Value;

/**
 * Result of one lookup inside a batch: either a pattern or an error message.
 *
 * @since 1.0.0
 */
@Value
public class RetrievalOutcome {

    String coordinate;
    Pattern pattern;
    String error;

    public static RetrievalOutcome found(String coordinate, Pattern pattern) {
        return new RetrievalOutcome(coordinate, pattern, null);
    }

    public static RetrievalOutcome failed(String coordinate, String error) {
        return new RetrievalOutcome(coordinate, null, error);
    }

    public boolean isFound() {
        return pattern != null;
    }
}
