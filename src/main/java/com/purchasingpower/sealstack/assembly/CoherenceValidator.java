package com.purchasingpower.sealstack.assembly;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.routing.LayerSelection;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Scores how well the patterns picked across layers fit together.
 *
 * <p>The module score is the worst pairwise score, not the average: one badly
 * mismatched pair drags the whole module down. A pair scores the lower of the two
 * authored classes, minus one point when the two patterns share no tag.
 *
 * @since 1.0.0
 */
@Component
public class CoherenceValidator {

    /**
     * Worst pairwise compatibility over present selections, 0-3.
     * Fewer than two present layers leaves nothing to contradict and scores 3.
     */
    public int score(List<LayerSelection> selections) {
        List<Pattern> present = selections.stream()
            .map(LayerSelection::pattern)
            .flatMap(Optional::stream)
            .toList();

        int score = Coordinate.MAX_CLASS;
        for (int i = 0; i < present.size(); i++) {
            for (int j = i + 1; j < present.size(); j++) {
                score = Math.min(score, compatibility(present.get(i), present.get(j)));
            }
        }
        return clamp(score);
    }

    /**
     * Pairwise compatibility of two selected patterns.
     */
    public int compatibility(Pattern lower, Pattern higher) {
        int base = Math.min(lower.getCoherenceClass(), higher.getCoherenceClass());
        return lower.sharesTagWith(higher) ? base : Math.max(0, base - 1);
    }

    /**
     * Fraction of the seven layers holding a selection.
     */
    public double completeness(List<LayerSelection> selections) {
        long present = selections.stream().filter(LayerSelection::isPresent).count();
        return (double) present / SealLayer.COUNT;
    }

    private static int clamp(int score) {
        return Math.max(Coordinate.MIN_CLASS, Math.min(Coordinate.MAX_CLASS, score));
    }
}
