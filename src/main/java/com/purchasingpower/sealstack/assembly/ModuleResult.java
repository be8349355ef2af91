package com.purchasingpower.sealstack.assembly;

import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.routing.LayerSelection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Assembled multi-layer module plus its coverage and coherence report.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ModuleResult {

    /** Seven entries, layer 1 first. */
    @Singular
    List<LayerSelection> selections;

    /** Worst pairwise coherence, 0-3. */
    int coherence;

    /** Present layers / 7. */
    double completeness;

    String entityName;

    /** Layers with no selection, ascending. */
    @Singular
    List<SealLayer> absentLayers;

    /** Union of the selected patterns' dependencies. */
    @Singular
    Set<String> dependencies;

    String output;

    public long presentCount() {
        return selections.stream().filter(LayerSelection::isPresent).count();
    }
}
