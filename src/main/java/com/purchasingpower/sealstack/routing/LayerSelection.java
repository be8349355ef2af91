package com.purchasingpower.sealstack.routing;

import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import lombok.Value;

import java.util.Optional;

/**
 * The router's pick for one seal layer. An absent pattern marks a coverage gap.
 *
 * @since 1.0.0
 */
@Value
public class LayerSelection {

    SealLayer layer;
    Pattern pattern;

    public static LayerSelection of(SealLayer layer, Pattern pattern) {
        return new LayerSelection(layer, pattern);
    }

    public static LayerSelection absent(SealLayer layer) {
        return new LayerSelection(layer, null);
    }

    public boolean isPresent() {
        return pattern != null;
    }

    public Optional<Pattern> pattern() {
        return Optional.ofNullable(pattern);
    }
}
