package com.purchasingpower.sealstack.query;

import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.SealLayer;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Set;

/**
 * What a caller asked for: free text, an explicit coordinate, or one layer with a tag set.
 * Exactly one shape is populated.
 *
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModuleRequest {

    public enum Shape {
        FREE_TEXT,
        COORDINATE,
        LAYER_TAGS
    }

    Shape shape;
    String query;
    Coordinate coordinate;
    SealLayer layer;
    Set<String> tags;

    public static ModuleRequest ofText(String query) {
        return new ModuleRequest(Shape.FREE_TEXT, query != null ? query : "", null, null, Set.of());
    }

    public static ModuleRequest ofCoordinate(Coordinate coordinate) {
        return new ModuleRequest(Shape.COORDINATE, null, coordinate, coordinate.sealLayer(), Set.of());
    }

    public static ModuleRequest ofLayer(SealLayer layer, Set<String> tags) {
        return new ModuleRequest(Shape.LAYER_TAGS, null, null, layer, tags != null ? Set.copyOf(tags) : Set.of());
    }
}
