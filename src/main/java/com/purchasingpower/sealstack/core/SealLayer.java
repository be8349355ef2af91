package com.purchasingpower.sealstack.core;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * The seven seal layers patterns are bucketed into.
 *
 * <p>Display name and description are response metadata only. Routing and
 * scoring look at the layer number and nothing else.
 *
 * @since 1.0.0
 */
@Getter
public enum SealLayer {

    IDENTITY(1, "Identity", "What is this? The essence of the concept"),
    STRUCTURE(2, "Structure", "What shape does it take? Models and schemas"),
    FUNCTION(3, "Function", "What does it do? Behavior and operations"),
    AUTHORITY(4, "Authority", "Who can access it? Gates, auth and middleware"),
    COMMUNITY(5, "Community", "How does it relate? Relationships and integration"),
    WISDOM(6, "Wisdom", "How does it evolve? Migrations and versioning"),
    FULFILLMENT(7, "Fulfillment", "What is the complete form? Tests and deployment");

    public static final int COUNT = 7;

    private final int number;
    private final String displayName;
    private final String description;

    SealLayer(int number, String displayName, String description) {
        this.number = number;
        this.displayName = displayName;
        this.description = description;
    }

    /**
     * Resolve a layer by its number.
     *
     * @throws IllegalArgumentException when the number is outside 1-7
     */
    public static SealLayer of(int number) {
        return find(number)
            .orElseThrow(() -> new IllegalArgumentException("Seal layer must be 1-7, got " + number));
    }

    public static Optional<SealLayer> find(int number) {
        return Arrays.stream(values())
            .filter(layer -> layer.number == number)
            .findFirst();
    }
}
