package com.purchasingpower.sealstack.core;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * A stored code template, keyed by its {@link Coordinate}.
 *
 * <p>Tags are normalized to lower case. The body may contain {@code {Entity}},
 * {@code {entity}} or {@code {ENTITY}} placeholders that the assembler fills in.
 *
 * @since 1.0.0
 */
@Value
public class Pattern {

    Coordinate coordinate;
    String title;
    String body;
    Set<String> tags;
    String language;
    String tests;
    List<String> dependencies;

    @Builder(toBuilder = true)
    private Pattern(Coordinate coordinate, String title, String body, Collection<String> tags,
                    String language, String tests, List<String> dependencies) {
        if (coordinate == null) {
            throw new IllegalArgumentException("Pattern coordinate is required");
        }
        this.coordinate = coordinate;
        this.title = title != null ? title : coordinate.getEntity();
        this.body = body != null ? body : "";
        this.tags = normalizeTags(tags);
        this.language = language != null ? language.toLowerCase(Locale.ROOT) : "text";
        this.tests = tests;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public SealLayer getSealLayer() {
        return coordinate.sealLayer();
    }

    public int getCoherenceClass() {
        return coordinate.getCoherenceClass();
    }

    /**
     * Number of the given tags this pattern carries.
     */
    public int overlap(Set<String> other) {
        int count = 0;
        for (String tag : other) {
            if (tags.contains(tag)) {
                count++;
            }
        }
        return count;
    }

    public boolean sharesTagWith(Pattern other) {
        return overlap(other.tags) > 0;
    }

    private static Set<String> normalizeTags(Collection<String> tags) {
        if (tags == null) {
            return Set.of();
        }
        Set<String> normalized = new TreeSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(normalized);
    }
}
