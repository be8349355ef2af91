package com.purchasingpower.sealstack.core;

import com.purchasingpower.sealstack.exception.MalformedCoordinateException;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structured address of one stored pattern.
 *
 * <p>Textual form: {@code L<layer>.Q<quadrant>.<LEXICON>.<ENTITY>[:<VARIANT>][C<class>]},
 * for example {@code L1.Q1.TECH.PYTHON.FUNCTION.BASIC[C3]}.
 * <ul>
 *   <li>layer - seal layer, 1 to 7</li>
 *   <li>quadrant - sub-bucket within the layer, 1 to 4</li>
 *   <li>lexicon - namespace segment (TECH, DATA, AUTH ...)</li>
 *   <li>entity - dotted path of one or more segments</li>
 *   <li>variant - optional qualifier after a colon</li>
 *   <li>class - authored confidence class, 0 (experimental) to 3 (production-validated)</li>
 * </ul>
 *
 * <p>The {@code L}, {@code Q} and {@code C} prefixes parse case-insensitively and
 * serialize in upper case. Everything else is case-sensitive. {@link #toString()}
 * is the exact inverse of {@link #parse(String)}.
 *
 * @since 1.0.0
 */
@Value
public class Coordinate implements Comparable<Coordinate> {

    public static final int MIN_QUADRANT = 1;
    public static final int MAX_QUADRANT = 4;
    public static final int MIN_CLASS = 0;
    public static final int MAX_CLASS = 3;

    private static final double LAYER_WEIGHT = 0.3;
    private static final double QUADRANT_WEIGHT = 0.3;
    private static final double LEXICON_WEIGHT = 0.2;
    private static final double ENTITY_WEIGHT = 0.2;
    private static final double CONTAINED_ENTITY_DISTANCE = 0.3;
    private static final int NEIGHBOR_LAYER_SPAN = 2;

    private static final String SEGMENT = "[A-Za-z0-9_]+";

    private static final Pattern SEGMENT_PATTERN = Pattern.compile(SEGMENT);

    private static final Pattern GRAMMAR = Pattern.compile(
        "^[Ll](\\d)\\.[Qq](\\d)\\.(" + SEGMENT + ")\\.(" + SEGMENT + "(?:\\." + SEGMENT + ")*)"
            + "(?::([^\\[\\]:]+))?\\[[Cc](\\d)]$");

    int layer;
    int quadrant;
    String lexicon;
    String entity;
    String variant;
    int coherenceClass;

    private Coordinate(int layer, int quadrant, String lexicon, String entity, String variant, int coherenceClass) {
        this.layer = layer;
        this.quadrant = quadrant;
        this.lexicon = lexicon;
        this.entity = entity;
        this.variant = variant;
        this.coherenceClass = coherenceClass;
    }

    /**
     * Parse the textual form.
     *
     * @param text coordinate text
     * @return parsed coordinate
     * @throws MalformedCoordinateException when the text does not match the grammar
     *         or a numeric field is out of range
     */
    public static Coordinate parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedCoordinateException(text, "coordinate text is empty");
        }

        Matcher matcher = GRAMMAR.matcher(text);
        if (!matcher.matches()) {
            throw new MalformedCoordinateException(text,
                "expected L<layer>.Q<quadrant>.<LEXICON>.<ENTITY>[:<VARIANT>][C<class>]");
        }

        return build(text,
            Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2)),
            matcher.group(3),
            matcher.group(4),
            matcher.group(5),
            Integer.parseInt(matcher.group(6)));
    }

    /**
     * Lenient variant of {@link #parse(String)}.
     */
    public static Optional<Coordinate> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (MalformedCoordinateException e) {
            return Optional.empty();
        }
    }

    public static Coordinate of(int layer, int quadrant, String lexicon, String entity, int coherenceClass) {
        return of(layer, quadrant, lexicon, entity, null, coherenceClass);
    }

    public static Coordinate of(int layer, int quadrant, String lexicon, String entity,
                                String variant, int coherenceClass) {
        String text = render(layer, quadrant, lexicon, entity, variant, coherenceClass);
        if (lexicon == null || !SEGMENT_PATTERN.matcher(lexicon).matches()) {
            throw new MalformedCoordinateException(text, "lexicon must be a single [A-Za-z0-9_] segment");
        }
        if (entity == null || Arrays.stream(entity.split("\\.", -1)).anyMatch(s -> !SEGMENT_PATTERN.matcher(s).matches())) {
            throw new MalformedCoordinateException(text, "entity must be a dotted path of [A-Za-z0-9_] segments");
        }
        if (variant != null && (variant.isEmpty() || variant.matches(".*[\\[\\]:].*"))) {
            throw new MalformedCoordinateException(text, "variant must be non-empty and free of ':', '[' and ']'");
        }
        return build(text, layer, quadrant, lexicon, entity, variant, coherenceClass);
    }

    private static Coordinate build(String text, int layer, int quadrant, String lexicon, String entity,
                                    String variant, int coherenceClass) {
        if (SealLayer.find(layer).isEmpty()) {
            throw new MalformedCoordinateException(text, "layer must be 1-7, got " + layer);
        }
        if (quadrant < MIN_QUADRANT || quadrant > MAX_QUADRANT) {
            throw new MalformedCoordinateException(text, "quadrant must be 1-4, got " + quadrant);
        }
        if (coherenceClass < MIN_CLASS || coherenceClass > MAX_CLASS) {
            throw new MalformedCoordinateException(text, "class must be 0-3, got " + coherenceClass);
        }
        return new Coordinate(layer, quadrant, lexicon, entity, variant, coherenceClass);
    }

    private static String render(int layer, int quadrant, String lexicon, String entity,
                                 String variant, int coherenceClass) {
        StringBuilder sb = new StringBuilder()
            .append('L').append(layer)
            .append(".Q").append(quadrant)
            .append('.').append(lexicon)
            .append('.').append(entity);
        if (variant != null) {
            sb.append(':').append(variant);
        }
        return sb.append("[C").append(coherenceClass).append(']').toString();
    }

    /**
     * Semantic distance to another coordinate, 0 (identical address) to 1.
     *
     * <p>Weighted sum of four normalized components:
     * <ul>
     *   <li>layer gap / 6, weight 0.3</li>
     *   <li>circular quadrant gap / 2, weight 0.3</li>
     *   <li>lexicon mismatch, weight 0.2</li>
     *   <li>entity distance, weight 0.2: 0 when equal, 0.3 when one contains
     *       the other, else normalized Levenshtein distance</li>
     * </ul>
     * Variant and class do not contribute.
     */
    public double distanceTo(Coordinate other) {
        double layerDistance = Math.abs(layer - other.layer) / (double) (SealLayer.COUNT - 1);

        int quadrantGap = Math.abs(quadrant - other.quadrant);
        double quadrantDistance = Math.min(quadrantGap, MAX_QUADRANT - quadrantGap) / 2.0;

        double lexiconDistance = lexicon.equals(other.lexicon) ? 0.0 : 1.0;

        return layerDistance * LAYER_WEIGHT
            + quadrantDistance * QUADRANT_WEIGHT
            + lexiconDistance * LEXICON_WEIGHT
            + entityDistance(entity, other.entity) * ENTITY_WEIGHT;
    }

    /**
     * Addresses within {@code radius} of this one that keep its lexicon, entity,
     * variant and class, up to two layers away, in layer then quadrant order.
     * The coordinate itself is excluded.
     */
    public List<Coordinate> neighbors(double radius) {
        List<Coordinate> neighbors = new ArrayList<>();
        for (int l = Math.max(1, layer - NEIGHBOR_LAYER_SPAN); l <= Math.min(SealLayer.COUNT, layer + NEIGHBOR_LAYER_SPAN); l++) {
            for (int q = MIN_QUADRANT; q <= MAX_QUADRANT; q++) {
                Coordinate candidate = new Coordinate(l, q, lexicon, entity, variant, coherenceClass);
                double distance = distanceTo(candidate);
                if (distance > 0 && distance <= radius) {
                    neighbors.add(candidate);
                }
            }
        }
        return neighbors;
    }

    static double entityDistance(String a, String b) {
        if (a.equals(b)) {
            return 0.0;
        }
        if (a.contains(b) || b.contains(a)) {
            return CONTAINED_ENTITY_DISTANCE;
        }
        return (double) levenshtein(a, b) / Math.max(a.length(), b.length());
    }

    private static int levenshtein(String a, String b) {
        int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= b.length(); j++) dp[0][j] = j;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[a.length()][b.length()];
    }

    public SealLayer sealLayer() {
        return SealLayer.of(layer);
    }

    public Optional<String> variant() {
        return Optional.ofNullable(variant);
    }

    /**
     * Entity path split on dots, e.g. {@code [PYTHON, FUNCTION, BASIC]}.
     */
    public List<String> entitySegments() {
        return List.of(entity.split("\\."));
    }

    /**
     * Serialized textual form.
     */
    @Override
    public String toString() {
        return render(layer, quadrant, lexicon, entity, variant, coherenceClass);
    }

    @Override
    public int compareTo(Coordinate other) {
        return toString().compareTo(other.toString());
    }
}
