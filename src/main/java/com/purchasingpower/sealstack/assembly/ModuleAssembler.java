package com.purchasingpower.sealstack.assembly;

import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.routing.LayerSelection;
import com.purchasingpower.sealstack.exception.EmptyModuleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Renders the router's selections into one composed module.
 *
 * <p>Each present layer's body gets its entity placeholders filled in and is
 * emitted under a header naming its seal layer, in ascending layer order, blocks
 * separated by one blank line. Absent layers are skipped in the text and listed
 * in the report.
 *
 * <p>Placeholders:
 * <ul>
 *   <li>{@code {Entity}} - title case, for type names</li>
 *   <li>{@code {entity}} - lower case, for variable names</li>
 *   <li>{@code {ENTITY}} - upper case, for constants</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModuleAssembler {

    private static final java.util.regex.Pattern PLACEHOLDER =
        java.util.regex.Pattern.compile("\\{(entity|Entity|ENTITY)}");

    private final CoherenceValidator coherenceValidator;

    /**
     * Assemble a module.
     *
     * @param selections router output, one entry per layer
     * @param entityName name substituted into placeholders; blank leaves them as-is
     * @return composed text with coherence and completeness report
     * @throws EmptyModuleException when no layer has a selection
     */
    public ModuleResult assemble(List<LayerSelection> selections, String entityName) {
        List<Pattern> present = new ArrayList<>();
        ModuleResult.ModuleResultBuilder result = ModuleResult.builder()
            .selections(selections)
            .entityName(entityName);

        for (LayerSelection selection : selections) {
            if (selection.isPresent()) {
                present.add(selection.getPattern());
            } else {
                result.absentLayer(selection.getLayer());
            }
        }

        if (present.isEmpty()) {
            throw new EmptyModuleException(null, entityName);
        }

        int coherence = coherenceValidator.score(selections);
        double completeness = coherenceValidator.completeness(selections);

        Set<String> dependencies = new TreeSet<>();
        present.forEach(p -> dependencies.addAll(p.getDependencies()));

        String output = render(present, entityName, coherence, completeness, dependencies);

        log.info("Assembled module '{}': {}/7 layers, coherence {}/3", entityName, present.size(), coherence);

        return result
            .coherence(coherence)
            .completeness(completeness)
            .dependencies(dependencies)
            .output(output)
            .build();
    }

    /**
     * Fill entity placeholders in a template body.
     */
    public String substitute(String body, String entityName) {
        if (entityName == null || entityName.isBlank()) {
            return body;
        }
        Matcher matcher = PLACEHOLDER.matcher(body);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(applyCase(matcher.group(1), entityName)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String render(List<Pattern> present, String entityName, int coherence,
                          double completeness, Set<String> dependencies) {
        List<String> blocks = new ArrayList<>();
        String moduleComment = commentPrefix(present.get(0).getLanguage());

        StringBuilder header = new StringBuilder()
            .append(moduleComment).append(" ===== ")
            .append(entityName == null || entityName.isBlank() ? "SEAL STACK" : entityName.toUpperCase(Locale.ROOT))
            .append(" MODULE =====\n")
            .append(moduleComment).append(" Coherence: ").append(coherence).append("/3\n")
            .append(moduleComment).append(" Completeness: ").append(Math.round(completeness * 100))
            .append("% (").append(present.size()).append("/7 seal layers)");
        if (!dependencies.isEmpty()) {
            header.append('\n').append(moduleComment).append(" Dependencies: ").append(String.join(", ", dependencies));
        }
        blocks.add(header.toString());

        for (Pattern pattern : present) {
            String comment = commentPrefix(pattern.getLanguage());
            blocks.add(comment + " ===== SEAL " + pattern.getSealLayer().getNumber() + ": "
                + pattern.getSealLayer().name() + " =====\n"
                + comment + " Pattern: " + pattern.getTitle() + "\n"
                + comment + " Coordinate: " + pattern.getCoordinate() + "\n"
                + substitute(pattern.getBody(), entityName).stripTrailing());
        }

        return String.join("\n\n", blocks) + "\n";
    }

    private static String applyCase(String placeholder, String entityName) {
        return switch (placeholder) {
            case "ENTITY" -> entityName.toUpperCase(Locale.ROOT);
            case "Entity" -> entityName.substring(0, 1).toUpperCase(Locale.ROOT) + entityName.substring(1);
            default -> entityName.toLowerCase(Locale.ROOT);
        };
    }

    static String commentPrefix(String language) {
        return switch (language) {
            case "python", "yaml", "shell", "bash", "dockerfile", "toml" -> "#";
            case "sql" -> "--";
            default -> "//";
        };
    }
}
