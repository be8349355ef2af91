package com.purchasingpower.sealstack.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.sealstack.core.Coordinate;
import com.purchasingpower.sealstack.core.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the versioned JSON pattern table at startup.
 *
 * <p>Each row's tags are lower-cased and extended with the lower-cased segments of
 * its entity path, so {@code L4.Q3.TECH.WEB.MIDDLEWARE.AUTH} is findable by
 * "middleware" or "auth" even when the author listed no tags.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternTableLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    /**
     * Load every pattern from a Spring resource location.
     *
     * @throws IllegalStateException when the table is missing or unreadable
     * @throws com.purchasingpower.sealstack.exception.MalformedCoordinateException for a bad row
     */
    public List<Pattern> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Pattern table not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            List<PatternRecord> records = objectMapper.readValue(in, new TypeReference<List<PatternRecord>>() {});
            List<Pattern> patterns = new ArrayList<>(records.size());
            for (PatternRecord record : records) {
                patterns.add(toPattern(record));
            }
            log.info("Loaded {} patterns from {}", patterns.size(), location);
            return patterns;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pattern table " + location, e);
        }
    }

    Pattern toPattern(PatternRecord record) {
        Coordinate coordinate = Coordinate.parse(record.getCoordinate());

        Set<String> tags = new LinkedHashSet<>();
        if (record.getTags() != null) {
            tags.addAll(record.getTags());
        }
        coordinate.entitySegments().forEach(s -> tags.add(s.toLowerCase(Locale.ROOT)));

        return Pattern.builder()
            .coordinate(coordinate)
            .title(record.getTitle())
            .body(record.getBody())
            .tags(tags)
            .language(record.getLanguage())
            .tests(record.getTests())
            .dependencies(record.getDependencies())
            .build();
    }
}
