package com.purchasingpower.sealstack.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.exception.MalformedCoordinateException;
import com.purchasingpower.sealstack.store.PatternStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pattern table loader")
class PatternTableLoaderTest {

    private final PatternTableLoader loader = new PatternTableLoader(new DefaultResourceLoader(), new ObjectMapper());

    @Test
    @DisplayName("Loads every row of the classpath table")
    void loadsClasspathTable() {
        List<Pattern> patterns = loader.load("classpath:patterns/test-lexicon.json");

        assertThat(patterns).hasSize(4);
        Pattern migration = patterns.get(3);
        assertThat(migration.getCoordinate().toString()).isEqualTo("L6.Q2.DATA.SQL.MIGRATION[C1]");
        assertThat(migration.getLanguage()).isEqualTo("sql");
        assertThat(migration.getDependencies()).isEmpty();
    }

    @Test
    @DisplayName("The shipped table loads into a store covering every seal layer")
    void shippedTableCoversAllLayers() {
        PatternStore store = PatternStore.load(loader.load("classpath:patterns/tech-lexicon.json"));

        assertThat(store.size()).isEqualTo(63);
        assertThat(store.countByLayer().values()).allMatch(count -> count > 0);
    }

    @Test
    @DisplayName("Entity segments become implicit lower-case tags")
    void addsEntitySegmentTags() {
        Pattern pattern = loader.toPattern(PatternRecord.builder()
            .coordinate("L4.Q3.TECH.WEB.MIDDLEWARE.AUTH[C3]")
            .tags(List.of("JWT"))
            .build());

        assertThat(pattern.getTags()).containsExactly("auth", "jwt", "middleware", "web");
    }

    @Test
    @DisplayName("A missing table fails startup")
    void missingTable() {
        assertThatThrownBy(() -> loader.load("classpath:patterns/does-not-exist.json"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("does-not-exist.json");
    }

    @Test
    @DisplayName("A row with a malformed coordinate fails the load")
    void malformedRow() {
        assertThatThrownBy(() -> loader.toPattern(PatternRecord.builder().coordinate("L8.Q1.TECH.X[C3]").build()))
            .isInstanceOf(MalformedCoordinateException.class);
    }
}
