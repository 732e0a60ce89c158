package com.code.quality.api;

import com.code.quality.core.model.IssueCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisOptionsTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should enable caching, incremental and parallel processing by default")
        void testDefaults() {
            AnalysisOptions options = AnalysisOptions.defaults();

            assertTrue(options.isUseCache());
            assertTrue(options.isIncremental());
            assertTrue(options.isParallelProcessing());
            assertEquals(4, options.getMaxWorkers());
            assertEquals(0.7, options.getConfidenceThreshold());
            assertEquals(Duration.ofHours(24), options.getCacheTtl());
            assertEquals(10L * 1024 * 1024, options.getMaxFileSizeBytes());
            assertEquals(0, options.getTaskTimeoutMs());
            assertTrue(options.getIncludePatterns().contains("*.py"));
            assertTrue(options.getExcludePatterns().contains("node_modules/**"));
            assertTrue(options.getCategories().isEmpty());
        }

        @Test
        @DisplayName("Should bypass both caches for a full analysis")
        void testFullAnalysis() {
            AnalysisOptions options = AnalysisOptions.fullAnalysis();

            assertFalse(options.isUseCache());
            assertFalse(options.isIncremental());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should reject out-of-range values")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().maxWorkers(0));
            assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().confidenceThreshold(1.1));
            assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().confidenceThreshold(-0.1));
            assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().maxFileSizeMb(0));
            assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().cacheTtlHours(-1));
            assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().taskTimeoutMs(-1));
            assertThrows(NullPointerException.class, () -> AnalysisOptions.builder().includePatterns(null));
        }

        @Test
        @DisplayName("Should copy every option with toBuilder")
        void testToBuilder() {
            AnalysisOptions options = AnalysisOptions.builder()
                    .includePatterns(List.of("*.ts"))
                    .categories(Set.of(IssueCategory.SECURITY))
                    .maxWorkers(2)
                    .taskTimeoutMs(500)
                    .build();

            AnalysisOptions copy = options.toBuilder().build();
            AnalysisOptions changed = options.toBuilder().useCache(false).build();

            assertEquals(options, copy);
            assertEquals(options.hashCode(), copy.hashCode());
            assertNotEquals(options, changed);
        }

        @Test
        @DisplayName("Should not be affected by later changes to the given collections")
        void testImmutable() {
            List<String> patterns = new ArrayList<>(List.of("*.py"));
            AnalysisOptions options = AnalysisOptions.builder().includePatterns(patterns).build();
            patterns.add("*.js");

            assertEquals(List.of("*.py"), options.getIncludePatterns());
            assertThrows(UnsupportedOperationException.class, () -> options.getCategories().add(IssueCategory.HOTSPOT));
        }
    }

    @Test
    @DisplayName("Should read back what it writes as JSON")
    void testJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        AnalysisOptions options = AnalysisOptions.builder()
                .categories(Set.of(IssueCategory.COMPLEXITY, IssueCategory.SECURITY))
                .parallelProcessing(false)
                .confidenceThreshold(0.5)
                .build();

        String json = mapper.writeValueAsString(options);

        assertFalse(json.contains("cacheTtl\""));
        assertEquals(options, mapper.readValue(json, AnalysisOptions.class));
    }
}
