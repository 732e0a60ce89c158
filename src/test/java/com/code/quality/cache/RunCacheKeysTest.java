package com.code.quality.cache;

import com.code.quality.api.AnalysisOptions;
import com.code.quality.core.model.IssueCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RunCacheKeysTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should produce the same key for equal root and options")
    void testDeterministic() {
        AnalysisOptions first = AnalysisOptions.builder()
                .categories(Set.of(IssueCategory.SECURITY, IssueCategory.TESTING))
                .build();
        AnalysisOptions second = AnalysisOptions.builder()
                .categories(Set.of(IssueCategory.TESTING, IssueCategory.SECURITY))
                .build();

        assertEquals(RunCacheKeys.key(dir, first), RunCacheKeys.key(dir, second));
        assertEquals(64, RunCacheKeys.key(dir, first).length());
    }

    @Test
    @DisplayName("Should resolve equivalent spellings of the root to one key")
    void testCanonicalRoot() throws IOException {
        Files.createDirectories(dir.resolve("sub"));
        Path dotted = dir.resolve("sub").resolve("..");

        assertEquals(RunCacheKeys.key(dir, AnalysisOptions.defaults()),
                RunCacheKeys.key(dotted, AnalysisOptions.defaults()));
    }

    @Test
    @DisplayName("Should change the key when any input changes")
    void testDistinctInputs() throws IOException {
        Path other = Files.createDirectories(dir.resolve("other"));
        AnalysisOptions base = AnalysisOptions.defaults();
        String key = RunCacheKeys.key(dir, base);

        assertNotEquals(key, RunCacheKeys.key(other, base));
        assertNotEquals(key, RunCacheKeys.key(dir, base.toBuilder().confidenceThreshold(0.8).build()));
        assertNotEquals(key, RunCacheKeys.key(dir, base.toBuilder().includePatterns(List.of("*.py")).build()));
        assertNotEquals(key, RunCacheKeys.key(dir, base.toBuilder().incremental(false).build()));
        assertNotEquals(key, RunCacheKeys.key(dir, base, "signature"));
    }
}
