package com.code.quality.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    @Test
    @DisplayName("Should detect languages by extension, ignoring case")
    void testDefaults() {
        LanguageDetector detector = new LanguageDetector();

        assertEquals(Optional.of("python"), detector.detect(Path.of("src/app.py")));
        assertEquals(Optional.of("typescript"), detector.detect(Path.of("View.TSX")));
        assertEquals(Optional.of("javascript"), detector.detect(Path.of("lib.mjs")));
        assertTrue(detector.detect(Path.of("Makefile")).isEmpty());
        assertTrue(detector.detect(Path.of("notes.txt")).isEmpty());
    }

    @Test
    @DisplayName("Should let additional mappings extend and override defaults")
    void testAdditional() {
        LanguageDetector detector = new LanguageDetector(Map.of(".RB", "ruby", ".js", "ecmascript"));

        assertEquals(Optional.of("ruby"), detector.detect(Path.of("a.rb")));
        assertEquals(Optional.of("ecmascript"), detector.detect(Path.of("a.js")));
    }
}
