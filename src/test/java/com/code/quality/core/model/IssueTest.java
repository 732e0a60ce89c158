package com.code.quality.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IssueTest {

    @Test
    @DisplayName("Should reject confidence outside [0, 1]")
    void testConfidence() {
        CodeLocation location = CodeLocation.of("/a.py", 1);

        assertThrows(IllegalArgumentException.class,
                () -> new Issue("i", IssueCategory.SECURITY, Severity.LOW, "t", "d", location, "", 1.01));
        assertThrows(IllegalArgumentException.class,
                () -> new Issue("i", IssueCategory.SECURITY, Severity.LOW, "t", "d", location, "", -0.01));
    }

    @Test
    @DisplayName("Should default missing text fields to empty")
    void testDefaults() {
        Issue issue = new Issue("i", IssueCategory.SECURITY, Severity.LOW, null, null,
                CodeLocation.of("/a.py", 3), null, 0.5);

        assertEquals("", issue.title());
        assertEquals("", issue.suggestion());
        assertEquals("/a.py", issue.filePath());
    }

    @Test
    @DisplayName("Should reject an inverted line range")
    void testLocation() {
        assertThrows(IllegalArgumentException.class, () -> new CodeLocation("/a.py", 5, 4));
        assertEquals("/a.py:2-2", CodeLocation.of("/a.py", 2).toString());
    }

    @Test
    @DisplayName("Should count lines of parsed content")
    void testParsedFileOf() {
        ParsedFile parsed = ParsedFile.of("/a.py", "python", "a\nb\nc");

        assertEquals(3, parsed.lineCount());
        assertTrue(parsed.attributes().isEmpty());
    }
}
