package com.code.quality.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.MalformedInputException;

import static org.junit.jupiter.api.Assertions.*;

class CodeQualityExceptionTest {

    @Test
    @DisplayName("Should carry its kind and suggestions")
    void testKinds() {
        assertEquals(ErrorKind.RESOURCE, new ResourceException("gone", "directory", null).getKind());
        assertEquals(ErrorKind.PARSING, new ParsingException("bad", "/a.py", null).getKind());
        assertEquals(ErrorKind.ANALYSIS, new AnalysisException("boom", "security").getKind());
        assertEquals(ErrorKind.CACHE, new CacheException("corrupt").getKind());
        assertEquals(ErrorKind.CANCELLED, new AnalysisCancelledException("analysis-1").getKind());
        assertFalse(new ParsingException("bad", "/a.py", null).getSuggestions().isEmpty());
    }

    @Test
    @DisplayName("Should report the root cause as technical details")
    void testTechnicalDetails() {
        IOException root = new MalformedInputException(1);
        ParsingException wrapped = new ParsingException("Failed to parse /a.py", "/a.py",
                new IllegalStateException("decode", root));

        assertTrue(wrapped.getTechnicalDetails().startsWith("MalformedInputException"));
        assertEquals("corrupt", new CacheException("corrupt").getTechnicalDetails());
    }
}
