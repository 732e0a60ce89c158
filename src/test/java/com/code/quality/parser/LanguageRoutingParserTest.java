package com.code.quality.parser;

import com.code.quality.core.model.ParsedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LanguageRoutingParserTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("Should use the parser registered for the detected language")
        void testRegisteredParser() throws IOException {
            Path file = write("a.py", "x = 1\n");
            LanguageRoutingParser parser = new LanguageRoutingParser()
                    .register("python", path -> ParsedFile.of(path.toString(), "python-custom", ""));

            assertEquals("python-custom", parser.parse(file).language());
        }

        @Test
        @DisplayName("Should fall back to plain text with the detected language")
        void testFallback() throws IOException {
            Path file = write("a.ts", "const a = 1;\n");

            ParsedFile parsed = new LanguageRoutingParser().parse(file);

            assertEquals("typescript", parsed.language());
            assertEquals(file.toString(), parsed.path());
            assertEquals(1, parsed.lineCount());
        }

        @Test
        @DisplayName("Should mark files of unknown type")
        void testUnknownLanguage() throws IOException {
            Path file = write("notes.txt", "hello\nworld\n");

            ParsedFile parsed = new LanguageRoutingParser().parse(file);

            assertEquals(PlainTextParser.UNKNOWN_LANGUAGE, parsed.language());
            assertEquals(2, parsed.lineCount());
        }

        @Test
        @DisplayName("Should fail on content that is not valid UTF-8")
        void testInvalidUtf8() throws IOException {
            Path file = dir.resolve("bad.py");
            Files.write(file, new byte[]{(byte) 0xC3, (byte) 0x28, (byte) 0xFF});

            assertThrows(CharacterCodingException.class, () -> new LanguageRoutingParser().parse(file));
        }
    }

    @Nested
    @DisplayName("Declaration counts")
    class CountTests {

        @Test
        @DisplayName("Should count Python functions and classes")
        void testPythonCounts() throws IOException {
            Path file = write("m.py", """
                    class Service:
                        def run(self):
                            pass

                        async def stop(self):
                            pass

                    def helper():
                        return 1
                    """);

            ParsedFile parsed = new LanguageRoutingParser().parse(file);

            assertEquals(3, parsed.attributes().get(PlainTextParser.ATTR_FUNCTIONS));
            assertEquals(1, parsed.attributes().get(PlainTextParser.ATTR_CLASSES));
        }

        @Test
        @DisplayName("Should count script functions and arrow functions")
        void testScriptCounts() throws IOException {
            Path file = write("m.js", """
                    export class View {}
                    function render(a) { return a; }
                    const handler = async (e) => e;
                    """);

            ParsedFile parsed = new LanguageRoutingParser().parse(file);

            assertEquals(2, parsed.attributes().get(PlainTextParser.ATTR_FUNCTIONS));
            assertEquals(1, parsed.attributes().get(PlainTextParser.ATTR_CLASSES));
        }
    }
}
