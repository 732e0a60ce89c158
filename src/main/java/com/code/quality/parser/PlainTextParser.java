package com.code.quality.parser;

import com.code.quality.core.model.ParsedFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-agnostic parser: reads the file as UTF-8 and counts lines, plus a rough count of
 * function and class declarations for the languages it recognizes.
 * A file that is not valid UTF-8 fails to parse.
 */
public class PlainTextParser implements ParserAdapter {

    public static final String ATTR_FUNCTIONS = "functions";
    public static final String ATTR_CLASSES = "classes";
    public static final String UNKNOWN_LANGUAGE = "unknown";

    private static final Pattern PYTHON_FUNCTION = Pattern.compile("(?m)^\\s*(?:async\\s+)?def\\s+\\w+");
    private static final Pattern SCRIPT_FUNCTION = Pattern.compile(
            "(?m)\\bfunction\\b\\s*\\*?\\s*\\w*\\s*\\(|^\\s*(?:export\\s+)?(?:const|let|var)\\s+\\w+\\s*=\\s*(?:async\\s*)?\\([^)]*\\)\\s*=>");
    private static final Pattern CLASS = Pattern.compile("(?m)^\\s*(?:export\\s+)?(?:default\\s+)?class\\s+\\w+");

    private final String language;

    public PlainTextParser() {
        this(UNKNOWN_LANGUAGE);
    }

    public PlainTextParser(String language) {
        this.language = language;
    }

    @Override
    public ParsedFile parse(Path file) throws IOException {
        return parse(file, language);
    }

    ParsedFile parse(Path file, String detectedLanguage) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Map<String, Object> attributes = Map.of(
                ATTR_FUNCTIONS, countFunctions(content, detectedLanguage),
                ATTR_CLASSES, count(CLASS, content));
        return new ParsedFile(file.toString(), detectedLanguage, content,
                (int) content.lines().count(), attributes);
    }

    private static int countFunctions(String content, String language) {
        return switch (language) {
            case "python" -> count(PYTHON_FUNCTION, content);
            case "javascript", "typescript" -> count(SCRIPT_FUNCTION, content);
            default -> 0;
        };
    }

    private static int count(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
