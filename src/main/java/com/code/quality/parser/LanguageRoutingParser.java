package com.code.quality.parser;

import com.code.quality.core.model.ParsedFile;
import com.code.quality.discovery.LanguageDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches each file to the parser registered for its language and falls back to
 * {@link PlainTextParser} when none is registered.
 */
public class LanguageRoutingParser implements ParserAdapter {
    private static final Logger log = LoggerFactory.getLogger(LanguageRoutingParser.class);

    private final LanguageDetector detector;
    private final PlainTextParser fallback = new PlainTextParser();
    private final Map<String, ParserAdapter> parsers = new ConcurrentHashMap<>();

    public LanguageRoutingParser() {
        this(new LanguageDetector());
    }

    public LanguageRoutingParser(LanguageDetector detector) {
        this.detector = Objects.requireNonNull(detector, "detector is required");
    }

    /**
     * Registers the parser for one language, replacing any previous one.
     */
    public LanguageRoutingParser register(String language, ParserAdapter parser) {
        Objects.requireNonNull(language, "language is required");
        Objects.requireNonNull(parser, "parser is required");
        if (parsers.put(language, parser) != null) {
            log.warn("Replacing parser for language {}", language);
        }
        return this;
    }

    @Override
    public ParsedFile parse(Path file) throws IOException {
        String language = detector.detect(file).orElse(PlainTextParser.UNKNOWN_LANGUAGE);
        ParserAdapter parser = parsers.get(language);
        if (parser == null) {
            return fallback.parse(file, language);
        }
        return parser.parse(file);
    }
}
