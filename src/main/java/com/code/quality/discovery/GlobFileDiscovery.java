package com.code.quality.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the filesystem and filters files with glob patterns.
 *
 * <p>A pattern without a slash matches the file or directory name ({@code *.py},
 * {@code __pycache__}). A pattern with a slash or {@code **} matches the path relative to the
 * root, at any depth ({@code node_modules/**} excludes every {@code node_modules} tree).
 * Directories matched by an exclude pattern are not descended into. Exclusion wins over
 * inclusion.</p>
 */
public class GlobFileDiscovery implements FileDiscovery {
    private static final Logger log = LoggerFactory.getLogger(GlobFileDiscovery.class);

    @Override
    public List<Path> discover(Path root, List<String> includePatterns, List<String> excludePatterns,
                               long maxFileSizeBytes) throws IOException {
        Path start = root.toAbsolutePath().normalize();
        if (!Files.exists(start)) {
            throw new NoSuchFileException(start.toString(), null, "Path does not exist");
        }
        PatternSet includes = PatternSet.compile(includePatterns);
        PatternSet excludes = PatternSet.compile(excludePatterns);

        if (Files.isRegularFile(start)) {
            Path relative = start.getFileName();
            boolean included = withinSize(start, maxFileSizeBytes)
                    && !excludes.matchesFile(relative)
                    && includes.matchesFile(relative);
            return included ? List.of(start) : List.of();
        }

        List<Path> discovered = new ArrayList<>();
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(start) && excludes.matchesDirectory(start.relativize(dir))) {
                    log.debug("Pruning excluded directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                Path relative = start.relativize(file);
                if (excludes.matchesFile(relative) || !includes.matchesFile(relative)) {
                    return FileVisitResult.CONTINUE;
                }
                if (attrs.size() > maxFileSizeBytes) {
                    log.debug("Skipping large file {} ({} bytes)", file, attrs.size());
                    return FileVisitResult.CONTINUE;
                }
                discovered.add(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(start)) {
                    throw exc;
                }
                log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        discovered.sort(null);
        log.info("Discovered {} files in {}", discovered.size(), start);
        return discovered;
    }

    private static boolean withinSize(Path file, long maxFileSizeBytes) {
        try {
            return Files.size(file) <= maxFileSizeBytes;
        } catch (IOException e) {
            log.debug("Could not check size of {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Compiled glob patterns.
     */
    static final class PatternSet {
        private final List<PathMatcher> nameMatchers = new ArrayList<>();
        private final List<PathMatcher> pathMatchers = new ArrayList<>();
        private final List<PathMatcher> directoryMatchers = new ArrayList<>();

        static PatternSet compile(List<String> patterns) {
            FileSystem fs = FileSystems.getDefault();
            PatternSet set = new PatternSet();
            for (String pattern : patterns) {
                if (pattern.isBlank()) {
                    continue;
                }
                if (pattern.contains("/")) {
                    set.pathMatchers.add(fs.getPathMatcher("glob:" + pattern));
                    set.pathMatchers.add(fs.getPathMatcher("glob:**/" + pattern));
                    if (pattern.startsWith("**/")) {
                        // ** needs at least one separator, so also match at the root
                        set.pathMatchers.add(fs.getPathMatcher("glob:" + pattern.substring(3)));
                    }
                    if (pattern.endsWith("/**")) {
                        String dir = pattern.substring(0, pattern.length() - 3);
                        set.directoryMatchers.add(fs.getPathMatcher("glob:" + dir));
                        set.directoryMatchers.add(fs.getPathMatcher("glob:**/" + dir));
                    }
                } else {
                    set.nameMatchers.add(fs.getPathMatcher("glob:" + pattern));
                }
            }
            return set;
        }

        boolean matchesFile(Path relative) {
            Path name = relative.getFileName();
            return (name != null && anyMatch(nameMatchers, name)) || anyMatch(pathMatchers, relative);
        }

        boolean matchesDirectory(Path relative) {
            Path name = relative.getFileName();
            return (name != null && anyMatch(nameMatchers, name)) || anyMatch(directoryMatchers, relative);
        }

        private static boolean anyMatch(List<PathMatcher> matchers, Path path) {
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(path)) {
                    return true;
                }
            }
            return false;
        }
    }
}
