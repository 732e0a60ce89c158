package com.code.quality.api;

import java.nio.file.Path;

/**
 * Context handed to every analyzer unit invocation.
 *
 * @param analysisId id of the run
 * @param root       root of the analyzed code base
 * @param options    options of the run
 */
public record AnalysisContext(String analysisId, Path root, AnalysisOptions options) {
}
