package com.code.quality.error;

/**
 * Classification of failures raised during an analysis run.
 */
public enum ErrorKind {
    /** Discovery or filesystem failure. Fatal for the run. */
    RESOURCE,
    /** A single file failed to parse. Recorded, the run continues. */
    PARSING,
    /** A single analyzer unit failed, or nothing could be parsed at all. */
    ANALYSIS,
    /** A cache entry could not be read. Treated as a miss. */
    CACHE,
    /** The run was cancelled by its caller. */
    CANCELLED
}
