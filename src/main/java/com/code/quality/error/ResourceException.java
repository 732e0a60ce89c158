package com.code.quality.error;

import java.util.List;

/**
 * Raised when files cannot be discovered or the filesystem is unusable.
 * Aborts the run; no partial result is produced.
 */
public class ResourceException extends CodeQualityException {

    private final String resourceType;

    public ResourceException(String message, String resourceType, Throwable cause) {
        super(ErrorKind.RESOURCE, message, List.of(
                "Check that the path exists and is accessible",
                "Ensure you have read permissions for the directory"), cause);
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
