package com.code.quality.core.model;

import java.util.Objects;

/**
 * A single finding emitted by an analyzer unit.
 *
 * @param id          identifier, unique within a run
 * @param category    issue category
 * @param severity    issue severity
 * @param title       short summary
 * @param description full description
 * @param location    where the issue was found
 * @param suggestion  suggested fix, may be empty
 * @param confidence  analyzer confidence in [0, 1]
 */
public record Issue(
        String id,
        IssueCategory category,
        Severity severity,
        String title,
        String description,
        CodeLocation location,
        String suggestion,
        double confidence
) {
    public Issue {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(location, "location is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        title = title != null ? title : "";
        description = description != null ? description : "";
        suggestion = suggestion != null ? suggestion : "";
    }

    /**
     * Path of the file this issue belongs to.
     */
    public String filePath() {
        return location.filePath();
    }
}
