package com.code.quality.core.model;

/**
 * Categories of code quality issues.
 */
public enum IssueCategory {
    SECURITY,
    PERFORMANCE,
    COMPLEXITY,
    DUPLICATION,
    TESTING,
    DOCUMENTATION,
    HOTSPOT
}
