package com.code.quality.api;

import com.code.quality.error.CodeQualityException;
import com.code.quality.error.ErrorKind;

import java.util.Objects;

/**
 * One recovered failure of an analysis run, kept in the run's ledger.
 *
 * @param kind    failure kind ({@code PARSING} or {@code ANALYSIS} for recovered failures)
 * @param subject the file path or analyzer name the failure belongs to
 * @param message operator-facing message
 * @param details technical details, usually the root cause
 */
public record RunFailure(ErrorKind kind, String subject, String message, String details) {

    public RunFailure {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(subject, "subject is required");
        message = message != null ? message : "";
        details = details != null ? details : "";
    }

    public static RunFailure of(CodeQualityException e, String subject) {
        return new RunFailure(e.getKind(), subject, e.getMessage(), e.getTechnicalDetails());
    }
}
