package com.code.quality.error;

import java.util.List;

/**
 * Base class for all failures raised by the analysis engine.
 * Carries the {@link ErrorKind} and optional suggestions for the operator.
 */
public abstract class CodeQualityException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> suggestions;

    protected CodeQualityException(ErrorKind kind, String message, List<String> suggestions, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    /**
     * Returns the message of the root cause, or this exception's own message if there is none.
     */
    public String getTechnicalDetails() {
        Throwable root = this;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == this ? getMessage() : root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
