package ai.codegraft;

import org.jetbrains.annotations.Nullable;

/**
 * Failures raised inside the engine. They never escape a public operation: every boundary catches them, logs one
 * diagnostic line and returns its fallback (the original text, or an empty extraction).
 */
public abstract sealed class GraftException extends Exception
        permits ParseFailureException, StructuralMismatchException, ImportReconciliationException {
    private final FailureKind kind;

    protected GraftException(FailureKind kind, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
