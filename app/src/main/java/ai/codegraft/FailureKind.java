package ai.codegraft;

/** The failure categories the engine reports; each one maps to a documented fallback, never to a thrown error. */
public enum FailureKind {
    PARSE_FAILURE,
    STRUCTURAL_MISMATCH,
    IMPORT_RECONCILIATION_FAILURE,
    POST_EXTRACTION_VALIDATION_FAILURE
}
