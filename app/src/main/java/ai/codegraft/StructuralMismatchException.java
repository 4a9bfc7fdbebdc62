package ai.codegraft;

/**
 * Thrown when a declaration path does not resolve, resolves to an unsupported kind of node, mixes methods of
 * different classes, or nests deeper than one class.
 */
public final class StructuralMismatchException extends GraftException {

    public StructuralMismatchException(String message) {
        super(FailureKind.STRUCTURAL_MISMATCH, message, null);
    }
}
