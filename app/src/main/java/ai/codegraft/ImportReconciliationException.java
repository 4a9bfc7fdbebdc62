package ai.codegraft;

import org.jetbrains.annotations.Nullable;

/** Thrown when an import entry cannot be added to or removed from a destination file. */
public final class ImportReconciliationException extends GraftException {

    public ImportReconciliationException(String message) {
        super(FailureKind.IMPORT_RECONCILIATION_FAILURE, message, null);
    }

    public ImportReconciliationException(String message, @Nullable Throwable cause) {
        super(FailureKind.IMPORT_RECONCILIATION_FAILURE, message, cause);
    }
}
