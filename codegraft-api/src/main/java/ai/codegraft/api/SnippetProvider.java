package ai.codegraft.api;

import java.util.List;
import java.util.Set;

/** Implemented by engines that can cut a standalone snippet for a set of declarations out of a source file. */
public interface SnippetProvider {

    /**
     * Extracts the declarations named by {@code targets} together with the class context they need.
     * Returns {@link ExtractionResult#empty()} when extraction is not applicable.
     */
    ExtractionResult extract(String sourceCode, List<TargetFunction> targets);

    /** Every top-level function and class, and every method of a top-level class, the file defines. */
    default Set<PreexistingSymbol> preexistingSymbols(String sourceCode) {
        throw new UnsupportedOperationException();
    }
}
