package ai.codegraft.api;

import java.nio.file.Path;
import java.util.Set;

/** Implemented by engines that can fold rewritten code back into its destination file. */
public interface MergeProvider {

    /** Runs the full merge; returns the destination text unchanged when nothing could be merged. */
    String mergeOptimizedCode(MergeRequest request);

    /** Reconciles module-level variables and free statements of {@code newCode} into {@code destinationCode}. */
    default String mergeGlobals(String newCode, String destinationCode) {
        throw new UnsupportedOperationException();
    }

    /** Adds the imports {@code newCode} needs to {@code destinationCode} and drops the ones left unused. */
    default String reconcileImports(
            String newCode,
            String destinationCode,
            Path sourcePath,
            Path destinationPath,
            Path projectRoot,
            Set<String> helperFqns) {
        throw new UnsupportedOperationException();
    }
}
