package ai.codegraft.api;

import java.util.Optional;

/**
 * The external service that rewrites an extracted snippet. Treated as an opaque text-to-text function; an empty
 * reply means no candidate was produced.
 */
@FunctionalInterface
public interface CandidateOptimizer {
    Optional<String> optimize(String snippet);
}
