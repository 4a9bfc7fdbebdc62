package ai.codegraft.api;

import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The standalone snippet extracted for a set of targets, plus the dunder methods of the enclosing class that were
 * carried along as context. An empty result means extraction was not applicable.
 */
public record ExtractionResult(@Nullable String snippet, Set<DunderMethod> contextualDunders) {
    private static final ExtractionResult EMPTY = new ExtractionResult(null, Set.of());

    public ExtractionResult {
        contextualDunders = Set.copyOf(contextualDunders);
    }

    public static ExtractionResult empty() {
        return EMPTY;
    }

    public static ExtractionResult of(String snippet, Set<DunderMethod> contextualDunders) {
        return new ExtractionResult(snippet, contextualDunders);
    }

    public boolean isEmpty() {
        return snippet == null;
    }

    public Optional<String> snippetText() {
        return Optional.ofNullable(snippet);
    }
}
