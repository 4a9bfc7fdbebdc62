package ai.codegraft.api;

import java.util.List;
import java.util.Optional;

/**
 * Identifies a declaration inside one source file: either a top-level function (one segment) or a method of a
 * top-level class (class name, method name). Deeper nesting is not representable.
 */
public record DeclarationPath(List<String> segments) {

    public DeclarationPath {
        segments = List.copyOf(segments);
        if (segments.isEmpty() || segments.size() > 2) {
            throw new IllegalArgumentException("Declaration path must have 1 or 2 segments, got " + segments);
        }
        for (var segment : segments) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Blank segment in declaration path " + segments);
            }
        }
    }

    public static DeclarationPath of(String... segments) {
        return new DeclarationPath(List.of(segments));
    }

    public String first() {
        return segments.get(0);
    }

    public String last() {
        return segments.get(segments.size() - 1);
    }

    public boolean isMethod() {
        return segments.size() == 2;
    }

    public Optional<String> className() {
        return isMethod() ? Optional.of(segments.get(0)) : Optional.empty();
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
