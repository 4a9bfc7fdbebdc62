package ai.codegraft.extract;

import ai.codegraft.api.DeclarationPath;
import ai.codegraft.api.DunderMethod;
import ai.codegraft.api.LineRange;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * A declaration resolved from a {@link DeclarationPath}.
 *
 * @param node the statement node, including its decorators when it has any
 * @param lines the lines to extract for it, starting at the first decorator
 * @param enclosingClass the class the declaration was found in, or null at module level
 * @param skeletonRanges class context ranges (header, docstring, dunder methods) collected on the way
 * @param contextualDunders dunder methods of the enclosing class other than the target
 */
public record LocatedDeclaration(
        DeclarationPath path,
        TSNode node,
        LineRange lines,
        @Nullable String enclosingClass,
        List<LineRange> skeletonRanges,
        Set<DunderMethod> contextualDunders) {

    public LocatedDeclaration {
        skeletonRanges = List.copyOf(skeletonRanges);
        contextualDunders = Set.copyOf(contextualDunders);
    }

    public Optional<String> enclosingClassName() {
        return Optional.ofNullable(enclosingClass);
    }
}
