package ai.codegraft.extract;

import ai.codegraft.StructuralMismatchException;
import ai.codegraft.api.DeclarationPath;
import ai.codegraft.api.DunderMethod;
import ai.codegraft.api.LineRange;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Resolves a {@link DeclarationPath} to its node in a parsed file. The first top-level function, class or
 * single-target assignment with a matching name wins. For method paths the enclosing class contributes its header,
 * docstring and dunder methods as skeleton ranges.
 */
public final class DeclarationLocator {
    private static final Logger log = LogManager.getLogger(DeclarationLocator.class);

    /**
     * Finds the declaration named by {@code path}.
     *
     * @return the declaration, or empty when nothing matches
     * @throws StructuralMismatchException when a method path's first segment names something other than a class
     */
    public Optional<LocatedDeclaration> locate(ProgramUnit unit, DeclarationPath path)
            throws StructuralMismatchException {
        var target = findTarget(unit, unit.topLevelStatements(), path.first(), false);
        if (target == null) {
            log.debug("No top-level declaration named {}", path.first());
            return Optional.empty();
        }
        if (!path.isMethod()) {
            return Optional.of(new LocatedDeclaration(path, target, unit.lineRange(target), null, List.of(), Set.of()));
        }

        if (!PythonSyntax.isClass(target)) {
            throw new StructuralMismatchException(
                    "%s resolves to a %s, not a class".formatted(path.first(), target.getType()));
        }
        var classNode = PythonSyntax.unwrapDecorated(target);
        var bodyStatements = PythonSyntax.body(classNode).map(PythonSyntax::statements).orElse(List.of());
        if (bodyStatements.isEmpty()) {
            return Optional.empty();
        }

        var methodName = path.last();
        List<LineRange> skeleton = new ArrayList<>();
        Set<DunderMethod> dunders = new LinkedHashSet<>();

        // class keyword line through the line before the first body statement
        int headerStart = unit.startLine(classNode);
        skeleton.add(new LineRange(headerStart, unit.startLine(bodyStatements.get(0)) - 1));

        var rest = bodyStatements;
        if (PythonSyntax.isDocstring(bodyStatements.get(0))) {
            skeleton.add(unit.lineRange(bodyStatements.get(0)));
            rest = bodyStatements.subList(1, bodyStatements.size());
        }

        for (var member : rest) {
            if (!PythonSyntax.isFunction(member)) {
                continue;
            }
            var memberName = PythonSyntax.definitionName(member, unit).orElse("");
            if (!memberName.equals(methodName) && DunderMethod.isDunderName(memberName)) {
                dunders.add(new DunderMethod(path.first(), memberName));
                skeleton.add(unit.lineRange(member));
            }
        }

        var method = findTarget(unit, bodyStatements, methodName, true);
        if (method == null) {
            log.debug("Class {} has no method {}", path.first(), methodName);
            return Optional.empty();
        }
        return Optional.of(
                new LocatedDeclaration(path, method, unit.lineRange(method), path.first(), skeleton, dunders));
    }

    private static @Nullable TSNode findTarget(
            ProgramUnit unit, List<TSNode> statements, String name, boolean insideClass) {
        for (var node : statements) {
            if (PythonSyntax.isDefinition(node)) {
                if (PythonSyntax.definitionName(node, unit).filter(name::equals).isPresent()) {
                    return node;
                }
                continue;
            }
            var matchesAssignment = PythonSyntax.assignment(node)
                    .flatMap(a -> PythonSyntax.singleTargetName(a, unit))
                    .filter(name::equals)
                    .isPresent();
            if (matchesAssignment) {
                // type-alias style assignments are only looked up at module level
                return insideClass ? null : node;
            }
        }
        return null;
    }
}
