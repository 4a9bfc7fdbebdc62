package ai.codegraft.merge;

import static ai.codegraft.parse.PythonNodeTypes.FIELD_RIGHT;

import ai.codegraft.parse.AstTraversalUtils;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.treesitter.TSNode;

/**
 * Collects the bindings made by the module's own top-level assignment statements. Assignments nested in any block,
 * whether a function, a class, an {@code if} or a {@code try}, are not global state here. A bare annotation such as
 * {@code X: int} binds no value and is skipped. A name assigned more than once keeps its last assignment but its
 * first position.
 */
public final class GlobalBindingCollector {

    private GlobalBindingCollector() {}

    /** Bindings keyed by name, iterated in order of first appearance. */
    public static Map<String, GlobalBinding> collect(ProgramUnit unit) {
        Map<String, GlobalBinding> bindings = new LinkedHashMap<>();
        for (var statement : unit.topLevelStatements()) {
            var assignment = PythonSyntax.assignment(statement);
            if (assignment.isEmpty()) {
                continue;
            }
            var value = valueOf(assignment.get());
            var names = PythonSyntax.assignedNames(assignment.get(), unit);
            if (value.isEmpty() || names.isEmpty()) {
                continue;
            }
            for (var name : names) {
                // re-putting a key keeps its first position
                bindings.put(
                        name,
                        new GlobalBinding(
                                name,
                                unit.textOf(assignment.get()),
                                unit.textOf(value.get()),
                                names));
            }
        }
        return Collections.unmodifiableMap(bindings);
    }

    /** The right-hand side holding the value; for a chain like {@code a = b = value} that of the innermost link. */
    static Optional<TSNode> valueOf(TSNode assignment) {
        var current = assignment;
        while (true) {
            var right = AstTraversalUtils.field(current, FIELD_RIGHT);
            if (right.isPresent() && PythonSyntax.isAssignmentNode(right.get())) {
                current = right.get();
            } else {
                return right;
            }
        }
    }
}
