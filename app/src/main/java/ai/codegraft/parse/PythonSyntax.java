package ai.codegraft.parse;

import static ai.codegraft.parse.PythonNodeTypes.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TSNode;

/** Shape queries over Python syntax nodes that several transforms share. */
public final class PythonSyntax {
    private static final Set<String> IMPORT_TYPES =
            Set.of(IMPORT_STATEMENT, IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT);
    private static final Set<String> STRING_TYPES = Set.of(STRING, CONCATENATED_STRING);

    private PythonSyntax() {}

    /** For a decorated definition, the wrapped class or function; any other node is returned as is. */
    public static TSNode unwrapDecorated(TSNode node) {
        if (DECORATED_DEFINITION.equals(node.getType())) {
            return AstTraversalUtils.field(node, FIELD_DEFINITION).orElse(node);
        }
        return node;
    }

    public static boolean isFunction(TSNode node) {
        return FUNCTION_DEFINITION.equals(unwrapDecorated(node).getType());
    }

    public static boolean isClass(TSNode node) {
        return CLASS_DEFINITION.equals(unwrapDecorated(node).getType());
    }

    public static boolean isDefinition(TSNode node) {
        return isFunction(node) || isClass(node);
    }

    /** Name of a (possibly decorated) class or function definition. */
    public static Optional<String> definitionName(TSNode node, ProgramUnit unit) {
        var definition = unwrapDecorated(node);
        if (!FUNCTION_DEFINITION.equals(definition.getType()) && !CLASS_DEFINITION.equals(definition.getType())) {
            return Optional.empty();
        }
        return AstTraversalUtils.field(definition, FIELD_NAME).map(unit::textOf);
    }

    /** Body block of a (possibly decorated) class or function definition. */
    public static Optional<TSNode> body(TSNode node) {
        return AstTraversalUtils.field(unwrapDecorated(node), FIELD_BODY);
    }

    /** Statements of a block, comments excluded. */
    public static List<TSNode> statements(TSNode block) {
        var result = new ArrayList<TSNode>();
        for (var child : AstTraversalUtils.namedChildren(block)) {
            if (!COMMENT.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static boolean isImport(TSNode statement) {
        return IMPORT_TYPES.contains(statement.getType());
    }

    public static boolean isFutureImport(TSNode statement) {
        return FUTURE_IMPORT_STATEMENT.equals(statement.getType());
    }

    /** An expression statement consisting of a lone string literal. */
    public static boolean isDocstring(TSNode statement) {
        if (!EXPRESSION_STATEMENT.equals(statement.getType()) || statement.getNamedChildCount() != 1) {
            return false;
        }
        return STRING_TYPES.contains(statement.getNamedChild(0).getType());
    }

    /** The assignment carried by an expression statement such as {@code x = 1} or {@code x: int = 1}. */
    public static Optional<TSNode> assignment(TSNode statement) {
        if (!EXPRESSION_STATEMENT.equals(statement.getType()) || statement.getNamedChildCount() != 1) {
            return Optional.empty();
        }
        var child = statement.getNamedChild(0);
        return ASSIGNMENT.equals(child.getType()) ? Optional.of(child) : Optional.empty();
    }

    public static boolean isAssignmentNode(TSNode node) {
        return ASSIGNMENT.equals(node.getType());
    }

    public static boolean isAnnotated(TSNode assignment) {
        return AstTraversalUtils.field(assignment, FIELD_TYPE).isPresent();
    }

    /**
     * Plain-name targets of an assignment. A chained assignment {@code a = b = 1} yields both names; tuple,
     * attribute and subscript targets yield nothing.
     */
    public static List<String> assignedNames(TSNode assignment, ProgramUnit unit) {
        var names = new ArrayList<String>();
        var current = assignment;
        while (true) {
            var left = AstTraversalUtils.field(current, FIELD_LEFT);
            if (left.isEmpty() || !IDENTIFIER.equals(left.get().getType())) {
                return List.of();
            }
            names.add(unit.textOf(left.get()));
            var right = AstTraversalUtils.field(current, FIELD_RIGHT);
            if (right.isPresent() && ASSIGNMENT.equals(right.get().getType())) {
                current = right.get();
            } else {
                return names;
            }
        }
    }

    /**
     * The target name of a single-target assignment ({@code X = ...} or {@code X: T = ...}), as used for type
     * aliases. Chained and destructuring assignments have none.
     */
    public static Optional<String> singleTargetName(TSNode assignment, ProgramUnit unit) {
        var names = assignedNames(assignment, unit);
        return names.size() == 1 ? Optional.of(names.get(0)) : Optional.empty();
    }
}
