package ai.codegraft.imports;

import static ai.codegraft.parse.PythonNodeTypes.*;

import ai.codegraft.parse.AstTraversalUtils;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import org.treesitter.TSNode;

/**
 * The names a file reads. Identifiers inside import statements, the names of definitions, attribute members,
 * keyword-argument names and parameter names are declarations rather than reads and are not counted. Names
 * exported through a module-level {@code __all__} and names inside string annotations count as read.
 */
public final class NameUsageIndex {
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> PARAMETER_CONTAINERS = Set.of(PARAMETERS, LAMBDA_PARAMETERS);
    private static final Set<String> NAMED_PARAMETERS = Set.of(DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER);
    private static final Set<String> SPLAT_PATTERNS = Set.of("list_splat_pattern", "dictionary_splat_pattern");
    private static final String ALL_NAME = "__all__";

    private final Set<String> names;
    private final Set<String> dottedChains;

    private NameUsageIndex(Set<String> names, Set<String> dottedChains) {
        this.names = names;
        this.dottedChains = dottedChains;
    }

    public static NameUsageIndex of(ProgramUnit unit) {
        Set<String> names = new HashSet<>();
        Set<String> chains = new HashSet<>();
        collect(unit, unit.root(), false, names, chains);
        collectExports(unit, names);
        return new NameUsageIndex(names, chains);
    }

    /** True when the plain name is read anywhere in the file. */
    public boolean isUsed(String name) {
        return names.contains(name);
    }

    /** True when an attribute chain such as {@code os.path} (or one that extends it) is read. */
    public boolean isChainUsed(String dotted) {
        return dotted.indexOf('.') < 0 ? names.contains(dotted) : dottedChains.contains(dotted);
    }

    private static void collect(ProgramUnit unit, TSNode node, boolean inAnnotation, Set<String> names, Set<String> chains) {
        if (PythonSyntax.isImport(node)) {
            return;
        }
        switch (node.getType()) {
            case IDENTIFIER -> {
                if (isRead(node)) {
                    names.add(unit.textOf(node));
                }
                return;
            }
            case ATTRIBUTE -> {
                var text = unit.textOf(node).replaceAll("\\s+", "");
                if (IDENTIFIER_PATTERN.matcher(text.replace(".", "")).matches()) {
                    chains.add(text);
                }
            }
            case STRING_CONTENT -> {
                if (inAnnotation) {
                    var matcher = IDENTIFIER_PATTERN.matcher(unit.textOf(node));
                    while (matcher.find()) {
                        names.add(matcher.group());
                    }
                }
                return;
            }
            default -> {}
        }
        // parameter, return and assignment annotations all hang off a type node
        boolean annotation = inAnnotation || TYPE.equals(node.getType());
        for (var child : AstTraversalUtils.children(node)) {
            collect(unit, child, annotation, names, chains);
        }
    }

    private static boolean isRead(TSNode identifier) {
        var parent = identifier.getParent();
        if (!AstTraversalUtils.isPresent(parent)) {
            return true;
        }
        var parentType = parent.getType();
        if (FUNCTION_DEFINITION.equals(parentType) || CLASS_DEFINITION.equals(parentType)) {
            return !isField(parent, FIELD_NAME, identifier);
        }
        if (ATTRIBUTE.equals(parentType)) {
            return !isField(parent, FIELD_ATTRIBUTE, identifier);
        }
        if (KEYWORD_ARGUMENT.equals(parentType) || NAMED_PARAMETERS.contains(parentType)) {
            return !isField(parent, FIELD_NAME, identifier);
        }
        if (PARAMETER_CONTAINERS.contains(parentType)) {
            return false;
        }
        if (TYPED_PARAMETER.equals(parentType)) {
            // x: int -> the bare identifier is the parameter, the annotation sits under a type node
            return false;
        }
        if (SPLAT_PATTERNS.contains(parentType)) {
            var grandParent = parent.getParent();
            return !(AstTraversalUtils.isPresent(grandParent)
                    && (PARAMETER_CONTAINERS.contains(grandParent.getType())
                            || TYPED_PARAMETER.equals(grandParent.getType())));
        }
        return true;
    }

    private static boolean isField(TSNode parent, String field, TSNode child) {
        return AstTraversalUtils.field(parent, field)
                .filter(f -> AstTraversalUtils.sameSpan(f, child))
                .isPresent();
    }

    // __all__ = ["a", "b"] keeps a and b alive
    private static void collectExports(ProgramUnit unit, Set<String> names) {
        for (var statement : unit.topLevelStatements()) {
            if (!EXPRESSION_STATEMENT.equals(statement.getType()) || statement.getNamedChildCount() != 1) {
                continue;
            }
            var expression = statement.getNamedChild(0);
            if (!ASSIGNMENT.equals(expression.getType()) && !AUGMENTED_ASSIGNMENT.equals(expression.getType())) {
                continue;
            }
            var target = AstTraversalUtils.field(expression, FIELD_LEFT).map(unit::textOf).orElse("");
            if (!ALL_NAME.equals(target)) {
                continue;
            }
            AstTraversalUtils.field(expression, FIELD_RIGHT).ifPresent(value -> {
                for (var content : AstTraversalUtils.findAllNodesByType(value, STRING_CONTENT)) {
                    names.add(unit.textOf(content));
                }
            });
        }
    }
}
