package ai.codegraft.imports;

import static ai.codegraft.parse.PythonNodeTypes.*;

import ai.codegraft.api.ImportRequirement;
import ai.codegraft.parse.AstTraversalUtils;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/** Decomposes Python import statements into {@link ImportEntry} values. */
public final class ImportStatements {
    private static final Logger log = LogManager.getLogger(ImportStatements.class);

    private ImportStatements() {}

    /** Entries of every top-level import statement of the unit, in source order. */
    public static List<ImportEntry> topLevelEntries(ProgramUnit unit, ModuleIdentity identity) {
        var entries = new ArrayList<ImportEntry>();
        for (var statement : unit.topLevelStatements()) {
            if (PythonSyntax.isImport(statement)) {
                entries.addAll(entries(unit, statement, identity));
            }
        }
        return entries;
    }

    /**
     * Entries of one import statement. Relative from-imports are resolved against {@code identity}; a relative
     * import that climbs above the project root yields no entries.
     */
    public static List<ImportEntry> entries(ProgramUnit unit, TSNode statement, ModuleIdentity identity) {
        return switch (statement.getType()) {
            case IMPORT_STATEMENT -> moduleEntries(unit, statement);
            case IMPORT_FROM_STATEMENT -> fromModule(unit, statement, identity)
                    .map(module -> objectEntries(unit, statement, module, nameNodes(statement)))
                    .orElse(List.of());
            case FUTURE_IMPORT_STATEMENT -> objectEntries(
                    unit, statement, ImportRequirement.FUTURE_MODULE, nameNodes(statement));
            default -> List.of();
        };
    }

    /** The absolute module a from-import reads from. */
    public static Optional<String> fromModule(ProgramUnit unit, TSNode statement, ModuleIdentity identity) {
        var moduleNode = AstTraversalUtils.field(statement, FIELD_MODULE_NAME);
        if (moduleNode.isEmpty()) {
            return Optional.empty();
        }
        var text = dotted(unit, moduleNode.get());
        if (!RELATIVE_IMPORT.equals(moduleNode.get().getType())) {
            return Optional.of(text);
        }
        var resolved = identity.resolveRelative(text);
        if (resolved.isEmpty()) {
            log.warn("Relative import {} climbs above the project root of {}", text, identity.name());
        }
        return resolved;
    }

    /** The entry nodes of a from-import or future import, excluding the module name. */
    public static List<TSNode> nameNodes(TSNode statement) {
        var moduleNode = AstTraversalUtils.field(statement, FIELD_MODULE_NAME);
        var names = new ArrayList<TSNode>();
        for (var child : AstTraversalUtils.namedChildren(statement)) {
            if (moduleNode.isPresent() && AstTraversalUtils.sameSpan(child, moduleNode.get())) {
                continue;
            }
            switch (child.getType()) {
                case DOTTED_NAME, ALIASED_IMPORT, WILDCARD_IMPORT -> names.add(child);
                default -> {}
            }
        }
        return names;
    }

    private static List<ImportEntry> moduleEntries(ProgramUnit unit, TSNode statement) {
        var nodes = new ArrayList<TSNode>();
        for (var child : AstTraversalUtils.namedChildren(statement)) {
            if (DOTTED_NAME.equals(child.getType()) || ALIASED_IMPORT.equals(child.getType())) {
                nodes.add(child);
            }
        }
        var entries = new ArrayList<ImportEntry>();
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            ImportRequirement requirement;
            if (ALIASED_IMPORT.equals(node.getType())) {
                requirement = ImportRequirement.aliasedModule(aliasedName(unit, node), alias(unit, node));
            } else {
                requirement = ImportRequirement.module(dotted(unit, node));
            }
            entries.add(new ImportEntry(statement, node, requirement, nodes, i));
        }
        return entries;
    }

    private static List<ImportEntry> objectEntries(
            ProgramUnit unit, TSNode statement, String module, List<TSNode> nodes) {
        var entries = new ArrayList<ImportEntry>();
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            var requirement = switch (node.getType()) {
                case ALIASED_IMPORT -> ImportRequirement.aliasedObject(
                        module, aliasedName(unit, node), alias(unit, node));
                case WILDCARD_IMPORT -> ImportRequirement.object(module, ImportRequirement.STAR);
                default -> ImportRequirement.object(module, dotted(unit, node));
            };
            entries.add(new ImportEntry(statement, node, requirement, nodes, i));
        }
        return entries;
    }

    private static String aliasedName(ProgramUnit unit, TSNode aliased) {
        return AstTraversalUtils.field(aliased, FIELD_NAME).map(n -> dotted(unit, n)).orElse("");
    }

    private static String alias(ProgramUnit unit, TSNode aliased) {
        return AstTraversalUtils.field(aliased, FIELD_ALIAS).map(unit::textOf).orElse("");
    }

    private static String dotted(ProgramUnit unit, TSNode node) {
        return unit.textOf(node).replaceAll("\\s+", "");
    }
}
