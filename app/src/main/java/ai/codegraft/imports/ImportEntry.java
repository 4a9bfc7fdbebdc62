package ai.codegraft.imports;

import ai.codegraft.api.ImportRequirement;
import java.util.List;
import org.treesitter.TSNode;

/**
 * One name of an import statement, e.g. {@code b} in {@code from a import b, c}.
 *
 * @param statement the whole import statement
 * @param node the entry's own node ({@code dotted_name}, {@code aliased_import} or {@code wildcard_import})
 * @param requirement what the entry imports, with relative modules already resolved
 * @param siblings all entry nodes of the statement in source order, this one included
 * @param index position of this entry among its siblings
 */
public record ImportEntry(
        TSNode statement, TSNode node, ImportRequirement requirement, List<TSNode> siblings, int index) {

    public ImportEntry {
        siblings = List.copyOf(siblings);
    }

    public boolean isOnlyEntry() {
        return siblings.size() == 1;
    }
}
