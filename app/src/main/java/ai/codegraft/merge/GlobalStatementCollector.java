package ai.codegraft.merge;

import static ai.codegraft.parse.PythonNodeTypes.EXPRESSION_STATEMENT;
import static ai.codegraft.parse.PythonNodeTypes.IF_STATEMENT;

import ai.codegraft.api.LineRange;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import java.util.ArrayList;
import java.util.List;
import org.treesitter.TSNode;

/**
 * Collects the module-level statements that are neither imports nor name bindings: calls and other side effects
 * that set the module up. Definitions, {@code if} blocks and docstrings are skipped; loops, {@code with} and
 * {@code try} statements are taken whole.
 */
public final class GlobalStatementCollector {

    private GlobalStatementCollector() {}

    /** Full source lines of each free statement, in file order. */
    public static List<String> collect(ProgramUnit unit) {
        var statements = new ArrayList<String>();
        LineRange previous = null;
        for (var node : unit.topLevelStatements()) {
            if (!isFreeStatement(node)) {
                continue;
            }
            var lines = unit.lineRange(node);
            // a; b on one line is taken once
            if (previous != null && previous.overlaps(lines)) {
                continue;
            }
            previous = lines;
            statements.add(unit.linesOf(node));
        }
        return statements;
    }

    static boolean isFreeStatement(TSNode node) {
        if (PythonSyntax.isImport(node) || PythonSyntax.isDefinition(node) || IF_STATEMENT.equals(node.getType())) {
            return false;
        }
        if (EXPRESSION_STATEMENT.equals(node.getType())) {
            return !PythonSyntax.isDocstring(node) && PythonSyntax.assignment(node).isEmpty();
        }
        return true;
    }
}
