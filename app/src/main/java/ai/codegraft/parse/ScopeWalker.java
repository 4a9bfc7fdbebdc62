package ai.codegraft.parse;

import static ai.codegraft.parse.PythonNodeTypes.*;

import java.util.ArrayList;
import java.util.List;
import org.treesitter.TSNode;

/**
 * Walks every statement of a module, carrying the {@link ScopeDepth} it executes at. Dispatch is on node type:
 * definitions open a scope, {@code if} statements open a conditional, other compound statements are entered at the
 * current depth.
 */
public final class ScopeWalker {

    @FunctionalInterface
    public interface StatementVisitor {
        void visit(TSNode statement, ScopeDepth depth);
    }

    private ScopeWalker() {}

    public static void walk(ProgramUnit unit, StatementVisitor visitor) {
        walkStatements(unit.topLevelStatements(), ScopeDepth.MODULE, visitor);
    }

    private static void walkStatements(List<TSNode> statements, ScopeDepth depth, StatementVisitor visitor) {
        for (var statement : statements) {
            walkStatement(statement, depth, visitor);
        }
    }

    private static void walkStatement(TSNode statement, ScopeDepth depth, StatementVisitor visitor) {
        if (COMMENT.equals(statement.getType())) {
            return;
        }
        // clauses (case, except, ...) reach here when a block holds them directly; they are not statements
        if (!statement.getType().endsWith("_clause")) {
            visitor.visit(statement, depth);
        }

        switch (statement.getType()) {
            case DECORATED_DEFINITION -> AstTraversalUtils.field(statement, FIELD_DEFINITION)
                    .ifPresent(definition -> enterBlocks(definition, depth.enterScope(), visitor));
            case FUNCTION_DEFINITION, CLASS_DEFINITION -> enterBlocks(statement, depth.enterScope(), visitor);
            case IF_STATEMENT -> enterBlocks(statement, depth.enterConditional(), visitor);
            default -> enterBlocks(statement, depth, visitor);
        }
    }

    private static void enterBlocks(TSNode node, ScopeDepth depth, StatementVisitor visitor) {
        for (var block : childBlocks(node)) {
            walkStatements(AstTraversalUtils.namedChildren(block), depth, visitor);
        }
    }

    /** Blocks directly owned by a statement, including those of its clauses. */
    static List<TSNode> childBlocks(TSNode node) {
        var blocks = new ArrayList<TSNode>();
        for (var child : AstTraversalUtils.namedChildren(node)) {
            if (BLOCK.equals(child.getType())) {
                blocks.add(child);
            } else if (child.getType().endsWith("_clause")) {
                blocks.addAll(childBlocks(child));
            }
        }
        return blocks;
    }
}
