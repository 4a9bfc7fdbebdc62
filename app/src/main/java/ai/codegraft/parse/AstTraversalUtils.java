package ai.codegraft.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Utility class for common AST traversal patterns over tree-sitter nodes.
 */
public final class AstTraversalUtils {

    private AstTraversalUtils() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Returns the child stored under a grammar field, if any. */
    public static Optional<TSNode> field(TSNode node, String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? Optional.of(child) : Optional.empty();
    }

    /** All children, named and anonymous, in source order. */
    public static List<TSNode> children(TSNode node) {
        var result = new ArrayList<TSNode>(node.getChildCount());
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /** Named children in source order. */
    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /** Recursively finds the first node matching the given predicate. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (!isPresent(rootNode)) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var result = findNodeRecursive(rootNode.getChild(i), predicate);
            if (result != null) {
                return result;
            }
        }

        return null;
    }

    /** Recursively finds all nodes matching the given predicate. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (!isPresent(node)) {
            return;
        }

        if (predicate.test(node)) {
            results.add(node);
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            findAllNodesRecursiveInternal(node.getChild(i), predicate, results);
        }
    }

    /** Finds all nodes of a specific type within the AST. */
    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }

    /** Same start and end offsets; tree-sitter hands out fresh node handles, so identity comparison is useless. */
    public static boolean sameSpan(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
