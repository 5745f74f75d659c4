package ai.refgraph.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal helpers shared by the tree-sitter parsers. */
public class ASTTraversalUtils {
    private ASTTraversalUtils() {}

    public static boolean isNull(@Nullable TSNode node) {
        return node == null || node.isNull();
    }

    /**
     * First node matching the predicate in breadth-first order, so a module-level declaration wins over a nested one
     * of the same name.
     */
    public static @Nullable TSNode findNodeBreadthFirst(TSNode rootNode, Predicate<TSNode> predicate) {
        var queue = new ArrayDeque<TSNode>();
        queue.add(rootNode);
        while (!queue.isEmpty()) {
            var node = queue.poll();
            if (predicate.test(node)) {
                return node;
            }
            for (int i = 0; i < node.getChildCount(); i++) {
                var child = node.getChild(i);
                if (!isNull(child)) {
                    queue.add(child);
                }
            }
        }
        return null;
    }

    /** All nodes matching the predicate, in pre-order. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        // explicit stack: deeply nested expressions would otherwise overflow the Java stack
        var stack = new ArrayDeque<TSNode>();
        stack.push(rootNode);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (predicate.test(node)) {
                results.add(node);
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                var child = node.getChild(i);
                if (!isNull(child)) {
                    stack.push(child);
                }
            }
        }
        return results;
    }

    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }

    public static List<TSNode> namedChildren(TSNode node) {
        var children = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (!isNull(child)) {
                children.add(child);
            }
        }
        return children;
    }

    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isNull(child) ? null : child;
    }

    public static @Nullable TSNode parent(TSNode node) {
        var p = node.getParent();
        return isNull(p) ? null : p;
    }

    /** Tree-sitter hands out fresh node handles, so identity comparison is by span and type. */
    public static boolean sameNode(@Nullable TSNode a, @Nullable TSNode b) {
        if (isNull(a) || isNull(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    public static boolean isField(TSNode parent, String fieldName, TSNode child) {
        return sameNode(field(parent, fieldName), child);
    }

    public static String text(@Nullable TSNode node, SourceText source) {
        if (isNull(node)) {
            return "";
        }
        return source.slice(node.getStartByte(), node.getEndByte());
    }

    /** 1-based line of the node's first byte. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based line of the node's last byte. */
    public static int endLine(TSNode node) {
        var end = node.getEndPoint();
        // a node ending in a newline reports column 0 of the following row
        return end.getColumn() == 0 && end.getRow() > node.getStartPoint().getRow() ? end.getRow() : end.getRow() + 1;
    }
}
