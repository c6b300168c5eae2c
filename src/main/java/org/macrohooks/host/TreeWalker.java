package org.macrohooks.host;

import org.macrohooks.ast.Node;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A generic, type-agnostic rewriter for node trees.
 */
public class TreeWalker {

    private final UnaryOperator<Node> rewriter;
    private final Map<Node, Node> transformed = new IdentityHashMap<>();

    /**
     * @param rewriter Maps a node to its replacement, or returns the node itself to keep it.
     */
    public TreeWalker(UnaryOperator<Node> rewriter) {
        this.rewriter = rewriter;
    }

    /**
     * Transforms a tree pre-order: each node is first offered to the rewriter, then the children
     * of the result are transformed in turn. A container is rebuilt only if one of its children
     * changed, so untouched subtrees keep their identity.
     * <p>
     * A node reachable along several paths (a rewrite may place the same argument more than once)
     * is offered to the rewriter only once per call; every occurrence receives the same result.
     *
     * @param node The root node to transform.
     * @return The transformed node (may be the same or a new node).
     */
    public Node transform(Node node) {
        transformed.clear();
        return visit(node);
    }

    private Node visit(Node node) {
        if (node == null) {
            return null;
        }
        Node known = transformed.get(node);
        if (known != null) {
            return known;
        }
        Node current = rewriter.apply(node);

        List<Node> children = current.getChildren();
        List<Node> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (Node child : children) {
            Node transformedChild = visit(child);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        Node result = childrenChanged ? current.reconstructWithChildren(transformedChildren) : current;
        transformed.put(node, result);
        return result;
    }
}
