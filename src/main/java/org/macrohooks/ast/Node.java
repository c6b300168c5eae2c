package org.macrohooks.ast;

import org.macrohooks.api.SourceInfo;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the syntax tree handed over by the host analyzer.
 * Nodes are immutable; a rewrite builds new containers around existing children.
 */
public interface Node {

    /**
     * @return The tag identifying which kind of node this is.
     */
    NodeTag tag();

    /**
     * @return The source position of this node. Never {@code null}.
     */
    SourceInfo sourceInfo();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<Node> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children, keeping the source position.
     *
     * @param newChildren The new children for this node
     * @return A new instance of this node with the new children, or this node if it has no children
     */
    default Node reconstructWithChildren(List<Node> newChildren) {
        return this;
    }
}
