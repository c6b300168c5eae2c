package org.macrohooks.ast;

import org.macrohooks.api.SourceInfo;

import java.util.List;

/**
 * A bracketed vector, used for binding vectors and parameter lists.
 *
 * @param children The elements of the vector, in source order.
 * @param sourceInfo The position of the opening bracket.
 */
public record VectorNode(
        List<Node> children,
        SourceInfo sourceInfo
) implements Node {

    public VectorNode {
        children = List.copyOf(children);
        sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
    }

    @Override
    public NodeTag tag() {
        return NodeTag.VECTOR;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    public Node reconstructWithChildren(List<Node> newChildren) {
        return new VectorNode(newChildren, sourceInfo);
    }
}
