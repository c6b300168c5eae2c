package org.macrohooks.ast;

import org.macrohooks.api.SourceInfo;

import java.util.List;

/**
 * A parenthesized list. Macro invocations are lists whose first child names the macro.
 *
 * @param children The elements of the list, in source order.
 * @param sourceInfo The position of the opening parenthesis.
 */
public record ListNode(
        List<Node> children,
        SourceInfo sourceInfo
) implements Node {

    public ListNode {
        children = List.copyOf(children);
        sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
    }

    @Override
    public NodeTag tag() {
        return NodeTag.LIST;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    public Node reconstructWithChildren(List<Node> newChildren) {
        return new ListNode(newChildren, sourceInfo);
    }
}
