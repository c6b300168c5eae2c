package org.macrohooks.ast;

import org.macrohooks.api.SourceInfo;

import java.util.Objects;

/**
 * A string literal, e.g. a documentation string or a step label.
 *
 * @param text The literal's content without quotes.
 * @param sourceInfo The position of the literal.
 */
public record StringNode(
        String text,
        SourceInfo sourceInfo
) implements Node {

    public StringNode {
        Objects.requireNonNull(text, "text");
        sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
    }

    @Override
    public NodeTag tag() {
        return NodeTag.STRING;
    }
}
