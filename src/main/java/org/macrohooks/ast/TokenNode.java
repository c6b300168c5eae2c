package org.macrohooks.ast;

import org.macrohooks.api.SourceInfo;

import java.util.Objects;

/**
 * A plain token such as a symbol, keyword or number, e.g. {@code with-page} or {@code :times}.
 *
 * @param value The token text.
 * @param sourceInfo The position of the token.
 */
public record TokenNode(
        String value,
        SourceInfo sourceInfo
) implements Node {

    public TokenNode {
        Objects.requireNonNull(value, "value");
        sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
    }

    @Override
    public NodeTag tag() {
        return NodeTag.TOKEN;
    }

    /**
     * @param text The text to compare with.
     * @return {@code true} if this token's text equals {@code text}.
     */
    public boolean is(String text) {
        return value.equals(text);
    }
}
