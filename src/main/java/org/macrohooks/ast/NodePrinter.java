package org.macrohooks.ast;

import java.util.List;

/**
 * Renders a node tree back to bracketed source text, e.g. {@code (let [x (foo)] (bar x))}.
 * Used for log output and test assertions; positions are not rendered.
 */
public final class NodePrinter {

    private NodePrinter() {}

    /**
     * @param node The node to render.
     * @return The source text of the node.
     */
    public static String print(Node node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Node node) {
        if (node instanceof TokenNode token) {
            sb.append(token.value());
        } else if (node instanceof StringNode string) {
            sb.append('"');
            for (char c : string.text().toCharArray()) {
                if (c == '"' || c == '\\') sb.append('\\');
                sb.append(c);
            }
            sb.append('"');
        } else if (node instanceof ListNode list) {
            appendAll(sb, '(', list.children(), ')');
        } else if (node instanceof VectorNode vector) {
            appendAll(sb, '[', vector.children(), ']');
        } else if (node instanceof MapNode map) {
            appendAll(sb, '{', map.getChildren(), '}');
        } else {
            throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
        }
    }

    private static void appendAll(StringBuilder sb, char open, List<Node> children, char close) {
        sb.append(open);
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ');
            append(sb, children.get(i));
        }
        sb.append(close);
    }
}
