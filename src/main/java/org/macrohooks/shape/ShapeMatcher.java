package org.macrohooks.shape;

import org.macrohooks.ast.CoreForms;
import org.macrohooks.ast.Node;
import org.macrohooks.ast.NodeTag;
import org.macrohooks.ast.TokenNode;
import org.macrohooks.ast.VectorNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts and validates argument shapes from the raw arguments of an invocation.
 * All methods are pure; only {@link #matchBindingVector(Node, int, int)} can fail.
 */
public final class ShapeMatcher {

    private ShapeMatcher() {}

    /**
     * Reads a binding vector into symbol/expression pairs.
     * Elements are paired in order; a trailing unpaired symbol is bound to the nil placeholder,
     * so <code>[sym]</code> yields {@code sym -> nil} and <code>[sym expr]</code> yields {@code sym -> expr}.
     *
     * @param node The candidate binding vector, may be {@code null} if the argument is missing.
     * @param minArity The minimum number of vector elements.
     * @param maxArity The maximum number of vector elements.
     * @return The extracted bindings, or a violation if the node is missing, not a vector,
     *         or has an element count outside {@code [minArity, maxArity]}.
     */
    public static ShapeResult<BindingSpec> matchBindingVector(Node node, int minArity, int maxArity) {
        String expected = expectedVector(minArity, maxArity);
        if (!(node instanceof VectorNode vector)) {
            return ShapeResult.failure(expected, describe(node));
        }
        int count = vector.children().size();
        if (count < minArity || count > maxArity) {
            return ShapeResult.failure(expected, describe(node));
        }

        List<Node> elements = vector.children();
        List<Binding> bindings = new ArrayList<>((count + 1) / 2);
        for (int i = 0; i < count; i += 2) {
            Node expression = i + 1 < count
                    ? elements.get(i + 1)
                    : new TokenNode(CoreForms.NIL, vector.sourceInfo());
            bindings.add(new Binding(elements.get(i), expression));
        }
        return ShapeResult.success(new BindingSpec(vector, bindings));
    }

    /**
     * @param node The node to test, may be {@code null}.
     * @return {@code true} if the node is a vector.
     */
    public static boolean isVectorShaped(Node node) {
        return node != null && node.tag() == NodeTag.VECTOR;
    }

    /**
     * @param node The node to test, may be {@code null}.
     * @return {@code true} if the node is a string literal.
     */
    public static boolean isStringLiteral(Node node) {
        return node != null && node.tag() == NodeTag.STRING;
    }

    /**
     * Describes the shape of a node for violation messages.
     *
     * @param node The node, may be {@code null}.
     * @return A short description such as "vector of 3" or "nothing".
     */
    public static String describe(Node node) {
        if (node == null) {
            return "nothing";
        }
        return switch (node.tag()) {
            case TOKEN -> "token";
            case STRING -> "string literal";
            case LIST -> "list";
            case VECTOR -> "vector of " + node.getChildren().size();
            case MAP -> "map";
        };
    }

    private static String expectedVector(int minArity, int maxArity) {
        if (minArity == maxArity) {
            return "a binding vector of " + minArity + (minArity == 1 ? " element" : " elements");
        }
        if (maxArity == Integer.MAX_VALUE) {
            return "a binding vector of at least " + minArity + (minArity == 1 ? " element" : " elements");
        }
        return "a binding vector of " + minArity + " to " + maxArity + " elements";
    }
}
