package org.macrohooks.shape;

import org.macrohooks.ast.Node;

import java.util.Objects;

/**
 * A single symbol/expression pair of a binding form.
 *
 * @param symbol The bound symbol (or any bindable node, e.g. a destructuring map).
 * @param expression The bound expression; the nil placeholder when the source omitted it.
 */
public record Binding(Node symbol, Node expression) {
    public Binding {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(expression, "expression");
    }
}
