package org.macrohooks.shape;

import org.macrohooks.ast.VectorNode;

import java.util.List;

/**
 * The ordered bindings extracted from a binding vector.
 *
 * @param source The vector the bindings were read from.
 * @param bindings The symbol/expression pairs in source order.
 */
public record BindingSpec(VectorNode source, List<Binding> bindings) {

    public BindingSpec {
        bindings = List.copyOf(bindings);
    }

    /**
     * @return The first binding.
     * @throws IndexOutOfBoundsException if there are no bindings.
     */
    public Binding first() {
        return bindings.get(0);
    }
}
