package org.macrohooks.rules.features.binding;

import org.macrohooks.ast.Node;
import org.macrohooks.ast.VectorNode;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeMatcher;
import org.macrohooks.shape.ShapeResult;

/**
 * Rule for macros taking flat binding pairs, like <code>with-open</code>:
 * <code>(with-api-contexts [a ea b eb] body...)</code> becomes <code>(let [a ea b eb] body...)</code>.
 * The binding vector is reused as is.
 */
public class FlatPairBindingRule implements IRewriteRule {

    private static final String EXPECTED = "a binding vector with an even number of elements";

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        Node bindings = invocation.argument(0);
        if (!(bindings instanceof VectorNode vector) || vector.children().size() % 2 != 0) {
            return ShapeResult.failure(EXPECTED, ShapeMatcher.describe(bindings));
        }
        return ShapeResult.success(invocation.synthesizer().binding(vector, invocation.argumentsFrom(1)));
    }
}
