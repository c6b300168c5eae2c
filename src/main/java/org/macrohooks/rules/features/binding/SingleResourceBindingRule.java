package org.macrohooks.rules.features.binding;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeMatcher;
import org.macrohooks.shape.ShapeResult;

/**
 * Rule for resource-acquisition macros such as <code>with-page</code>.
 * <pre>
 *   (with-page [pg] body...)        → (let [pg nil] body...)
 *   (with-page [pg (make)] body...) → (let [pg (make)] body...)
 * </pre>
 */
public class SingleResourceBindingRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        return ShapeMatcher.matchBindingVector(invocation.argument(0), 1, 2)
                .map(spec -> invocation.synthesizer().binding(spec.bindings(), invocation.argumentsFrom(1)));
    }
}
