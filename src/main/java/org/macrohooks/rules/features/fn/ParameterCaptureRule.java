package org.macrohooks.rules.features.fn;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeMatcher;
import org.macrohooks.shape.ShapeResult;

/**
 * Rule for wrapper hooks such as <code>(around [f] body...)</code>, rewritten to
 * <code>(fn [f] body...)</code> so the captured parameter resolves as a function argument.
 */
public class ParameterCaptureRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        Node params = invocation.argument(0);
        if (!ShapeMatcher.isVectorShaped(params)) {
            return ShapeResult.failure("a parameter vector", ShapeMatcher.describe(params));
        }
        return ShapeResult.success(invocation.synthesizer().functionLiteral(params, invocation.argumentsFrom(1)));
    }
}
