package org.macrohooks.rules.features.body;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeResult;

/**
 * Rule for step-style macros.
 * <pre>
 *   (step "label")         → (do "label")
 *   (step "label" body...) → (do body...)
 * </pre>
 * A marker step keeps its label, which may be any expression. With a body the label is dropped
 * whatever its shape.
 */
public class LabelStrippingRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        if (invocation.argumentCount() == 1) {
            return ShapeResult.success(invocation.synthesizer().sequence(invocation.arguments()));
        }
        return ShapeResult.success(invocation.synthesizer().sequence(invocation.argumentsFrom(1)));
    }
}
