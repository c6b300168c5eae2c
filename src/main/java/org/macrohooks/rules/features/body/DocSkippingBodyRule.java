package org.macrohooks.rules.features.body;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeResult;

/**
 * Rule for <code>(describe doc attr-map? children...)</code> and macros of the same shape.
 * Exactly the first argument is dropped; an attribute map after it stays in the body.
 */
public class DocSkippingBodyRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        return ShapeResult.success(invocation.synthesizer().sequence(invocation.argumentsFrom(1)));
    }
}
