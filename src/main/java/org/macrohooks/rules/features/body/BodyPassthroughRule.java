package org.macrohooks.rules.features.body;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeResult;

/**
 * <code>(before body...)</code> → <code>(do body...)</code>.
 */
public class BodyPassthroughRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        return ShapeResult.success(invocation.synthesizer().sequence(invocation.arguments()));
    }
}
