package org.macrohooks.rules.features.def;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeMatcher;
import org.macrohooks.shape.ShapeResult;

/**
 * Rule for defining macros such as <code>defdescribe</code>.
 * <pre>
 *   (defdescribe name "doc"? attr-map? children...) → (do (def name nil) attr-map? children...)
 * </pre>
 * The name is declared so references to it resolve; a doc string directly after the name is dropped.
 */
public class DocSkippingDefinitionRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        Node name = invocation.argument(0);
        if (name == null) {
            return ShapeResult.failure("a name to define", ShapeMatcher.describe(null));
        }
        int firstChild = ShapeMatcher.isStringLiteral(invocation.argument(1)) ? 2 : 1;

        return ShapeResult.success(invocation.synthesizer().declaration(name, invocation.argumentsFrom(firstChild)));
    }
}
