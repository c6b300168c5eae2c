package org.macrohooks.rules.features.binding;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.Binding;
import org.macrohooks.shape.ShapeMatcher;
import org.macrohooks.shape.ShapeResult;
import org.macrohooks.synth.FormSynthesizer;

import java.util.List;

/**
 * Rule for <code>(with-page-api pg opts [sym] body...)</code>, rewritten to
 * <code>(let [pg pg opts opts sym nil] body...)</code>.
 * <p>
 * The two leading expressions are bound to themselves so they are analyzed in place
 * without being renamed.
 */
public class FixedTripleBindingRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        if (invocation.argumentCount() < 3) {
            return ShapeResult.failure("two expressions followed by a binding vector",
                    invocation.argumentCount() + (invocation.argumentCount() == 1 ? " argument" : " arguments"));
        }
        Node first = invocation.argument(0);
        Node second = invocation.argument(1);
        FormSynthesizer synth = invocation.synthesizer();

        return ShapeMatcher.matchBindingVector(invocation.argument(2), 1, 1)
                .map(spec -> synth.binding(
                        List.of(new Binding(first, first),
                                new Binding(second, second),
                                new Binding(spec.first().symbol(), synth.nil())),
                        invocation.argumentsFrom(3)));
    }
}
