package org.macrohooks.rules.features.binding;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.IRewriteRule;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.Binding;
import org.macrohooks.shape.ShapeResult;
import org.macrohooks.synth.FormSynthesizer;

import java.util.List;

/**
 * Rule for macros with an optional leading options argument, switched on arity.
 * <pre>
 *   (with-retry (call))          → (do (call))
 *   (with-retry opts (call) ...) → (let [_ opts] (call) ...)
 * </pre>
 */
public class OptionalConfigRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        FormSynthesizer synth = invocation.synthesizer();
        if (invocation.argumentCount() <= 1) {
            return ShapeResult.success(synth.sequence(invocation.arguments()));
        }
        return ShapeResult.success(synth.binding(
                List.of(new Binding(synth.anonymous(), invocation.argument(0))),
                invocation.argumentsFrom(1)));
    }
}
