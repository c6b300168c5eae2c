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
 * Rule for macros whose first argument is a configuration expression, not a binding vector:
 * <code>(with-hooks {:on-request f} body...)</code> becomes <code>(let [_ {:on-request f}] body...)</code>.
 * Binding the expression to the anonymous symbol makes the analyzer check its references
 * without introducing a named local.
 */
public class ConfigMapBindingRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        Node config = invocation.argument(0);
        if (config == null) {
            return ShapeResult.failure("a configuration expression", ShapeMatcher.describe(null));
        }
        FormSynthesizer synth = invocation.synthesizer();
        return ShapeResult.success(synth.binding(
                List.of(new Binding(synth.anonymous(), config)),
                invocation.argumentsFrom(1)));
    }
}
