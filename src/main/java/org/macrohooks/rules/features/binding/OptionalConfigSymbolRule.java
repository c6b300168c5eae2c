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
 * Rule for macros taking an optional options expression before a one-symbol binding vector.
 * <pre>
 *   (with-testing-page [pg] body...)      → (let [_ {} pg nil] body...)
 *   (with-testing-page opts [pg] body...) → (let [_ opts pg nil] body...)
 * </pre>
 * Whether the options were given is decided by the shape of the first argument.
 */
public class OptionalConfigSymbolRule implements IRewriteRule {

    @Override
    public ShapeResult<Node> rewrite(Invocation invocation) {
        FormSynthesizer synth = invocation.synthesizer();
        boolean configOmitted = ShapeMatcher.isVectorShaped(invocation.argument(0));
        int vectorIndex = configOmitted ? 0 : 1;
        Node config = configOmitted ? synth.emptyMap() : invocation.argument(0);

        return ShapeMatcher.matchBindingVector(invocation.argument(vectorIndex), 1, 1)
                .map(spec -> synth.binding(
                        List.of(new Binding(synth.anonymous(), config),
                                new Binding(spec.first().symbol(), synth.nil())),
                        invocation.argumentsFrom(vectorIndex + 1)));
    }
}
