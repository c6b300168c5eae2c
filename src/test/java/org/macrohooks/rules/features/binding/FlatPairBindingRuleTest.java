package org.macrohooks.rules.features.binding;

import org.macrohooks.ast.Node;
import org.macrohooks.rules.Invocation;
import org.macrohooks.shape.ShapeResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.macrohooks.testkit.Forms.invocation;
import static org.macrohooks.testkit.Forms.list;
import static org.macrohooks.testkit.Forms.print;

@Tag("unit")
class FlatPairBindingRuleTest {

    private final FlatPairBindingRule rule = new FlatPairBindingRule();

    @Test
    void bindingVectorIsPassedThroughUnchanged() {
        Invocation inv = invocation("(with-api-contexts [a (ctx 1) b (ctx 2)] (use a b))");

        Node result = rule.rewrite(inv).value();

        assertThat(print(result)).isEqualTo("(let [a (ctx 1) b (ctx 2)] (use a b))");
        assertThat(list(result).children().get(1)).isSameAs(inv.argument(0));
    }

    @Test
    void emptyVectorIsAccepted() {
        assertThat(print(rule.rewrite(invocation("(with-api-contexts [] (x))")).value()))
                .isEqualTo("(let [] (x))");
    }

    @Test
    void oddVectorOrMissingVectorIsAViolation() {
        ShapeResult<Node> odd = rule.rewrite(invocation("(with-api-contexts [a (ctx) b] (x))"));
        ShapeResult<Node> map = rule.rewrite(invocation("(with-api-contexts {:a 1} (x))"));

        assertThat(odd.violation().expected()).isEqualTo("a binding vector with an even number of elements");
        assertThat(odd.violation().received()).isEqualTo("vector of 3");
        assertThat(map.violation().received()).isEqualTo("map");
    }
}
