package org.macrohooks.rules;

import org.macrohooks.rules.features.binding.ConfigMapBindingRule;
import org.macrohooks.rules.features.binding.FixedTripleBindingRule;
import org.macrohooks.rules.features.binding.FlatPairBindingRule;
import org.macrohooks.rules.features.binding.OptionalConfigRule;
import org.macrohooks.rules.features.binding.OptionalConfigSymbolRule;
import org.macrohooks.rules.features.binding.SingleResourceBindingRule;
import org.macrohooks.rules.features.body.BodyPassthroughRule;
import org.macrohooks.rules.features.body.DocSkippingBodyRule;
import org.macrohooks.rules.features.body.LabelStrippingRule;
import org.macrohooks.rules.features.def.DocSkippingDefinitionRule;
import org.macrohooks.rules.features.fn.ParameterCaptureRule;

import java.util.Arrays;
import java.util.Optional;

/**
 * The macro families of the rewrite catalog, each backed by one shared rule instance.
 * The id is the name used to refer to a family from configuration.
 */
public enum RuleFamily {
    SINGLE_RESOURCE_BINDING("single-resource-binding", new SingleResourceBindingRule()),
    FLAT_PAIR_BINDING("flat-pair-binding", new FlatPairBindingRule()),
    CONFIG_MAP_BINDING("config-map-binding", new ConfigMapBindingRule()),
    OPTIONAL_CONFIG("optional-config", new OptionalConfigRule()),
    OPTIONAL_CONFIG_SYMBOL("optional-config-symbol", new OptionalConfigSymbolRule()),
    FIXED_TRIPLE_BINDING("fixed-triple-binding", new FixedTripleBindingRule()),
    LABEL_STRIPPING("label-stripping", new LabelStrippingRule()),
    DOC_SKIPPING_DEFINITION("doc-skipping-definition", new DocSkippingDefinitionRule()),
    DOC_SKIPPING_BODY("doc-skipping-body", new DocSkippingBodyRule()),
    BODY_PASSTHROUGH("body-passthrough", new BodyPassthroughRule()),
    PARAMETER_CAPTURE("parameter-capture", new ParameterCaptureRule());

    private final String id;
    private final IRewriteRule rule;

    RuleFamily(String id, IRewriteRule rule) {
        this.id = id;
        this.rule = rule;
    }

    public String id() {
        return id;
    }

    public IRewriteRule rule() {
        return rule;
    }

    /**
     * @param id A family id such as "label-stripping".
     * @return The family, or empty if the id is unknown.
     */
    public static Optional<RuleFamily> fromId(String id) {
        return Arrays.stream(values()).filter(f -> f.id.equals(id)).findFirst();
    }
}
