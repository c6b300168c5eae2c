package org.macrohooks.rules;

import org.macrohooks.config.CatalogSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A registry for rewrite rules. This class holds a map of fully qualified macro names
 * to the rule that rewrites their invocations.
 * <p>
 * A registry is assembled through a {@link Builder} and is read-only afterwards, so it can be
 * shared by any number of analysis threads once constructed.
 */
public final class RewriteRuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteRuleRegistry.class);

    private static final String CORE = "com.blockether.spel.core/";
    private static final String API = "com.blockether.spel.api/";
    private static final String ALLURE = "com.blockether.spel.allure/";

    private final Map<String, IRewriteRule> rules;

    private RewriteRuleRegistry(Map<String, IRewriteRule> rules) {
        this.rules = Map.copyOf(rules);
    }

    /**
     * Gets the rule for a given macro name.
     * @param macroName The fully qualified macro name, e.g. "com.blockether.spel.allure/step".
     * @return An {@link Optional} containing the rule if it exists, otherwise empty.
     */
    public Optional<IRewriteRule> lookup(String macroName) {
        return Optional.ofNullable(rules.get(macroName));
    }

    /**
     * @return The registered macro names.
     */
    public Set<String> names() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }

    /**
     * @return A builder for an empty registry.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Initializes the registry with the built-in catalog.
     * @return A new registry with all built-in rules registered.
     */
    public static RewriteRuleRegistry initialize() {
        return initialize(CatalogSettings.DEFAULTS);
    }

    /**
     * Initializes the registry with the built-in catalog adjusted by configuration:
     * disabled names are removed, then aliases are registered onto their families.
     *
     * @param settings The catalog settings.
     * @return A new registry.
     */
    public static RewriteRuleRegistry initialize(CatalogSettings settings) {
        Builder builder = builtIns();
        for (String disabled : settings.disabled()) {
            if (!builder.rules.containsKey(disabled)) {
                LOG.warn("Cannot disable '{}': no such built-in macro", disabled);
            }
            builder.rules.remove(disabled);
        }
        settings.aliases().forEach((macroName, family) -> {
            if (builder.rules.containsKey(macroName)) {
                LOG.warn("Alias '{}' replaces an existing rule with family '{}'", macroName, family.id());
            }
            builder.register(macroName, family.rule());
        });
        RewriteRuleRegistry registry = builder.build();
        LOG.info("Rewrite registry initialized with {} macros ({} aliases, {} disabled)",
                registry.size(), settings.aliases().size(), settings.disabled().size());
        return registry;
    }

    private static Builder builtIns() {
        Builder b = builder();

        // Resource lifecycle: (with-x [sym expr?] body...)
        b.register(CORE + "with-playwright", RuleFamily.SINGLE_RESOURCE_BINDING);
        b.register(CORE + "with-browser", RuleFamily.SINGLE_RESOURCE_BINDING);
        b.register(CORE + "with-context", RuleFamily.SINGLE_RESOURCE_BINDING);
        b.register(CORE + "with-page", RuleFamily.SINGLE_RESOURCE_BINDING);
        b.register(API + "with-api-context", RuleFamily.SINGLE_RESOURCE_BINDING);

        b.register(API + "with-api-contexts", RuleFamily.FLAT_PAIR_BINDING);
        b.register(API + "with-hooks", RuleFamily.CONFIG_MAP_BINDING);
        b.register(API + "with-retry", RuleFamily.OPTIONAL_CONFIG);
        b.register(CORE + "with-testing-page", RuleFamily.OPTIONAL_CONFIG_SYMBOL);
        b.register(API + "with-testing-api", RuleFamily.OPTIONAL_CONFIG_SYMBOL);
        b.register(API + "with-page-api", RuleFamily.FIXED_TRIPLE_BINDING);

        // Steps
        b.register(ALLURE + "step", RuleFamily.LABEL_STRIPPING);
        b.register(ALLURE + "ui-step", RuleFamily.DOC_SKIPPING_BODY);
        b.register(ALLURE + "api-step", RuleFamily.DOC_SKIPPING_BODY);

        // Test definition
        b.register(ALLURE + "defdescribe", RuleFamily.DOC_SKIPPING_DEFINITION);
        b.register(ALLURE + "describe", RuleFamily.DOC_SKIPPING_BODY);
        b.register(ALLURE + "context", RuleFamily.DOC_SKIPPING_BODY);
        b.register(ALLURE + "it", RuleFamily.DOC_SKIPPING_BODY);
        b.register(ALLURE + "specify", RuleFamily.DOC_SKIPPING_BODY);
        b.register(ALLURE + "expect-it", RuleFamily.DOC_SKIPPING_BODY);

        // Assertions and hooks
        b.register(ALLURE + "expect", RuleFamily.BODY_PASSTHROUGH);
        b.register(ALLURE + "should", RuleFamily.BODY_PASSTHROUGH);
        b.register(ALLURE + "before", RuleFamily.BODY_PASSTHROUGH);
        b.register(ALLURE + "after", RuleFamily.BODY_PASSTHROUGH);
        b.register(ALLURE + "before-each", RuleFamily.BODY_PASSTHROUGH);
        b.register(ALLURE + "after-each", RuleFamily.BODY_PASSTHROUGH);
        b.register(ALLURE + "around", RuleFamily.PARAMETER_CAPTURE);

        return b;
    }

    /**
     * Collects registrations before the registry is frozen.
     */
    public static final class Builder {
        private final Map<String, IRewriteRule> rules = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a rule for a macro name, replacing any earlier registration.
         * @param macroName The fully qualified macro name.
         * @param rule The rule rewriting its invocations.
         * @return This builder.
         */
        public Builder register(String macroName, IRewriteRule rule) {
            rules.put(Objects.requireNonNull(macroName, "macroName"), Objects.requireNonNull(rule, "rule"));
            return this;
        }

        /**
         * Registers the shared rule of a family for a macro name.
         */
        public Builder register(String macroName, RuleFamily family) {
            return register(macroName, family.rule());
        }

        public RewriteRuleRegistry build() {
            return new RewriteRuleRegistry(rules);
        }
    }
}
