package org.macrohooks.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.macrohooks.rules.RuleFamily;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Adjustments to the built-in rewrite catalog, read from the {@code macro-hooks} section:
 * <pre>
 * macro-hooks {
 *   disabled = ["com.blockether.spel.allure/around"]
 *   aliases = [
 *     { macro = "my.app.db/with-connection", family = "single-resource-binding" }
 *   ]
 * }
 * </pre>
 *
 * @param disabled Built-in macro names that must not be rewritten.
 * @param aliases Additional macro names, each mapped to a built-in family, in declaration order.
 */
public record CatalogSettings(List<String> disabled, Map<String, RuleFamily> aliases) {

    /** The configuration path of the section. */
    public static final String PATH = "macro-hooks";

    /** Settings leaving the built-in catalog untouched. */
    public static final CatalogSettings DEFAULTS = new CatalogSettings(List.of(), Map.of());

    public CatalogSettings {
        disabled = List.copyOf(disabled);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    /**
     * Reads the settings from a configuration.
     *
     * @param config A configuration containing the {@code macro-hooks} section (reference.conf provides it).
     * @return The settings.
     * @throws ConfigException.BadValue if an alias names an unknown family.
     */
    public static CatalogSettings from(Config config) {
        Config section = config.getConfig(PATH);
        List<String> disabled = section.getStringList("disabled");

        Map<String, RuleFamily> aliases = new LinkedHashMap<>();
        for (Config alias : section.getConfigList("aliases")) {
            String macro = alias.getString("macro");
            String familyId = alias.getString("family");
            RuleFamily family = RuleFamily.fromId(familyId).orElseThrow(() -> new ConfigException.BadValue(
                    alias.origin(), "family",
                    "Unknown rule family '" + familyId + "' for macro '" + macro + "', expected one of "
                            + Arrays.stream(RuleFamily.values()).map(RuleFamily::id).collect(Collectors.joining(", "))));
            aliases.put(macro, family);
        }
        return new CatalogSettings(disabled, aliases);
    }
}
