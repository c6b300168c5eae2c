package org.macrohooks.config;

import com.typesafe.config.ConfigFactory;
import org.macrohooks.rules.RewriteRuleRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConfigLoaderTest {

    private static final String MARKER = "macro-hooks.loader-test-marker";

    @AfterEach
    void clearProperties() {
        System.clearProperty(MARKER);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void missingFileFallsBackToReferenceDefaults(@TempDir Path dir) {
        assertThat(ConfigLoader.loadSettings(dir.resolve("absent.conf"))).isEqualTo(CatalogSettings.DEFAULTS);
    }

    @Test
    void projectFileAdjustsTheCatalog(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve(ConfigLoader.PROJECT_FILE), """
                macro-hooks {
                  disabled = ["com.blockether.spel.allure/step"]
                  aliases = [{ macro = "my.db/with-conn", family = "single-resource-binding" }]
                }
                """);

        RewriteRuleRegistry registry = RewriteRuleRegistry.initialize(ConfigLoader.loadSettings(file));

        assertThat(registry.lookup("com.blockether.spel.allure/step")).isEmpty();
        assertThat(registry.lookup("my.db/with-conn")).isPresent();
    }

    @Test
    void systemPropertiesOverrideFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve(ConfigLoader.PROJECT_FILE), MARKER + " = file");
        System.setProperty(MARKER, "property");
        ConfigFactory.invalidateCaches();

        assertThat(ConfigLoader.load(file).getString(MARKER)).isEqualTo("property");
    }

    @Test
    void directoryIsIgnored(@TempDir Path dir) {
        assertThat(ConfigLoader.load(dir).getStringList("macro-hooks.disabled")).isEmpty();
    }
}
