package org.macrohooks.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the catalog adjustments a project makes to the built-in macro rules.
 * <p>
 * Layers, highest priority first: environment variables, JVM system properties, the project's
 * {@value #PROJECT_FILE} and the bundled {@code reference.conf}. A project file that is missing
 * or not a regular file contributes nothing.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the per-project file, looked up in the working directory by {@link #load()}. */
    public static final String PROJECT_FILE = "macro-hooks.conf";

    private ConfigLoader() {}

    /**
     * @return The merged configuration using {@value #PROJECT_FILE} from the working directory.
     */
    public static Config load() {
        return load(Path.of(PROJECT_FILE));
    }

    /**
     * @param projectFile The project file to layer between system properties and the defaults.
     * @return The merged, resolved configuration.
     */
    public static Config load(Path projectFile) {
        List<Config> layers = List.of(
                ConfigFactory.systemEnvironment(),
                ConfigFactory.systemProperties(),
                projectLayer(projectFile),
                ConfigFactory.parseResources("reference.conf"));

        Config merged = ConfigFactory.empty();
        for (Config layer : layers) {
            merged = merged.withFallback(layer);
        }
        return merged.resolve();
    }

    /**
     * Shortcut for {@code CatalogSettings.from(load(projectFile))}.
     *
     * @param projectFile The project file.
     * @return The catalog settings ready for the rule registry.
     */
    public static CatalogSettings loadSettings(Path projectFile) {
        return CatalogSettings.from(load(projectFile));
    }

    private static Config projectLayer(Path projectFile) {
        if (!Files.isRegularFile(projectFile)) {
            LOG.debug("No macro catalog file at '{}', using the built-in catalog as is", projectFile);
            return ConfigFactory.empty();
        }
        LOG.info("Reading macro catalog adjustments from {}", projectFile.toAbsolutePath());
        return ConfigFactory.parseFile(projectFile.toFile());
    }
}
