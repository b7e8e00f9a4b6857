package org.archipel.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the node configuration. Highest precedence first: environment variables, system
 * properties, the configuration file, {@code reference.conf}.
 *
 * <p>The merged {@code archipel} section is checked against {@code reference.conf}, so a
 * missing key or a value of the wrong type fails at startup rather than when a component
 * reads it.</p>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "archipel.conf";
    private static final String ROOT_PATH = "archipel";

    private ConfigLoader() {
    }

    /**
     * Loads {@code archipel.conf} from the working directory, if present.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile A HOCON file; ignored when it does not exist.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed, a substitution
     *                                             cannot be resolved or a value has the wrong type.
     */
    public static Config load(final File configFile) {
        final Config reference = ConfigFactory.parseResources(ConfigLoader.class.getClassLoader(), "reference.conf");
        final Config merged = ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(parseFile(configFile))
            .withFallback(reference)
            .resolve();
        merged.checkValid(reference.resolve(), ROOT_PATH);
        return merged;
    }

    private static Config parseFile(final File configFile) {
        if (!configFile.isFile()) {
            LOG.debug("No configuration file at {}, using defaults", configFile.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
        return ConfigFactory.parseFile(configFile);
    }
}
