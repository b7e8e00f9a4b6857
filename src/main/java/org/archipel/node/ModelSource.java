package org.archipel.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import org.archipel.evolution.ConfigurationException;
import org.archipel.evolution.Model;

import java.io.Serializable;
import java.lang.reflect.InvocationTargetException;

/**
 * Describes how to build a model in any process: the {@link IModelProvider} class and its
 * options, rendered as HOCON.
 *
 * @param providerClass The fully qualified provider class name.
 * @param options       The provider options as HOCON text.
 */
public record ModelSource(String providerClass, String options) implements Serializable {

    public ModelSource {
        if (providerClass == null || providerClass.isBlank()) {
            throw new ConfigurationException("model provider class must not be blank");
        }
        options = options == null ? "{}" : options;
    }

    public static ModelSource of(String providerClass, Config options) {
        return new ModelSource(providerClass, options.root().render(ConfigRenderOptions.concise()));
    }

    /**
     * Reads {@code provider} and {@code options} from the {@code archipel.model} section.
     */
    public static ModelSource fromConfig(Config model) {
        Config options = model.hasPath("options") ? model.getConfig("options") : ConfigFactory.empty();
        return of(model.getString("provider"), options);
    }

    public Config optionsConfig() {
        try {
            return ConfigFactory.parseString(options).resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("invalid options for model provider " + providerClass, e);
        }
    }

    /**
     * Instantiates the provider and builds the model.
     *
     * @return The model.
     * @throws ConfigurationException if the provider cannot be instantiated or rejects its options.
     */
    public Model load() {
        IModelProvider provider;
        try {
            Class<?> type = Class.forName(providerClass);
            if (!IModelProvider.class.isAssignableFrom(type)) {
                throw new ConfigurationException(String.format(
                    "class %s does not implement %s", providerClass, IModelProvider.class.getSimpleName()));
            }
            provider = (IModelProvider) type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("model provider class not found: " + providerClass, e);
        } catch (NoSuchMethodException e) {
            throw new ConfigurationException(String.format(
                "model provider %s needs a public no-argument constructor", providerClass), e);
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new ConfigurationException("failed to instantiate model provider " + providerClass, e);
        }
        try {
            return provider.createModel(optionsConfig());
        } catch (ConfigException e) {
            throw new ConfigurationException(String.format(
                "invalid options for model provider %s: %s", providerClass, e.getMessage()), e);
        }
    }
}
