package org.archipel.cli.commands;

import com.typesafe.config.Config;
import org.archipel.node.ModelSource;

final class ModelCommands {

    private ModelCommands() {
    }

    /**
     * Reads the model source from {@code archipel.model}, with an optional provider override.
     */
    static ModelSource modelSource(final Config config, final String providerOverride) {
        final ModelSource configured = ModelSource.fromConfig(config.getConfig("archipel.model"));
        return providerOverride == null
            ? configured
            : new ModelSource(providerOverride, configured.options());
    }
}
