package org.archipel.node;

import com.typesafe.config.Config;
import org.archipel.evolution.Model;

/**
 * Builds a model from configuration. Implementations need a public no-argument constructor,
 * since every node of a distributed run instantiates the provider reflectively and builds
 * its own copy of the model.
 */
public interface IModelProvider {

    /**
     * @param options The provider-specific options.
     * @return The model.
     */
    Model createModel(Config options);
}
