package org.archipel.evolution;

/**
 * Base type for errors detected while a model, pipeline, operation or topology is being
 * built. A configuration error is never retried: the definition has to be fixed and rebuilt.
 */
public class ConfigurationException extends IllegalArgumentException {

    /**
     * Constructs a new configuration exception with the specified detail message.
     *
     * @param message the detail message explaining what is misconfigured
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     *
     * @param message the detail message explaining what is misconfigured
     * @param cause   the underlying cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
