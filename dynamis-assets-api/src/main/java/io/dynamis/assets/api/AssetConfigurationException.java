package io.dynamis.assets.api;

/**
 * Thrown when asset configuration is invalid: duplicate asset class registration,
 * a missing required key or section, an unknown group type.
 *
 * Raised at startup on the caller thread. Not retried.
 */
public class AssetConfigurationException extends RuntimeException {

    public AssetConfigurationException(String message) {
        super(message);
    }

    public AssetConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
