package de.bsommerfeld.landcover.core.config;

/**
 * Thrown when the configuration file cannot be read, parsed or written.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
