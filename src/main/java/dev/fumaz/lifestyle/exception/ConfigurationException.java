package dev.fumaz.lifestyle.exception;

/**
 * Indicates an invalid registration or container configuration.
 */
public class ConfigurationException extends LifestyleException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }
}
