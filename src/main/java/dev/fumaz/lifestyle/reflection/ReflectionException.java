package dev.fumaz.lifestyle.reflection;

import dev.fumaz.lifestyle.exception.ConfigurationException;

public class ReflectionException extends ConfigurationException {

    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
