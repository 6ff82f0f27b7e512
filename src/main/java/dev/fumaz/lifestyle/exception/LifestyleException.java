package dev.fumaz.lifestyle.exception;

/**
 * Base unchecked exception for lifestyle and container failures.
 */
public class LifestyleException extends RuntimeException {

    public LifestyleException(String message) {
        super(message);
    }

    public LifestyleException(String message, Throwable cause) {
        super(message, cause);
    }

    public LifestyleException(Throwable cause) {
        super(cause);
    }
}
