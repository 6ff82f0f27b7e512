package dev.fumaz.lifestyle.exception;

/**
 * Signals that the container itself was unable to produce an instance.
 */
public class ActivationException extends LifestyleException {

    public ActivationException(String message) {
        super(message);
    }

    public ActivationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ActivationException(Throwable cause) {
        super(cause);
    }
}
