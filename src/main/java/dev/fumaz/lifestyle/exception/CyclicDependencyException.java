package dev.fumaz.lifestyle.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a construction call chain re-enters its own in-progress construction.
 */
public class CyclicDependencyException extends ActivationException {

    private final @NotNull Class<?> type;

    public CyclicDependencyException(@NotNull Class<?> type) {
        super("The configuration is invalid. The type " + type.getName()
                + " is directly or indirectly depending on itself.");
        this.type = type;
    }

    public @NotNull Class<?> getType() {
        return type;
    }
}
