package dev.fumaz.lifestyle.reflection;

import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;

/**
 * Builds the creator of a registration's implementation type.
 */
@FunctionalInterface
public interface ConstructionBehavior {

    /**
     * Called once per registration, before its first instance is created. The returned provider must create
     * a new instance on every call; caching is left to the registration's lifestyle.
     *
     * @param registration a registration with a non-null implementation type
     * @param <T>          the service type
     * @return a provider creating new instances of the implementation type
     */
    <T> @NotNull Provider<? extends T> createCreator(@NotNull Registration<T> registration);

}
