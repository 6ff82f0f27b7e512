package dev.fumaz.lifestyle.provider;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link Provider} is a zero-argument source of instances.
 *
 * @param <T> the type of the instances
 */
@FunctionalInterface
public interface Provider<T> {

    static <T> @NotNull Provider<T> instance(T instance) {
        return () -> instance;
    }

    static <T> @NotNull Provider<T> singleton(@NotNull Provider<T> creator) {
        return new SingletonProvider<>(creator);
    }

    T provide();

}
