package dev.fumaz.lifestyle.container;

import dev.fumaz.lifestyle.InstanceProducer;
import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A {@link Container} holds the registrations of an application and resolves instances from them.
 * <p>
 * Registrations and their cached instances are scoped to the container they were created for: two
 * containers never share a singleton.
 */
public interface Container {

    static @NotNull Container create() {
        return create(ContainerOptions.defaults());
    }

    static @NotNull Container create(@NotNull ContainerOptions options) {
        return new DefaultContainer(options);
    }

    <T> void register(@NotNull Class<T> serviceType, @NotNull Class<? extends T> implementationType);

    <T> void register(@NotNull Class<T> serviceType,
                      @NotNull Class<? extends T> implementationType,
                      @NotNull Lifestyle lifestyle);

    <T> void register(@NotNull Class<T> serviceType,
                      @NotNull Provider<? extends T> instanceCreator,
                      @NotNull Lifestyle lifestyle);

    <T> void registerSingleton(@NotNull Class<T> serviceType, @NotNull T instance);

    /**
     * Adds a registration created by a {@link Lifestyle} for this container.
     *
     * @throws IllegalArgumentException when the registration belongs to another container
     */
    <T> void addRegistration(@NotNull Class<T> serviceType, @NotNull Registration<? extends T> registration);

    <T> @NotNull T getInstance(@NotNull Class<T> serviceType);

    /**
     * @return the explicitly registered producer for {@code serviceType}, or {@code null}
     */
    <T> @Nullable InstanceProducer<T> getProducer(@NotNull Class<T> serviceType);

    @NotNull List<InstanceProducer<?>> getProducers();

    @NotNull ContainerOptions getOptions();

    /**
     * @return whether the container has resolved an instance and no longer accepts registrations
     */
    boolean isLocked();

    default <T> void register(@NotNull Class<T> concreteType) {
        register(concreteType, concreteType);
    }

}
