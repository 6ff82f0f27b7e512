package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.provider.Provider;
import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;

import java.util.function.BooleanSupplier;

/**
 * A {@link Lifestyle} is a caching policy that decides how many instances of a registered service exist and
 * when they are created.
 * <p>
 * Every {@code createRegistration} call yields a new {@link Registration}, even for the same service and
 * container. Only the instances a registration produces are cached, never the registration itself.
 */
public abstract class Lifestyle {

    /**
     * Creates a new instance on every request.
     */
    public static final Lifestyle TRANSIENT = new TransientLifestyle();

    /**
     * Creates at most one instance per registration, and so per container.
     */
    public static final Lifestyle SINGLETON = new SingletonLifestyle();

    private final @NotNull String name;

    protected Lifestyle(@NotNull String name) {
        this.name = Requires.isNotNullOrEmpty(name, "name");
    }

    public static @NotNull Lifestyle createHybrid(@NotNull BooleanSupplier lifestyleSelector,
                                                  @NotNull Lifestyle trueLifestyle,
                                                  @NotNull Lifestyle falseLifestyle) {
        Requires.isNotNull(lifestyleSelector, "lifestyleSelector");
        Requires.isNotNull(trueLifestyle, "trueLifestyle");
        Requires.isNotNull(falseLifestyle, "falseLifestyle");

        return new HybridLifestyle(lifestyleSelector, trueLifestyle, falseLifestyle);
    }

    public static @NotNull ScopedLifestyle createHybrid(@NotNull BooleanSupplier lifestyleSelector,
                                                        @NotNull ScopedLifestyle trueLifestyle,
                                                        @NotNull ScopedLifestyle falseLifestyle) {
        Requires.isNotNull(lifestyleSelector, "lifestyleSelector");
        Requires.isNotNull(trueLifestyle, "trueLifestyle");
        Requires.isNotNull(falseLifestyle, "falseLifestyle");

        return new ScopedHybridLifestyle(lifestyleSelector, trueLifestyle, falseLifestyle);
    }

    public static @NotNull Lifestyle createCustom(@NotNull String name,
                                                  @NotNull LifestyleApplierFactory lifestyleApplierFactory) {
        Requires.isNotNullOrEmpty(name, "name");
        Requires.isNotNull(lifestyleApplierFactory, "lifestyleApplierFactory");

        return new CustomLifestyle(name, lifestyleApplierFactory);
    }

    /**
     * Returns whether a component with the {@code consumer} lifestyle may outlive a dependency with the
     * {@code dependency} lifestyle, which would keep that dependency alive for too long.
     */
    public static boolean hasLifestyleMismatch(@NotNull Lifestyle consumer, @NotNull Lifestyle dependency) {
        Requires.isNotNull(consumer, "consumer");
        Requires.isNotNull(dependency, "dependency");

        return consumer.getComponentLength() > dependency.getDependencyLength();
    }

    public @NotNull String getName() {
        return name;
    }

    /**
     * The length used when this lifestyle is the lifestyle of the consuming component.
     */
    public int getComponentLength() {
        return getLength();
    }

    /**
     * The length used when this lifestyle is the lifestyle of a dependency.
     */
    public int getDependencyLength() {
        return getLength();
    }

    protected abstract int getLength();

    public <T> @NotNull InstanceProducer<T> createProducer(@NotNull Class<T> concreteType,
                                                           @NotNull Container container) {
        return new InstanceProducer<>(concreteType, createRegistration(concreteType, container));
    }

    public <T> @NotNull InstanceProducer<T> createProducer(@NotNull Class<T> serviceType,
                                                           @NotNull Class<? extends T> implementationType,
                                                           @NotNull Container container) {
        return new InstanceProducer<>(serviceType, createRegistration(serviceType, implementationType, container));
    }

    public <T> @NotNull InstanceProducer<T> createProducer(@NotNull Class<T> serviceType,
                                                           @NotNull Provider<? extends T> instanceCreator,
                                                           @NotNull Container container) {
        return new InstanceProducer<>(serviceType, createRegistration(serviceType, instanceCreator, container));
    }

    public <T> @NotNull Registration<T> createRegistration(@NotNull Class<T> concreteType,
                                                           @NotNull Container container) {
        Requires.isNotNull(concreteType, "concreteType");

        return createRegistration(concreteType, concreteType, container);
    }

    public <T> @NotNull Registration<T> createRegistration(@NotNull Class<T> serviceType,
                                                           @NotNull Class<? extends T> implementationType,
                                                           @NotNull Container container) {
        Requires.isNotNull(serviceType, "serviceType");
        Requires.isNotNull(implementationType, "implementationType");
        Requires.isNotNull(container, "container");

        Requires.isReferenceType(serviceType, "serviceType");
        Requires.isReferenceType(implementationType, "implementationType");
        Requires.serviceIsAssignableFromImplementation(serviceType, implementationType, "implementationType");
        Requires.isConcreteType(implementationType, "implementationType");

        return new Registration<>(this, serviceType, implementationType, null, container);
    }

    public <T> @NotNull Registration<T> createRegistration(@NotNull Class<T> serviceType,
                                                           @NotNull Provider<? extends T> instanceCreator,
                                                           @NotNull Container container) {
        Requires.isNotNull(serviceType, "serviceType");
        Requires.isNotNull(instanceCreator, "instanceCreator");
        Requires.isNotNull(container, "container");

        Requires.isReferenceType(serviceType, "serviceType");

        return new Registration<>(this, serviceType, null, instanceCreator, container);
    }

    /**
     * Wraps the guarded creator of a single registration in this lifestyle's caching policy. Called exactly
     * once per {@link Registration}, while it is being created; any state the returned provider holds is
     * private to that registration.
     *
     * @param registration the registration being created
     * @param creator      produces a fresh instance on every call, guarded against cyclic construction
     * @param <T>          the service type
     * @return the provider the registration will resolve instances through
     */
    protected abstract <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                                       @NotNull Provider<T> creator);

    @Override
    public String toString() {
        return name;
    }
}
