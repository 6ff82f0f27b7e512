package dev.fumaz.lifestyle.container;

import dev.fumaz.lifestyle.InstanceProducer;
import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.exception.ActivationException;
import dev.fumaz.lifestyle.exception.ConfigurationException;
import dev.fumaz.lifestyle.provider.Provider;
import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Default {@link Container}. Unregistered concrete types are resolved as {@link Lifestyle#TRANSIENT}; the
 * container stops accepting registrations once it has resolved its first instance.
 */
public class DefaultContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(DefaultContainer.class.getName());

    private final @NotNull ContainerOptions options;
    private final @NotNull ConcurrentMap<Class<?>, InstanceProducer<?>> producers;
    private final @NotNull ConcurrentMap<Class<?>, InstanceProducer<?>> implicitProducers;
    private final Object registrationLock = new Object();
    private volatile boolean locked;

    public DefaultContainer(@NotNull ContainerOptions options) {
        this.options = Requires.isNotNull(options, "options");
        this.producers = new ConcurrentHashMap<>();
        this.implicitProducers = new ConcurrentHashMap<>();
    }

    @Override
    public <T> void register(@NotNull Class<T> serviceType, @NotNull Class<? extends T> implementationType) {
        register(serviceType, implementationType, options.getDefaultLifestyle());
    }

    @Override
    public <T> void register(@NotNull Class<T> serviceType,
                             @NotNull Class<? extends T> implementationType,
                             @NotNull Lifestyle lifestyle) {
        Requires.isNotNull(lifestyle, "lifestyle");

        addRegistration(serviceType, lifestyle.createRegistration(serviceType, implementationType, this));
    }

    @Override
    public <T> void register(@NotNull Class<T> serviceType,
                             @NotNull Provider<? extends T> instanceCreator,
                             @NotNull Lifestyle lifestyle) {
        Requires.isNotNull(lifestyle, "lifestyle");

        addRegistration(serviceType, lifestyle.createRegistration(serviceType, instanceCreator, this));
    }

    @Override
    public <T> void registerSingleton(@NotNull Class<T> serviceType, @NotNull T instance) {
        Requires.isNotNull(instance, "instance");

        addRegistration(serviceType, Lifestyle.SINGLETON.createRegistration(serviceType, Provider.instance(instance),
                this));
    }

    @Override
    public <T> void addRegistration(@NotNull Class<T> serviceType, @NotNull Registration<? extends T> registration) {
        Requires.isNotNull(serviceType, "serviceType");
        Requires.isNotNull(registration, "registration");

        if (registration.getContainer() != this) {
            throw new IllegalArgumentException("The supplied registration belongs to a different container."
                    + "\nparamName: registration");
        }

        Requires.serviceIsAssignableFromImplementation(serviceType, registration.getServiceType(), "registration");

        synchronized (registrationLock) {
            if (locked) {
                throw new ConfigurationException("The container can't be changed after the first call to "
                        + "getInstance. Registration of " + serviceType.getName() + " is not allowed.");
            }

            if (!options.isAllowOverridingRegistrations() && producers.containsKey(serviceType)) {
                throw new ConfigurationException("Type " + serviceType.getName() + " has already been registered"
                        + " and the container is currently not configured to allow overriding registrations.");
            }

            producers.put(serviceType, new InstanceProducer<>(serviceType, registration));
        }

        LOGGER.fine(() -> "Registered " + serviceType.getName() + " as " + registration.getLifestyle().getName());
    }

    @Override
    public <T> @NotNull T getInstance(@NotNull Class<T> serviceType) {
        Requires.isNotNull(serviceType, "serviceType");
        lock();

        InstanceProducer<T> producer = getProducer(serviceType);

        if (producer == null) {
            producer = getImplicitProducer(serviceType);
        }

        return producer.getInstance();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @Nullable InstanceProducer<T> getProducer(@NotNull Class<T> serviceType) {
        Requires.isNotNull(serviceType, "serviceType");

        return (InstanceProducer<T>) producers.get(serviceType);
    }

    @Override
    public @NotNull List<InstanceProducer<?>> getProducers() {
        return new ArrayList<>(producers.values());
    }

    @Override
    public @NotNull ContainerOptions getOptions() {
        return options;
    }

    @Override
    public boolean isLocked() {
        return locked;
    }

    private void lock() {
        if (locked) {
            return;
        }

        synchronized (registrationLock) {
            if (!locked) {
                locked = true;
                LOGGER.fine("Container locked after its first resolution");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <T> @NotNull InstanceProducer<T> getImplicitProducer(@NotNull Class<T> serviceType) {
        if (!isConcrete(serviceType)) {
            throw new ActivationException("No registration for type " + serviceType.getName() + " could be found.");
        }

        return (InstanceProducer<T>) implicitProducers.computeIfAbsent(serviceType,
                ignored -> Lifestyle.TRANSIENT.createProducer(serviceType, this));
    }

    private static boolean isConcrete(Class<?> type) {
        return !type.isPrimitive()
                && !type.isArray()
                && !type.isInterface()
                && !Modifier.isAbstract(type.getModifiers());
    }
}
