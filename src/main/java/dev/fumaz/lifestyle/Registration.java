package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.exception.ActivationException;
import dev.fumaz.lifestyle.exception.ConfigurationException;
import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link Registration} binds a service type to the instance provider its {@link Lifestyle} built for it
 * inside a single {@link Container}.
 * <p>
 * Every instance is created through a guard that rejects a call chain re-entering this registration's own
 * construction. The lifestyle's provider decides when that guarded creator runs.
 *
 * @param <T> the service type
 */
public final class Registration<T> {

    private final @NotNull Lifestyle lifestyle;
    private final @NotNull Class<T> serviceType;
    private final @Nullable Class<? extends T> implementationType;
    private final @NotNull Container container;
    private final @NotNull CycleGuard guard;
    private final @NotNull Provider<T> instanceProvider;
    private final Object creatorLock = new Object();
    private volatile @Nullable Provider<? extends T> creator;
    private volatile @NotNull List<ParameterOverride> parameterOverrides = Collections.emptyList();
    private volatile boolean disposalSuppressed;

    Registration(@NotNull Lifestyle lifestyle,
                 @NotNull Class<T> serviceType,
                 @Nullable Class<? extends T> implementationType,
                 @Nullable Provider<? extends T> instanceCreator,
                 @NotNull Container container) {
        this.lifestyle = lifestyle;
        this.serviceType = serviceType;
        this.implementationType = implementationType;
        this.container = container;
        this.creator = instanceCreator;
        this.guard = new CycleGuard(implementationType != null ? implementationType : serviceType);

        Provider<T> provider = lifestyle.createInstanceProvider(this, this::createGuardedInstance);

        if (provider == null) {
            throw new ConfigurationException("Lifestyle '" + lifestyle.getName() + "' returned no provider for "
                    + serviceType.getName());
        }

        this.instanceProvider = provider;
    }

    /**
     * Returns an instance according to this registration's lifestyle.
     *
     * @throws dev.fumaz.lifestyle.exception.CyclicDependencyException when the current call chain is already
     *                                                                 constructing this registration
     */
    public @NotNull T getInstance() {
        return instanceProvider.provide();
    }

    public @NotNull Lifestyle getLifestyle() {
        return lifestyle;
    }

    public @NotNull Class<T> getServiceType() {
        return serviceType;
    }

    /**
     * @return the implementation type, or {@code null} when this registration wraps an instance creator
     */
    public @Nullable Class<? extends T> getImplementationType() {
        return implementationType;
    }

    public @NotNull Container getContainer() {
        return container;
    }

    public boolean wrapsInstanceCreator() {
        return implementationType == null;
    }

    public @NotNull List<ParameterOverride> getParameterOverrides() {
        return parameterOverrides;
    }

    /**
     * Replaces the constructor arguments the container would otherwise resolve itself.
     *
     * @throws IllegalStateException when this registration wraps an instance creator, or has already built
     *                               its creator
     */
    public void setParameterOverrides(@NotNull List<ParameterOverride> overrides) {
        if (overrides == null) {
            throw new IllegalArgumentException("overrides must not be null");
        }

        if (wrapsInstanceCreator()) {
            throw new IllegalStateException("Parameter overrides can't be applied to " + serviceType.getName()
                    + " because it is registered with an instance creator.");
        }

        synchronized (creatorLock) {
            if (creator != null) {
                throw new IllegalStateException("Parameter overrides of " + serviceType.getName()
                        + " can't be changed after the registration has been used.");
            }

            parameterOverrides = Collections.unmodifiableList(new ArrayList<>(overrides));
        }
    }

    public boolean isDisposalSuppressed() {
        return disposalSuppressed;
    }

    /**
     * Prevents scopes from closing {@link AutoCloseable} instances produced by this registration.
     */
    public void suppressDisposal() {
        this.disposalSuppressed = true;
    }

    @NotNull CycleGuard getGuard() {
        return guard;
    }

    private T createGuardedInstance() {
        guard.enter();

        try {
            return createInstance();
        } finally {
            guard.exit();
        }
    }

    private T createInstance() {
        T instance = resolveCreator().provide();

        if (instance == null) {
            throw new ActivationException("The registered delegate for type " + serviceType.getName()
                    + " returned null.");
        }

        return instance;
    }

    private @NotNull Provider<? extends T> resolveCreator() {
        Provider<? extends T> local = creator;

        if (local != null) {
            return local;
        }

        synchronized (creatorLock) {
            local = creator;

            if (local == null) {
                local = container.getOptions().getConstructionBehavior().createCreator(this);
                creator = local;
            }

            return local;
        }
    }

    @Override
    public String toString() {
        return "Registration{" + serviceType.getName() + ", " + lifestyle.getName() + "}";
    }
}
