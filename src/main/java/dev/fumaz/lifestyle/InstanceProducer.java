package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;

/**
 * The handle through which consumers obtain instances of a service.
 *
 * @param <T> the service type
 */
public final class InstanceProducer<T> {

    private final @NotNull Class<T> serviceType;
    private final @NotNull Registration<? extends T> registration;

    public InstanceProducer(@NotNull Class<T> serviceType, @NotNull Registration<? extends T> registration) {
        this.serviceType = Requires.isNotNull(serviceType, "serviceType");
        this.registration = Requires.isNotNull(registration, "registration");
    }

    /**
     * Returns an instance of the service; failures of the underlying construction propagate unchanged.
     */
    public @NotNull T getInstance() {
        return registration.getInstance();
    }

    public @NotNull Class<T> getServiceType() {
        return serviceType;
    }

    public @NotNull Registration<? extends T> getRegistration() {
        return registration;
    }

    public @NotNull Lifestyle getLifestyle() {
        return registration.getLifestyle();
    }

    @Override
    public String toString() {
        return "InstanceProducer{" + serviceType.getName() + ", " + getLifestyle().getName() + "}";
    }
}
