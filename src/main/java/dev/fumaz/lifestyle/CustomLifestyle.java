package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.exception.ActivationException;
import dev.fumaz.lifestyle.exception.ConfigurationException;
import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;

final class CustomLifestyle extends Lifestyle {

    private final @NotNull LifestyleApplierFactory lifestyleApplierFactory;

    CustomLifestyle(@NotNull String name, @NotNull LifestyleApplierFactory lifestyleApplierFactory) {
        super(name);
        this.lifestyleApplierFactory = lifestyleApplierFactory;
    }

    // Custom policies are opaque, so they are never reported as a lifestyle mismatch.
    @Override
    public int getComponentLength() {
        return TRANSIENT.getComponentLength();
    }

    @Override
    public int getDependencyLength() {
        return SINGLETON.getDependencyLength();
    }

    @Override
    protected int getLength() {
        throw new UnsupportedOperationException("The length property is not supported for this lifestyle.");
    }

    @Override
    protected <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                              @NotNull Provider<T> creator) {
        Provider<Object> applier = lifestyleApplierFactory.createApplier(creator::provide);

        if (applier == null) {
            throw new ConfigurationException("The lifestyle applier factory of lifestyle '" + getName()
                    + "' returned null for " + registration.getServiceType().getName());
        }

        Class<T> serviceType = registration.getServiceType();
        return () -> {
            Object instance = applier.provide();

            if (instance == null) {
                throw new ActivationException("The lifestyle applier of lifestyle '" + getName() + "' for type "
                        + serviceType.getName() + " returned null.");
            }

            return serviceType.cast(instance);
        };
    }
}
