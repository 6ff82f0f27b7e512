package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;

import java.util.function.BooleanSupplier;

/**
 * Selects, on every request, between the providers two lifestyles built for the same registration.
 */
final class HybridLifestyle extends Lifestyle {

    private final @NotNull BooleanSupplier lifestyleSelector;
    private final @NotNull Lifestyle trueLifestyle;
    private final @NotNull Lifestyle falseLifestyle;

    HybridLifestyle(@NotNull BooleanSupplier lifestyleSelector,
                    @NotNull Lifestyle trueLifestyle,
                    @NotNull Lifestyle falseLifestyle) {
        super("Hybrid " + trueLifestyle.getName() + " / " + falseLifestyle.getName());
        this.lifestyleSelector = lifestyleSelector;
        this.trueLifestyle = trueLifestyle;
        this.falseLifestyle = falseLifestyle;
    }

    static <T> @NotNull Provider<T> select(@NotNull BooleanSupplier lifestyleSelector,
                                           @NotNull Lifestyle trueLifestyle,
                                           @NotNull Lifestyle falseLifestyle,
                                           @NotNull Registration<T> registration,
                                           @NotNull Provider<T> creator) {
        Provider<T> whenTrue = trueLifestyle.createInstanceProvider(registration, creator);
        Provider<T> whenFalse = falseLifestyle.createInstanceProvider(registration, creator);

        return () -> lifestyleSelector.getAsBoolean() ? whenTrue.provide() : whenFalse.provide();
    }

    @Override
    public int getComponentLength() {
        return Math.max(trueLifestyle.getComponentLength(), falseLifestyle.getComponentLength());
    }

    @Override
    public int getDependencyLength() {
        return Math.min(trueLifestyle.getDependencyLength(), falseLifestyle.getDependencyLength());
    }

    @Override
    protected int getLength() {
        throw new UnsupportedOperationException("The length property is not supported for this lifestyle.");
    }

    @Override
    protected <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                              @NotNull Provider<T> creator) {
        return select(lifestyleSelector, trueLifestyle, falseLifestyle, registration, creator);
    }
}
