package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.provider.Provider;
import dev.fumaz.lifestyle.scope.Scope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.BooleanSupplier;

/**
 * A hybrid of two scoped lifestyles; its current scope is the current scope of the selected one.
 */
final class ScopedHybridLifestyle extends ScopedLifestyle {

    private final @NotNull BooleanSupplier lifestyleSelector;
    private final @NotNull ScopedLifestyle trueLifestyle;
    private final @NotNull ScopedLifestyle falseLifestyle;

    ScopedHybridLifestyle(@NotNull BooleanSupplier lifestyleSelector,
                          @NotNull ScopedLifestyle trueLifestyle,
                          @NotNull ScopedLifestyle falseLifestyle) {
        super("Hybrid " + trueLifestyle.getName() + " / " + falseLifestyle.getName());
        this.lifestyleSelector = lifestyleSelector;
        this.trueLifestyle = trueLifestyle;
        this.falseLifestyle = falseLifestyle;
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
    protected @Nullable Scope getCurrentScopeCore(@NotNull Container container) {
        ScopedLifestyle selected = lifestyleSelector.getAsBoolean() ? trueLifestyle : falseLifestyle;

        return selected.getCurrentScopeCore(container);
    }

    @Override
    protected <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                              @NotNull Provider<T> creator) {
        return HybridLifestyle.select(lifestyleSelector, trueLifestyle, falseLifestyle, registration, creator);
    }
}
