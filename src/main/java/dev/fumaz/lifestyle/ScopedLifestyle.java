package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.exception.ActivationException;
import dev.fumaz.lifestyle.provider.Provider;
import dev.fumaz.lifestyle.scope.Scope;
import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Lifestyle} that caches one instance per registration for the duration of an active {@link Scope}.
 * Subclasses decide what the current scope is.
 */
public abstract class ScopedLifestyle extends Lifestyle {

    protected ScopedLifestyle(@NotNull String name) {
        super(name);
    }

    public @Nullable Scope getCurrentScope(@NotNull Container container) {
        Requires.isNotNull(container, "container");

        return getCurrentScopeCore(container);
    }

    /**
     * Registers an action that runs when the current scope ends.
     *
     * @throws ActivationException when no scope is active for the container
     */
    public void whenScopeEnds(@NotNull Container container, @NotNull Runnable action) {
        Requires.isNotNull(container, "container");
        Requires.isNotNull(action, "action");

        requireCurrentScope(container).whenScopeEnds(action);
    }

    /**
     * Closes {@code closeable} when the current scope ends.
     *
     * @throws ActivationException when no scope is active for the container
     */
    public void registerForDisposal(@NotNull Container container, @NotNull AutoCloseable closeable) {
        Requires.isNotNull(container, "container");
        Requires.isNotNull(closeable, "closeable");

        requireCurrentScope(container).registerForDisposal(closeable);
    }

    protected abstract @Nullable Scope getCurrentScopeCore(@NotNull Container container);

    @Override
    protected int getLength() {
        return 500;
    }

    @Override
    protected <T> @NotNull Provider<T> createInstanceProvider(@NotNull Registration<T> registration,
                                                              @NotNull Provider<T> creator) {
        Container container = registration.getContainer();

        return () -> requireCurrentScope(container, registration.getServiceType())
                .getInstance(registration, creator);
    }

    private @NotNull Scope requireCurrentScope(@NotNull Container container) {
        return requireCurrentScope(container, null);
    }

    private @NotNull Scope requireCurrentScope(@NotNull Container container, @Nullable Class<?> serviceType) {
        Scope scope = getCurrentScopeCore(container);

        if (scope != null) {
            return scope;
        }

        String subject = serviceType != null
                ? "The " + serviceType.getName() + " is registered as '" + getName() + "' lifestyle, but"
                : "The '" + getName() + "' lifestyle requires a scope, but";

        throw new ActivationException(subject + " the instance is requested outside the context of an active scope.");
    }
}
