package dev.fumaz.lifestyle.scope;

import dev.fumaz.lifestyle.ScopedLifestyle;
import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link ScopedLifestyle} whose scopes are explicitly opened and closed on a thread. Scopes nest: the most
 * recently opened scope of a container on the current thread is its current scope.
 *
 * <pre>{@code
 * try (Scope scope = lifestyle.beginScope(container)) {
 *     container.getInstance(UnitOfWork.class);
 * }
 * }</pre>
 */
public final class ThreadScopedLifestyle extends ScopedLifestyle {

    public ThreadScopedLifestyle() {
        super("Thread Scope");
    }

    public @NotNull Scope beginScope(@NotNull Container container) {
        Requires.isNotNull(container, "container");

        return ScopeContexts.begin(container);
    }

    @Override
    protected @Nullable Scope getCurrentScopeCore(@NotNull Container container) {
        return ScopeContexts.current(container);
    }
}
