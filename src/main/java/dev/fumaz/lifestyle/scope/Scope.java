package dev.fumaz.lifestyle.scope;

import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.exception.LifestyleException;
import dev.fumaz.lifestyle.provider.Provider;
import dev.fumaz.lifestyle.util.Requires;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the instances of scoped registrations, and the actions to run when the scope ends.
 * <p>
 * Closing a scope runs its end actions in reverse order of registration, then forgets its instances.
 * {@link AutoCloseable} instances are closed at that point unless their registration suppresses disposal.
 * <p>
 * A scope may be shared between threads. When two threads create the same registration at once, the first
 * instance stored wins and the other is still registered for disposal, so no closeable instance escapes.
 */
public final class Scope implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Scope.class.getName());

    private final Object lock = new Object();
    private final Map<Registration<?>, Object> instances = new HashMap<>();
    private final Deque<Runnable> endActions = new ArrayDeque<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final @Nullable Runnable closeCheck;
    private final @Nullable Consumer<Scope> onClose;

    public Scope() {
        this(null, null);
    }

    /**
     * @param closeCheck runs before anything is disposed; throwing from it leaves the scope untouched
     * @param onClose    runs once the scope has been disposed
     */
    Scope(@Nullable Runnable closeCheck, @Nullable Consumer<Scope> onClose) {
        this.closeCheck = closeCheck;
        this.onClose = onClose;
    }

    /**
     * Returns the instance cached in this scope for {@code registration}, creating it on first request.
     * The creator runs outside of the scope's lock, so scoped instances may depend on other scoped instances.
     */
    public <T> @NotNull T getInstance(@NotNull Registration<T> registration, @NotNull Provider<T> creator) {
        Requires.isNotNull(registration, "registration");
        Requires.isNotNull(creator, "creator");

        synchronized (lock) {
            ensureActive();
            Object cached = instances.get(registration);

            if (cached != null) {
                return registration.getServiceType().cast(cached);
            }
        }

        T instance = creator.provide();
        Object existing;

        synchronized (lock) {
            ensureActive();
            existing = instances.putIfAbsent(registration, instance);

            if (existing == null) {
                existing = instance;
            }
        }

        if (instance instanceof AutoCloseable && !registration.isDisposalSuppressed()) {
            registerForDisposal((AutoCloseable) instance);
        }

        return registration.getServiceType().cast(existing);
    }

    public void whenScopeEnds(@NotNull Runnable action) {
        Requires.isNotNull(action, "action");

        synchronized (lock) {
            ensureActive();
            endActions.push(action);
        }
    }

    public void registerForDisposal(@NotNull AutoCloseable closeable) {
        Requires.isNotNull(closeable, "closeable");

        whenScopeEnds(() -> {
            try {
                closeable.close();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new LifestyleException("Failed to close " + closeable.getClass().getName(), e);
            }
        });
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    @Override
    public void close() {
        if (closeCheck != null && !disposed.get()) {
            closeCheck.run();
        }

        if (!disposed.compareAndSet(false, true)) {
            return;
        }

        try {
            Runnable action;

            while ((action = pollEndAction()) != null) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "An end-of-scope action failed; continuing with the remaining ones", e);
                }
            }

            synchronized (lock) {
                instances.clear();
            }
        } finally {
            if (onClose != null) {
                onClose.accept(this);
            }
        }
    }

    private @Nullable Runnable pollEndAction() {
        synchronized (lock) {
            return endActions.poll();
        }
    }

    private void ensureActive() {
        if (disposed.get()) {
            throw new IllegalStateException("The scope has already been closed");
        }
    }
}
