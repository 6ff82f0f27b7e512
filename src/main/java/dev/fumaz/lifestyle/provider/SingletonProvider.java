package dev.fumaz.lifestyle.provider;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;

/**
 * A {@link SingletonProvider} is a {@link Provider} that invokes its creator at most once successfully and
 * returns that instance from then on. A failing creator leaves the provider empty, so the next call retries.
 * <p>
 * {@code null} marks the empty state, so a creator returning {@code null} is rejected with an
 * {@link IllegalStateException} and nothing is cached. Registrations reject {@code null} before it gets here;
 * the check matters for cells built directly through {@link Provider#singleton(Provider)}.
 * <p>
 * Each provider has its own lock. Two providers whose creators resolve each other, entered concurrently from
 * two threads, block on each other's lock and deadlock; only a same-thread re-entry reaches the creator again.
 *
 * @param <T> the type of the instance
 */
public class SingletonProvider<T> implements Provider<T> {

    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(SingletonProvider.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull Provider<T> creator;
    private final Object lock = new Object();
    private T instance;

    public SingletonProvider(@NotNull Provider<T> creator) {
        this.creator = Objects.requireNonNull(creator, "creator");
    }

    @Override
    public @NotNull T provide() {
        T local = getInitializedInstance();

        if (local != null) {
            return local;
        }

        // synchronized is reentrant: a same-thread recursive call falls through to the creator
        synchronized (lock) {
            local = getInitializedInstance();

            if (local == null) {
                local = creator.provide();

                if (local == null) {
                    throw new IllegalStateException("The creator of a singleton provider returned null");
                }

                publish(local);
            }

            return local;
        }
    }

    public boolean isCreated() {
        return getInitializedInstance() != null;
    }

    @SuppressWarnings("unchecked")
    private T getInitializedInstance() {
        return (T) INSTANCE_HANDLE.getAcquire(this);
    }

    private void publish(T value) {
        INSTANCE_HANDLE.setRelease(this, value);
    }

}
