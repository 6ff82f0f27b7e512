package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.exception.CyclicDependencyException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects a call chain that re-enters the construction of the registration it guards.
 * <p>
 * Each guard belongs to exactly one {@link Registration}. Chains are identified by the thread performing the
 * construction, so two threads building the same registration at the same time are not a cycle. The lock
 * only protects the bookkeeping list; the guarded construction itself runs outside of it.
 */
final class CycleGuard {

    private final @NotNull Class<?> type;
    private final Object lock = new Object();
    private @Nullable List<Object> chains;

    CycleGuard(@NotNull Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    void enter() {
        enter(Thread.currentThread());
    }

    void exit() {
        exit(Thread.currentThread());
    }

    void enter(@NotNull Object chain) {
        synchronized (lock) {
            if (chains == null) {
                chains = new ArrayList<>(1);
            }

            if (chains.contains(chain)) {
                throw new CyclicDependencyException(type);
            }

            chains.add(chain);
        }
    }

    void exit(@NotNull Object chain) {
        synchronized (lock) {
            if (chains == null) {
                return;
            }

            chains.remove(chain);

            // registrations live as long as the container, so drop the list once idle
            if (chains.isEmpty()) {
                chains = null;
            }
        }
    }

    boolean isIdle() {
        synchronized (lock) {
            return chains == null;
        }
    }

    @NotNull Class<?> getType() {
        return type;
    }
}
