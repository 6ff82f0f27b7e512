package dev.fumaz.lifestyle.scope;

import dev.fumaz.lifestyle.container.Container;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Tracks the stack of thread scopes opened on the current thread, per container.
 */
final class ScopeContexts {

    private ScopeContexts() {
    }

    private static final ThreadLocal<Map<Container, Deque<Scope>>> SCOPES = ThreadLocal.withInitial(IdentityHashMap::new);

    static @NotNull Scope begin(@NotNull Container container) {
        Map<Container, Deque<Scope>> scopes = SCOPES.get();
        Deque<Scope> stack = scopes.computeIfAbsent(container, ignored -> new ArrayDeque<>());
        Thread owner = Thread.currentThread();
        Scope scope = new Scope(() -> checkOwner(owner), closed -> end(container, closed));
        stack.push(scope);

        return scope;
    }

    static @Nullable Scope current(@NotNull Container container) {
        Deque<Scope> stack = SCOPES.get().get(container);

        return stack == null ? null : stack.peek();
    }

    private static void checkOwner(Thread owner) {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("A thread scope can only be closed on the thread that opened it");
        }
    }

    private static void end(Container container, Scope scope) {
        Map<Container, Deque<Scope>> scopes = SCOPES.get();
        Deque<Scope> stack = scopes.get(container);

        if (stack == null) {
            return;
        }

        stack.remove(scope);

        if (stack.isEmpty()) {
            scopes.remove(container);
        }

        if (scopes.isEmpty()) {
            SCOPES.remove();
        }
    }
}
