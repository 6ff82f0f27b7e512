package dev.fumaz.lifestyle.scope;

import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.exception.ActivationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ThreadScopedLifestyleTest {

    private final ThreadScopedLifestyle lifestyle = new ThreadScopedLifestyle();

    static class UnitOfWork {
    }

    static class Connection implements AutoCloseable {
        boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void failsOutsideOfAScope() {
        Container container = Container.create();
        container.register(UnitOfWork.class, UnitOfWork.class, lifestyle);

        assertNull(lifestyle.getCurrentScope(container));
        assertThrows(ActivationException.class, () -> container.getInstance(UnitOfWork.class));
    }

    @Test
    void cachesOneInstancePerScope() {
        Container container = Container.create();
        container.register(UnitOfWork.class, UnitOfWork.class, lifestyle);

        UnitOfWork first;

        try (Scope scope = lifestyle.beginScope(container)) {
            first = container.getInstance(UnitOfWork.class);
            assertSame(first, container.getInstance(UnitOfWork.class));
            assertSame(scope, lifestyle.getCurrentScope(container));
        }

        try (Scope ignored = lifestyle.beginScope(container)) {
            assertNotSame(first, container.getInstance(UnitOfWork.class));
        }

        assertNull(lifestyle.getCurrentScope(container));
    }

    @Test
    void nestedScopesHaveTheirOwnInstances() {
        Container container = Container.create();
        container.register(UnitOfWork.class, UnitOfWork.class, lifestyle);

        try (Scope outer = lifestyle.beginScope(container)) {
            UnitOfWork outerInstance = container.getInstance(UnitOfWork.class);

            try (Scope inner = lifestyle.beginScope(container)) {
                assertNotSame(outerInstance, container.getInstance(UnitOfWork.class));
            }

            assertSame(outer, lifestyle.getCurrentScope(container));
            assertSame(outerInstance, container.getInstance(UnitOfWork.class));
        }
    }

    @Test
    void scopesAreBoundToTheOpeningThread() throws Exception {
        Container container = Container.create();
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try (Scope ignored = lifestyle.beginScope(container)) {
            assertNull(executor.submit(() -> lifestyle.getCurrentScope(container)).get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void closingFromAnotherThreadLeavesTheScopeUsable() throws Exception {
        Container container = Container.create();
        container.register(Connection.class, Connection.class, lifestyle);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try (Scope scope = lifestyle.beginScope(container)) {
            Connection connection = container.getInstance(Connection.class);

            ExecutionException failure = assertThrows(ExecutionException.class,
                    () -> executor.submit(scope::close).get(5, TimeUnit.SECONDS));

            assertInstanceOf(IllegalStateException.class, failure.getCause());
            assertFalse(scope.isDisposed());
            assertFalse(connection.closed);
            assertSame(scope, lifestyle.getCurrentScope(container));
            assertSame(connection, container.getInstance(Connection.class));
        } finally {
            executor.shutdownNow();
        }

        assertNull(lifestyle.getCurrentScope(container));
    }

    @Test
    void closesDisposableInstancesWhenTheScopeEnds() {
        Container container = Container.create();
        container.register(Connection.class, Connection.class, lifestyle);

        Connection connection;

        try (Scope ignored = lifestyle.beginScope(container)) {
            connection = container.getInstance(Connection.class);
            assertFalse(connection.closed);
        }

        assertTrue(connection.closed);
    }

    @Test
    void leavesSuppressedInstancesOpen() {
        Container container = Container.create();
        Registration<Connection> registration = lifestyle.createRegistration(Connection.class, container);
        registration.suppressDisposal();

        Connection connection;

        try (Scope ignored = lifestyle.beginScope(container)) {
            connection = registration.getInstance();
        }

        assertFalse(connection.closed);
    }

    @Test
    void runsEndActionsInReverseOrderDespiteFailures() {
        Container container = Container.create();
        List<String> calls = new ArrayList<>();

        try (Scope ignored = lifestyle.beginScope(container)) {
            lifestyle.whenScopeEnds(container, () -> calls.add("first"));
            lifestyle.whenScopeEnds(container, () -> {
                calls.add("failing");
                throw new IllegalStateException("boom");
            });
            lifestyle.registerForDisposal(container, () -> calls.add("closed"));
        }

        assertEquals(List.of("closed", "failing", "first"), calls);
    }

    @Test
    void closedScopesRejectFurtherUse() {
        Container container = Container.create();
        Registration<UnitOfWork> registration = Lifestyle.TRANSIENT.createRegistration(UnitOfWork.class, container);
        Scope scope = lifestyle.beginScope(container);

        scope.close();
        scope.close();

        assertTrue(scope.isDisposed());
        assertThrows(IllegalStateException.class, () -> scope.getInstance(registration, UnitOfWork::new));
        assertThrows(IllegalStateException.class, () -> scope.whenScopeEnds(() -> {
        }));
    }

    @Test
    void requiresAnActiveScopeForEndActions() {
        Container container = Container.create();

        assertThrows(ActivationException.class, () -> lifestyle.whenScopeEnds(container, () -> {
        }));
    }
}
