package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.exception.CyclicDependencyException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CycleGuardTest {

    static class Service {
    }

    @Test
    void rejectsSameChainEnteringTwice() {
        CycleGuard guard = new CycleGuard(Service.class);
        guard.enter("chain");

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
                () -> guard.enter("chain"));

        assertSame(Service.class, exception.getType());
        assertTrue(exception.getMessage().contains(Service.class.getName()),
                "message should name the type depending on itself");
    }

    @Test
    void allowsDifferentChainsAtTheSameTime() {
        CycleGuard guard = new CycleGuard(Service.class);

        guard.enter("first");
        assertDoesNotThrow(() -> guard.enter("second"));
    }

    @Test
    void releasesStorageWhenTheLastChainExits() {
        CycleGuard guard = new CycleGuard(Service.class);
        assertTrue(guard.isIdle());

        guard.enter("first");
        guard.enter("second");
        guard.exit("first");
        assertFalse(guard.isIdle());

        guard.exit("second");
        assertTrue(guard.isIdle(), "guard should drop its bookkeeping once idle");

        assertDoesNotThrow(() -> guard.enter("first"), "an exited chain may enter again");
    }

    @Test
    void exitsEvenWhenConstructionFails() {
        Container container = Container.create();
        AtomicInteger attempts = new AtomicInteger();
        Registration<Service> registration = Lifestyle.TRANSIENT.createRegistration(Service.class, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("construction failed");
        }, container);

        assertThrows(IllegalStateException.class, registration::getInstance);
        assertThrows(IllegalStateException.class, registration::getInstance,
                "a failed construction must not leave a false cycle behind");
        assertEquals(2, attempts.get());
        assertTrue(registration.getGuard().isIdle());
    }

    @Test
    void detectsSelfReferenceThroughProducer() {
        Container container = Container.create();
        @SuppressWarnings("unchecked")
        InstanceProducer<Service>[] self = new InstanceProducer[1];

        self[0] = Lifestyle.TRANSIENT.createProducer(Service.class, () -> {
            self[0].getInstance();
            return new Service();
        }, container);

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class, self[0]::getInstance);
        assertSame(Service.class, exception.getType());
        assertTrue(self[0].getRegistration().getGuard().isIdle());
    }

    @Test
    void unrelatedConcurrentChainsDoNotTripTheGuard() throws Exception {
        Container container = Container.create();
        CyclicBarrier bothInside = new CyclicBarrier(2);
        InstanceProducer<Service> producer = Lifestyle.TRANSIENT.createProducer(Service.class, () -> {
            try {
                bothInside.await(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException("constructions did not overlap", e);
            }

            return new Service();
        }, container);

        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<Service> first = executor.submit(producer::getInstance);
            Future<Service> second = executor.submit(producer::getInstance);

            assertNotNull(first.get(10, TimeUnit.SECONDS));
            assertNotNull(second.get(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
