package dev.fumaz.lifestyle;

import dev.fumaz.lifestyle.container.Container;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransientLifestyleTest {

    static class Service {
    }

    @Test
    void createsANewInstanceOnEveryCall() {
        Container container = Container.create();
        AtomicInteger counter = new AtomicInteger();
        InstanceProducer<Service> producer = Lifestyle.TRANSIENT.createProducer(Service.class, () -> {
            counter.incrementAndGet();
            return new Service();
        }, container);

        Service first = producer.getInstance();
        Service second = producer.getInstance();
        Service third = producer.getInstance();

        assertEquals(3, counter.get());
        assertNotSame(first, second);
        assertNotSame(second, third);
        assertNotSame(first, third);
    }

    @Test
    void constructsImplementationTypes() {
        Container container = Container.create();
        Registration<Service> registration = Lifestyle.TRANSIENT.createRegistration(Service.class, container);

        assertNotSame(registration.getInstance(), registration.getInstance());
        assertFalse(registration.wrapsInstanceCreator());
        assertSame(Service.class, registration.getImplementationType());
    }
}
