package dev.fumaz.lifestyle.container;

import dev.fumaz.lifestyle.InstanceProducer;
import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.exception.ActivationException;
import dev.fumaz.lifestyle.exception.ConfigurationException;
import dev.fumaz.lifestyle.exception.CyclicDependencyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultContainerTest {

    interface Repository {
    }

    static class InMemoryRepository implements Repository {
    }

    static class UserService {
        final Repository repository;

        UserService(Repository repository) {
            this.repository = repository;
        }
    }

    static class First {
        First(Second second) {
        }
    }

    static class Second {
        Second(First first) {
        }
    }

    static class SelfDependent {
        SelfDependent(SelfDependent self) {
        }
    }

    @Test
    void resolvesUnregisteredConcreteTypesAsTransient() {
        Container container = Container.create();

        InMemoryRepository first = container.getInstance(InMemoryRepository.class);
        InMemoryRepository second = container.getInstance(InMemoryRepository.class);

        assertNotNull(first);
        assertNotSame(first, second);
        assertNull(container.getProducer(InMemoryRepository.class), "implicit producers are not registrations");
    }

    @Test
    void failsForUnregisteredAbstractions() {
        Container container = Container.create();

        ActivationException exception = assertThrows(ActivationException.class,
                () -> container.getInstance(Repository.class));
        assertTrue(exception.getMessage().contains(Repository.class.getName()));
    }

    @Test
    void injectsRegisteredDependencies() {
        Container container = Container.create();
        container.register(Repository.class, InMemoryRepository.class, Lifestyle.SINGLETON);

        UserService first = container.getInstance(UserService.class);
        UserService second = container.getInstance(UserService.class);

        assertNotSame(first, second);
        assertSame(first.repository, second.repository);
        assertTrue(first.repository instanceof InMemoryRepository);
    }

    @Test
    void detectsIndirectConstructorCycles() {
        Container container = Container.create();

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
                () -> container.getInstance(First.class));

        assertSame(First.class, exception.getType());
        assertThrows(CyclicDependencyException.class, () -> container.getInstance(First.class),
                "the cycle should be reported on every attempt");
    }

    @Test
    void detectsDirectSelfDependency() {
        Container container = Container.create();
        container.register(SelfDependent.class, SelfDependent.class, Lifestyle.SINGLETON);

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
                () -> container.getInstance(SelfDependent.class));
        assertSame(SelfDependent.class, exception.getType());
    }

    @Test
    void rejectsDuplicateRegistrationsByDefault() {
        Container container = Container.create();
        container.register(Repository.class, InMemoryRepository.class);

        assertThrows(ConfigurationException.class,
                () -> container.register(Repository.class, InMemoryRepository.class));
    }

    @Test
    void allowsOverridingWhenConfigured() {
        Container container = Container.create(ContainerOptions.builder()
                .allowOverridingRegistrations(true)
                .build());
        InMemoryRepository instance = new InMemoryRepository();

        container.register(Repository.class, InMemoryRepository.class);
        container.registerSingleton(Repository.class, instance);

        assertSame(instance, container.getInstance(Repository.class));
    }

    @Test
    void usesTheConfiguredDefaultLifestyle() {
        Container container = Container.create(ContainerOptions.builder()
                .defaultLifestyle(Lifestyle.SINGLETON)
                .build());
        container.register(Repository.class, InMemoryRepository.class);

        InstanceProducer<Repository> producer = container.getProducer(Repository.class);

        assertNotNull(producer);
        assertSame(Lifestyle.SINGLETON, producer.getLifestyle());
        assertSame(container.getInstance(Repository.class), container.getInstance(Repository.class));
    }

    @Test
    void locksAfterTheFirstResolution() {
        Container container = Container.create();
        container.register(InMemoryRepository.class);
        assertFalse(container.isLocked());

        container.getInstance(InMemoryRepository.class);

        assertTrue(container.isLocked());
        assertThrows(ConfigurationException.class,
                () -> container.register(Repository.class, InMemoryRepository.class));
    }

    @Test
    void acceptsRegistrationsCreatedForItself() {
        Container container = Container.create();
        Registration<InMemoryRepository> registration = Lifestyle.SINGLETON
                .createRegistration(InMemoryRepository.class, container);

        container.addRegistration(Repository.class, registration);

        assertSame(registration.getInstance(), container.getInstance(Repository.class));
        assertEquals(1, container.getProducers().size());
    }

    @Test
    void rejectsRegistrationsOfAnotherContainer() {
        Container container = Container.create();
        Registration<InMemoryRepository> foreign = Lifestyle.SINGLETON
                .createRegistration(InMemoryRepository.class, Container.create());

        assertThrows(IllegalArgumentException.class, () -> container.addRegistration(Repository.class, foreign));
    }
}
