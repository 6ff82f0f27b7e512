package dev.fumaz.lifestyle.reflection;

import dev.fumaz.lifestyle.InstanceProducer;
import dev.fumaz.lifestyle.Lifestyle;
import dev.fumaz.lifestyle.ParameterOverride;
import dev.fumaz.lifestyle.Registration;
import dev.fumaz.lifestyle.annotation.Inject;
import dev.fumaz.lifestyle.container.Container;
import dev.fumaz.lifestyle.exception.ActivationException;
import dev.fumaz.lifestyle.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates implementation types through their constructor, resolving each parameter from the container unless a
 * {@link ParameterOverride} supplies it.
 * <p>
 * The constructor is the one annotated with {@link Inject}, otherwise the only declared constructor, otherwise
 * the constructor without parameters.
 */
public final class ReflectiveConstructionBehavior implements ConstructionBehavior {

    private static final Logger LOGGER = Logger.getLogger(ReflectiveConstructionBehavior.class.getName());
    private static final MethodHandles.Lookup ROOT_LOOKUP = MethodHandles.lookup();
    private static final ConcurrentMap<Class<?>, MethodHandles.Lookup> PRIVATE_LOOKUPS = new ConcurrentHashMap<>();

    private static MethodHandles.Lookup lookupFor(Class<?> type) {
        return PRIVATE_LOOKUPS.computeIfAbsent(type, ReflectiveConstructionBehavior::createLookupFor);
    }

    private static MethodHandles.Lookup createLookupFor(Class<?> type) {
        try {
            return MethodHandles.privateLookupIn(type, ROOT_LOOKUP);
        } catch (IllegalAccessException | RuntimeException e) {
            return ROOT_LOOKUP;
        }
    }

    @Override
    public <T> @NotNull Provider<? extends T> createCreator(@NotNull Registration<T> registration) {
        Class<? extends T> implementationType = registration.getImplementationType();

        if (implementationType == null) {
            throw new IllegalArgumentException("Registration for " + registration.getServiceType().getName()
                    + " has no implementation type");
        }

        return createCreator(registration, implementationType);
    }

    private <T, I extends T> Provider<I> createCreator(Registration<T> registration, Class<I> implementationType) {
        Constructor<I> constructor = selectConstructor(implementationType);
        MethodHandle handle = unreflect(constructor);
        Provider<?>[] arguments = resolveArguments(registration, constructor);

        LOGGER.fine(() -> "Resolved constructor " + constructor.toGenericString() + " for "
                + registration.getServiceType().getName());

        return () -> invoke(implementationType, handle, arguments);
    }

    @SuppressWarnings("unchecked")
    static <I> @NotNull Constructor<I> selectConstructor(@NotNull Class<I> type) {
        Constructor<?>[] declared = type.getDeclaredConstructors();
        List<Constructor<?>> annotated = new ArrayList<>();

        for (Constructor<?> constructor : declared) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                annotated.add(constructor);
            }
        }

        if (annotated.size() > 1) {
            throw new ReflectionException("The type " + type.getName()
                    + " declares more than one constructor annotated with @Inject.");
        }

        if (annotated.size() == 1) {
            return (Constructor<I>) annotated.get(0);
        }

        if (declared.length == 1) {
            return (Constructor<I>) declared[0];
        }

        for (Constructor<?> constructor : declared) {
            if (constructor.getParameterCount() == 0) {
                return (Constructor<I>) constructor;
            }
        }

        throw new ReflectionException("For the container to be able to create " + type.getName()
                + ", it should have a single constructor, a constructor annotated with @Inject or a constructor"
                + " without parameters, but it has " + declared.length + " constructors.");
    }

    private static MethodHandle unreflect(Constructor<?> constructor) {
        try {
            return lookupFor(constructor.getDeclaringClass()).unreflectConstructor(constructor);
        } catch (IllegalAccessException firstFailure) {
            try {
                constructor.setAccessible(true);
                return ROOT_LOOKUP.unreflectConstructor(constructor);
            } catch (IllegalAccessException | RuntimeException secondFailure) {
                secondFailure.addSuppressed(firstFailure);
                throw new ReflectionException("Unable to access constructor " + constructor.toGenericString(),
                        secondFailure);
            }
        }
    }

    private static Provider<?>[] resolveArguments(Registration<?> registration, Constructor<?> constructor) {
        Class<?>[] parameterTypes = constructor.getParameterTypes();
        Provider<?>[] arguments = new Provider<?>[parameterTypes.length];

        for (ParameterOverride override : registration.getParameterOverrides()) {
            int index = override.getIndex();

            if (index >= parameterTypes.length) {
                throw new ReflectionException("Constructor " + constructor.toGenericString()
                        + " has no parameter at index " + index + ".");
            }

            Object value = override.getValue();
            checkOverride(constructor, parameterTypes[index], index, value);
            arguments[index] = Provider.instance(value);
        }

        Container container = registration.getContainer();

        for (int i = 0; i < parameterTypes.length; i++) {
            if (arguments[i] != null) {
                continue;
            }

            Class<?> parameterType = parameterTypes[i];

            if (parameterType.isPrimitive()) {
                throw new ReflectionException("Parameter " + i + " of constructor " + constructor.toGenericString()
                        + " is of primitive type " + parameterType.getName()
                        + " and can only be supplied through a parameter override.");
            }

            warnOnLifestyleMismatch(registration, container.getProducer(parameterType));
            arguments[i] = () -> container.getInstance(parameterType);
        }

        return arguments;
    }

    private static void checkOverride(Constructor<?> constructor, Class<?> parameterType, int index,
                                      @Nullable Object value) {
        Class<?> boxed = MethodType.methodType(parameterType).wrap().returnType();

        if (value == null ? parameterType.isPrimitive() : !boxed.isInstance(value)) {
            throw new ReflectionException("Override " + value + " does not match parameter " + index
                    + " of constructor " + constructor.toGenericString() + ".");
        }
    }

    private static void warnOnLifestyleMismatch(Registration<?> consumer, @Nullable InstanceProducer<?> dependency) {
        if (dependency == null) {
            return;
        }

        Lifestyle consumerLifestyle = consumer.getLifestyle();
        Lifestyle dependencyLifestyle = dependency.getLifestyle();

        if (Lifestyle.hasLifestyleMismatch(consumerLifestyle, dependencyLifestyle)) {
            LOGGER.log(Level.WARNING, () -> consumer.getServiceType().getName() + " (" + consumerLifestyle.getName()
                    + ") depends on " + dependency.getServiceType().getName() + " (" + dependencyLifestyle.getName()
                    + ") which has a shorter lifestyle.");
        }
    }

    private static <I> I invoke(Class<I> type, MethodHandle handle, Provider<?>[] arguments) {
        Object[] values = new Object[arguments.length];

        for (int i = 0; i < arguments.length; i++) {
            values[i] = arguments[i].provide();
        }

        try {
            return type.cast(handle.invokeWithArguments(values));
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable throwable) {
            throw new ActivationException("Failed to construct " + type.getName(), throwable);
        }
    }
}
