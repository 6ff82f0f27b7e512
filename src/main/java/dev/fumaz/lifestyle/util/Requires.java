package dev.fumaz.lifestyle.util;

import java.lang.reflect.Modifier;

/**
 * Argument checks for the public entry points. Every failure is an {@link IllegalArgumentException} naming
 * the offending parameter.
 */
public final class Requires {

    private Requires() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static <T> T isNotNull(T argument, String paramName) {
        if (argument == null) {
            throw new IllegalArgumentException(paramName + " must not be null");
        }

        return argument;
    }

    public static String isNotNullOrEmpty(String argument, String paramName) {
        isNotNull(argument, paramName);

        if (argument.isEmpty()) {
            throw new IllegalArgumentException(paramName + " must not be empty");
        }

        return argument;
    }

    public static void isReferenceType(Class<?> type, String paramName) {
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("The supplied type " + type.getName()
                    + " is not a reference type. Only reference types are supported.\nparamName: " + paramName);
        }
    }

    public static void isConcreteType(Class<?> type, String paramName) {
        if (type.isInterface() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException("The supplied type " + type.getName()
                    + " is not a concrete type. Use one of the other overloads to register this type."
                    + "\nparamName: " + paramName);
        }
    }

    public static void serviceIsAssignableFromImplementation(Class<?> serviceType,
                                                             Class<?> implementationType,
                                                             String paramName) {
        if (!serviceType.isAssignableFrom(implementationType)) {
            throw new IllegalArgumentException("The supplied type " + implementationType.getName()
                    + " does not inherit from " + serviceType.getName() + ".\nparamName: " + paramName);
        }
    }
}
