package dev.fumaz.lifestyle.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor the container should use when a type declares more than one.
 */
@Target(ElementType.CONSTRUCTOR)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
}
