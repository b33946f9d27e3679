package ru.dimension.inject;

import java.lang.annotation.*;

/**
 * Registers a public method of a module as the provider for {@link #value()}.
 *
 * @see ResolutionEngine#install(Object)
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Provides {

  String value();

  String[] aliases() default {};
}
