package ru.dimension.inject;

import java.lang.annotation.*;

/**
 * Registers a public method of a module as the resolver for {@link #value()}. The method
 * receives the injection point's parameters and config and must return a provider
 * ({@link Invocable} or {@link java.util.function.Supplier}).
 *
 * @see ResolutionEngine#install(Object)
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Resolves {

  String value();

  String[] aliases() default {};
}
