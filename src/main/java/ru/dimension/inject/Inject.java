package ru.dimension.inject;

import java.lang.annotation.*;

/**
 * Declares a parameter as an explicit injection point. The parameter receives the value
 * provided under {@link #value()}, regardless of its own name.
 *
 * {@link #parameters()} and {@link #config()} are handed to the resolver bound to that name:
 * <pre>
 *   void handle(@Inject(value = "counter", parameters = "special",
 *                       config = @Inject.Option(key = "increment", value = "10")) Counter c)
 * </pre>
 * A plain {@code @jakarta.inject.Named("counter")} is the short form without resolver arguments.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface Inject {

  String value();

  String[] parameters() default {};

  Option[] config() default {};

  @Target({})
  @Retention(RetentionPolicy.RUNTIME)
  @interface Option {
    String key();

    String value();
  }
}
