package ru.dimension.inject;

import java.util.List;
import java.util.Map;

/**
 * Resolver written as a lambda: receives an injection point's parameters and config and
 * returns a provider ({@link Invocable} or {@link java.util.function.Supplier}).
 *
 * Resolvers that need injected dependencies of their own are registered as an
 * {@link Invocable} instead (a method, or a programmatic signature).
 */
@FunctionalInterface
public interface Resolver {

  Object resolve(List<Object> parameters, Map<String, Object> config) throws Exception;

  @SuppressWarnings("unchecked")
  static Invocable asInvocable(String name, Resolver resolver) {
    return Invocables.builder("resolver '" + name + "'")
        .varArgs("parameters")
        .varKeywords("config")
        .body(args -> resolver.resolve(
            (List<Object>) args.get("parameters"),
            (Map<String, Object>) args.get("config")));
  }
}
