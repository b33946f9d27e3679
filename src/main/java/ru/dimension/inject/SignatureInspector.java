package ru.dimension.inject;

import java.util.*;

/**
 * Derives the injection points of an {@link Invocable} from its declared parameters.
 *
 * Rules:
 * - decoration layers are followed through {@link Invocable#wrapped()} to the underlying definition
 * - a required positional parameter is an implicit injection point named after itself,
 *   unless its name is in {@link Config#neverInject()}
 * - a parameter whose marker or default value is an {@link InjectionPoint} is that explicit point
 * - variadic parameters, optional parameters and keyword-only parameters without a marker
 *   are left to the caller
 */
public final class SignatureInspector {

  /**
   * @param neverInject parameter names that never become implicit injection points
   */
  public record Config(Set<String> neverInject) {
    public static Config defaults() {
      return new Config(Set.of("self"));
    }

    public Config {
      neverInject = Set.copyOf(Objects.requireNonNull(neverInject, "neverInject"));
    }
  }

  private final Config config;

  public SignatureInspector() {
    this(Config.defaults());
  }

  public SignatureInspector(Config config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public Config config() {
    return config;
  }

  public Map<String, InjectionPoint> inspect(Invocable invocable) {
    List<ParameterSpec> parameters = unwrap(invocable).parameters();
    Map<String, InjectionPoint> points = new LinkedHashMap<>();

    for (ParameterSpec p : parameters) {
      if (p.isVariadic()) continue;

      InjectionPoint explicit = p.explicitInjectionPoint();
      if (explicit != null) {
        points.put(p.name(), explicit);
      } else if (p.kind() == ParameterSpec.Kind.POSITIONAL && p.required()
          && !config.neverInject().contains(p.name())) {
        points.put(p.name(), InjectionPoint.implicit(p.name()));
      }
    }
    return Collections.unmodifiableMap(points);
  }

  /**
   * Follows the chain of decoration layers to the underlying definition.
   */
  public static Invocable unwrap(Invocable invocable) {
    Objects.requireNonNull(invocable, "invocable");
    Invocable current = invocable;
    Set<Invocable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Invocable next = current.wrapped(); next != null; next = current.wrapped()) {
      if (!seen.add(current)) {
        throw new IllegalStateException("Decoration chain of " + invocable + " loops back on itself");
      }
      current = next;
    }
    return current;
  }
}
