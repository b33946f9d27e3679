package ru.dimension.inject;

import java.util.*;

/**
 * A named request for a dependency, optionally carrying arguments for the resolver
 * bound to that name.
 *
 * Instances are immutable. Two points are equal when name, parameters and config match;
 * whether the point was inferred ({@link #isImplicit()}) does not take part in equality.
 *
 * Usage as a default value of a programmatic signature:
 * <pre>
 *   Invocables.builder()
 *       .param("c")
 *       .optional("other", InjectionPoint.inject("c"))
 *       .body(args -> ...);
 * </pre>
 */
public final class InjectionPoint {

  private final String name;
  private final List<Object> parameters;
  private final Map<String, Object> config;
  private final boolean implicit;

  private InjectionPoint(String name, List<?> parameters, Map<String, ?> config, boolean implicit) {
    this.name = requireName(name);
    this.parameters = parameters == null || parameters.isEmpty()
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(parameters));
    this.config = config == null || config.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    this.implicit = implicit;
  }

  /**
   * Marks a parameter as an injection point for {@code name}. Positional {@code parameters}
   * are handed to the resolver bound to that name.
   */
  public static InjectionPoint inject(String name, Object... parameters) {
    return new InjectionPoint(name, parameters == null ? null : Arrays.asList(parameters), null, false);
  }

  public static InjectionPoint inject(String name, List<?> parameters, Map<String, ?> config) {
    return new InjectionPoint(name, parameters, config, false);
  }

  static InjectionPoint implicit(String name) {
    return new InjectionPoint(name, null, null, true);
  }

  static InjectionPoint fromAnnotation(Inject annotation) {
    LinkedHashMap<String, Object> config = new LinkedHashMap<>();
    for (Inject.Option option : annotation.config()) {
      if (config.put(option.key(), option.value()) != null) {
        throw new IllegalArgumentException(
            "Duplicate config key '" + option.key() + "' on injection point '" + annotation.value() + "'");
      }
    }
    return new InjectionPoint(annotation.value(), List.of((Object[]) annotation.parameters()), config, false);
  }

  private static String requireName(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Injection point name must be non-blank");
    }
    return name;
  }

  public String name() {
    return name;
  }

  public List<Object> parameters() {
    return parameters;
  }

  public Map<String, Object> config() {
    return config;
  }

  /**
   * True when the point was inferred from a required parameter's own name rather than
   * declared with a marker.
   */
  public boolean isImplicit() {
    return implicit;
  }

  public boolean hasArguments() {
    return !parameters.isEmpty() || !config.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof InjectionPoint p)) return false;
    return name.equals(p.name) && parameters.equals(p.parameters) && config.equals(p.config);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters, config);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("inject('").append(name).append('\'');
    for (Object p : parameters) {
      sb.append(", ").append(p);
    }
    for (Map.Entry<String, Object> e : config.entrySet()) {
      sb.append(", ").append(e.getKey()).append('=').append(e.getValue());
    }
    return sb.append(')').toString();
  }
}
