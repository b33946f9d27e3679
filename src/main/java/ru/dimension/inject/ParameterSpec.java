package ru.dimension.inject;

import java.util.Objects;

/**
 * One declared parameter of an {@link Invocable}.
 *
 * @param name         parameter name, used for keyword binding and implicit injection
 * @param kind         how arguments bind to the parameter
 * @param required     whether the caller (or the engine) must supply a value
 * @param defaultValue value used when an optional parameter is not supplied
 * @param marker       injection point declared on the parameter itself, or {@code null}
 */
public record ParameterSpec(String name, Kind kind, boolean required, Object defaultValue, InjectionPoint marker) {

  public enum Kind {
    /** Bound by position or by name. */
    POSITIONAL,
    /** Collects surplus positional arguments into a {@code List}. */
    VAR_POSITIONAL,
    /** Bound by name only. */
    KEYWORD_ONLY,
    /** Collects surplus keyword arguments into a {@code Map}. */
    VAR_KEYWORD
  }

  public ParameterSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    if (isVariadic(kind) && required) {
      throw new IllegalArgumentException("Variadic parameter '" + name + "' cannot be required");
    }
  }

  public static ParameterSpec required(String name) {
    return new ParameterSpec(name, Kind.POSITIONAL, true, null, null);
  }

  public static ParameterSpec optional(String name, Object defaultValue) {
    return new ParameterSpec(name, Kind.POSITIONAL, false, defaultValue, null);
  }

  public boolean isVariadic() {
    return isVariadic(kind);
  }

  private static boolean isVariadic(Kind kind) {
    return kind == Kind.VAR_POSITIONAL || kind == Kind.VAR_KEYWORD;
  }

  /**
   * Explicit injection point carried by this parameter, either as its declared marker or
   * as its default value. Returns {@code null} when there is none.
   */
  public InjectionPoint explicitInjectionPoint() {
    if (marker != null) return marker;
    return defaultValue instanceof InjectionPoint ip ? ip : null;
  }
}
