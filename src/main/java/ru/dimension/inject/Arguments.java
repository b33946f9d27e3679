package ru.dimension.inject;

import java.util.*;

/**
 * Binds positional and keyword arguments to a declared parameter list.
 *
 * Rules:
 * - positionals fill {@code POSITIONAL} slots in declaration order; surplus goes to the
 *   {@code VAR_POSITIONAL} slot, or fails if there is none
 * - keywords fill {@code POSITIONAL} and {@code KEYWORD_ONLY} slots by name; unknown names go
 *   to the {@code VAR_KEYWORD} slot, or fail if there is none
 * - a slot filled twice fails
 * - an unfilled required slot fails, an unfilled optional slot takes its default
 */
final class Arguments {

  private Arguments() {}

  static Object[] bind(Invocable target, List<?> args, Map<String, ?> kwargs) {
    List<ParameterSpec> specs = target.parameters();
    List<?> positional = args == null ? List.of() : args;
    Map<String, ?> keywords = kwargs == null ? Map.of() : kwargs;

    Object[] bound = new Object[specs.size()];
    boolean[] filled = new boolean[specs.size()];
    int varPositional = -1;
    int varKeyword = -1;

    for (int i = 0; i < specs.size(); i++) {
      ParameterSpec.Kind kind = specs.get(i).kind();
      if (kind == ParameterSpec.Kind.VAR_POSITIONAL) varPositional = i;
      if (kind == ParameterSpec.Kind.VAR_KEYWORD) varKeyword = i;
    }

    // Positionals
    List<Object> surplus = new ArrayList<>();
    int slot = 0;
    for (Object arg : positional) {
      while (slot < specs.size() && specs.get(slot).kind() != ParameterSpec.Kind.POSITIONAL) {
        slot++;
      }
      // POSITIONAL slots after a variadic one are not reachable by position
      if (slot < specs.size() && (varPositional == -1 || slot < varPositional)) {
        bound[slot] = arg;
        filled[slot] = true;
        slot++;
      } else if (varPositional != -1) {
        surplus.add(arg);
      } else {
        throw new IllegalArgumentException(
            target + " takes " + countPositional(specs) + " positional argument(s) but "
                + positional.size() + " were given");
      }
    }

    // Keywords
    Map<String, Object> extraKeywords = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : keywords.entrySet()) {
      int idx = indexOfNamed(specs, e.getKey());
      if (idx != -1) {
        if (filled[idx]) {
          throw new IllegalArgumentException(
              target + " got multiple values for argument '" + e.getKey() + "'");
        }
        bound[idx] = e.getValue();
        filled[idx] = true;
      } else if (varKeyword != -1) {
        extraKeywords.put(e.getKey(), e.getValue());
      } else {
        throw new IllegalArgumentException(
            target + " got an unexpected keyword argument '" + e.getKey() + "'");
      }
    }

    // Defaults and variadics
    for (int i = 0; i < specs.size(); i++) {
      ParameterSpec spec = specs.get(i);
      if (i == varPositional) {
        bound[i] = Collections.unmodifiableList(surplus);
      } else if (i == varKeyword) {
        bound[i] = Collections.unmodifiableMap(extraKeywords);
      } else if (!filled[i]) {
        if (spec.required()) {
          throw new IllegalArgumentException(
              target + " missing required argument '" + spec.name() + "'");
        }
        bound[i] = spec.defaultValue();
      }
    }
    return bound;
  }

  private static int indexOfNamed(List<ParameterSpec> specs, String name) {
    for (int i = 0; i < specs.size(); i++) {
      ParameterSpec spec = specs.get(i);
      if (spec.isVariadic()) continue;
      if (spec.name().equals(name)) return i;
    }
    return -1;
  }

  private static int countPositional(List<ParameterSpec> specs) {
    int n = 0;
    for (ParameterSpec spec : specs) {
      if (spec.kind() == ParameterSpec.Kind.POSITIONAL) n++;
    }
    return n;
  }

  /**
   * Index of {@code name} among the positional slots of {@code specs}, or -1 when the
   * parameter cannot be bound by position.
   */
  static int positionOf(List<ParameterSpec> specs, String name) {
    int position = 0;
    for (ParameterSpec spec : specs) {
      if (spec.kind() == ParameterSpec.Kind.VAR_POSITIONAL) return -1;
      if (spec.kind() != ParameterSpec.Kind.POSITIONAL) continue;
      if (spec.name().equals(name)) return position;
      position++;
    }
    return -1;
  }
}
