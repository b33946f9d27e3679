package ru.dimension.inject;

import java.util.Map;

/**
 * A parameter of a target callable paired with the provider that fills it.
 *
 * @param parameter parameter name on the target
 * @param provider  zero-argument provider, already wrapped for injection
 * @param position  index of the parameter among the target's positional slots, or -1
 */
public record ResolvedDependency(String parameter, Invocable provider, int position) {

  /**
   * Whether a call already supplies this parameter, by keyword or by position.
   */
  boolean suppliedBy(int positionalCount, Map<String, ?> kwargs) {
    return kwargs.containsKey(parameter) || (position >= 0 && position < positionalCount);
  }
}
