package ru.dimension.inject;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A callable with a declared parameter list. Arguments are bound to the parameters by
 * position and by name (see {@link Arguments}) before {@link #invoke(Object[])} runs.
 *
 * Implementations for methods, constructors, suppliers and programmatic signatures are
 * available from {@link Invocables}.
 */
public interface Invocable {

  List<ParameterSpec> parameters();

  /**
   * Runs the callable with arguments already bound to {@link #parameters()}, one slot per
   * parameter. Variadic slots hold a {@code List} or a {@code Map}.
   */
  Object invoke(Object[] bound) throws Throwable;

  /**
   * The callable this one decorates, or {@code null} if it is not a decoration layer.
   * Signature inspection follows this reference to the underlying definition.
   */
  default Invocable wrapped() {
    return null;
  }

  default Object call(Object... args) {
    return call(args == null ? List.of() : Arrays.asList(args), Map.of());
  }

  default Object call(List<?> args, Map<String, ?> kwargs) {
    Object[] bound = Arguments.bind(this, args, kwargs);
    try {
      return invoke(bound);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new InvocationFailedException(this, t);
    }
  }
}
