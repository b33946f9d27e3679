package ru.dimension.inject;

/**
 * Carries a checked exception thrown by an {@link Invocable}. Unchecked exceptions and
 * errors are never wrapped.
 */
public class InvocationFailedException extends InjectionException {

  public InvocationFailedException(Invocable target, Throwable cause) {
    super("Failed to invoke " + target, cause);
  }
}
