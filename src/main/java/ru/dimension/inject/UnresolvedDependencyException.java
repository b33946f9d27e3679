package ru.dimension.inject;

/**
 * An injection point names a dependency that has no binding.
 */
public class UnresolvedDependencyException extends InjectionException {

  private final InjectionPoint injectionPoint;

  public UnresolvedDependencyException(InjectionPoint injectionPoint) {
    super("Could not resolve provider for injection point '" + injectionPoint.name() + "'");
    this.injectionPoint = injectionPoint;
  }

  public InjectionPoint injectionPoint() {
    return injectionPoint;
  }
}
