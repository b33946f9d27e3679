package ru.dimension.inject;

/**
 * Base type for failures raised by the resolution engine.
 */
public class InjectionException extends RuntimeException {

  public InjectionException(String message) {
    super(message);
  }

  public InjectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
