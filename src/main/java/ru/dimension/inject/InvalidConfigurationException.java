package ru.dimension.inject;

/**
 * Parameters or config were given to an injection point whose binding is a plain
 * provider or value and accepts none.
 */
public class InvalidConfigurationException extends InjectionException {

  public InvalidConfigurationException(String message) {
    super(message);
  }
}
