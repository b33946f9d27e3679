package ru.dimension.inject;

/**
 * A binding was removed that does not exist.
 */
public class UnknownBindingException extends InjectionException {

  private final String name;

  public UnknownBindingException(String name) {
    super("No binding registered for '" + name + "'");
    this.name = name;
  }

  public String name() {
    return name;
  }
}
