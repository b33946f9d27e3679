package ru.dimension.inject;

import java.util.List;
import java.util.Map;

/**
 * Body of a decoration layer created by {@link Invocables#decorate(Invocable, Interceptor)}.
 * Receives the decorated target and the call's arguments as given by the caller.
 */
@FunctionalInterface
public interface Interceptor {

  Object intercept(Invocable target, List<Object> args, Map<String, Object> kwargs) throws Throwable;
}
