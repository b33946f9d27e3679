package ru.dimension.inject;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of {@link ResolutionEngine#wrap(Invocable)}: accepts the same arguments as the
 * target and injects the missing ones on every call.
 */
public final class InjectingInvocable implements Invocable {

  private final ResolutionEngine engine;
  private final Invocable target;

  InjectingInvocable(ResolutionEngine engine, Invocable target) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.target = Objects.requireNonNull(target, "target");
  }

  /**
   * The engine that injects into this callable.
   */
  public ResolutionEngine engine() {
    return engine;
  }

  @Override
  public Invocable wrapped() {
    return target;
  }

  @Override
  public List<ParameterSpec> parameters() {
    return Invocables.PASS_THROUGH;
  }

  @Override
  @SuppressWarnings("unchecked")
  public Object invoke(Object[] bound) {
    return engine.callInject(target, (List<Object>) bound[0], (Map<String, Object>) bound[1]);
  }

  @Override
  public Object call(List<?> args, Map<String, ?> kwargs) {
    return engine.callInject(target, args, kwargs);
  }

  @Override
  public String toString() {
    return "injecting " + target;
  }
}
