package ru.dimension.inject;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the injectable parameters of a callable from named bindings and calls it.
 *
 * Typical use:
 * <pre>
 *   ResolutionEngine engine = new ResolutionEngine();
 *   engine.addValue("request", request, "req", "rq");
 *   Invocable handler = engine.wrap(Invocables.of(controller, "show"));
 *   handler.call("42");
 * </pre>
 *
 * Resolvers are called once per injection point and cached with the target callable; the
 * providers they return are called on every call. Arguments given by the caller are never
 * replaced by injected ones. Resolvers that depend on their own name recurse until the stack
 * overflows; no cycle detection is done.
 */
public final class ResolutionEngine {

  private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

  private final SignatureInspector inspector;
  private final ResolutionCache cache;
  private final ResolverRegistry registry;

  public ResolutionEngine() {
    this(new SignatureInspector());
  }

  public ResolutionEngine(SignatureInspector inspector) {
    this.inspector = Objects.requireNonNull(inspector, "inspector");
    this.cache = new ResolutionCache();
    this.registry = new ResolverRegistry(cache);
  }

  // =========================================================================
  // Registration
  // =========================================================================

  public ResolutionEngine addResolver(String name, Invocable resolver, String... aliases) {
    registry.addResolver(name, resolver, aliases);
    return this;
  }

  public ResolutionEngine addResolver(String name, Resolver resolver, String... aliases) {
    registry.addResolver(name, resolver, aliases);
    return this;
  }

  public ResolutionEngine addProvider(String name, Invocable provider, String... aliases) {
    registry.addProvider(name, provider, aliases);
    return this;
  }

  public ResolutionEngine addProvider(String name, Supplier<?> provider, String... aliases) {
    registry.addProvider(name, provider, aliases);
    return this;
  }

  public ResolutionEngine addValue(String name, Object value, String... aliases) {
    registry.addValue(name, value, aliases);
    return this;
  }

  public ResolutionEngine remove(String name) {
    registry.remove(name);
    return this;
  }

  /**
   * Registers every public method of {@code module} annotated with {@link Provides} or
   * {@link Resolves}. Instance methods are bound to {@code module}; their own parameters are
   * injected like those of any other provider or resolver.
   */
  public ResolutionEngine install(Object module) {
    Objects.requireNonNull(module, "module");
    Method[] methods = module.getClass().getMethods();
    Arrays.sort(methods, Comparator.comparing(Method::getName));

    int installed = 0;
    for (Method m : methods) {
      Provides provides = m.getAnnotation(Provides.class);
      Resolves resolves = m.getAnnotation(Resolves.class);
      if (provides == null && resolves == null) continue;
      if (provides != null && resolves != null) {
        throw new IllegalStateException(
            "Method cannot be both @Provides and @Resolves: " + m.getDeclaringClass().getName() + "#" + m.getName());
      }

      Invocable invocable = Modifier.isStatic(m.getModifiers()) ? Invocables.of(m) : Invocables.of(module, m);
      if (provides != null) {
        registry.addProvider(provides.value(), invocable, provides.aliases());
      } else {
        registry.addResolver(resolves.value(), invocable, resolves.aliases());
      }
      installed++;
    }
    log.debug("Installed {} binding(s) from {}", installed, module.getClass().getName());
    return this;
  }

  // =========================================================================
  // Resolution
  // =========================================================================

  public Map<String, InjectionPoint> inspect(Invocable target) {
    return inspector.inspect(target);
  }

  /**
   * The providers needed to call {@code target}, computed on first use and cached until the
   * next registry change.
   */
  public List<ResolvedDependency> resolveDependencies(Invocable target) {
    return cache.get(target, this::computeDependencies);
  }

  private List<ResolvedDependency> computeDependencies(Invocable target) {
    List<ParameterSpec> parameters = SignatureInspector.unwrap(target).parameters();
    Map<String, InjectionPoint> points = inspector.inspect(target);

    List<ResolvedDependency> resolved = new ArrayList<>(points.size());
    for (Map.Entry<String, InjectionPoint> e : points.entrySet()) {
      String parameter = e.getKey();
      resolved.add(new ResolvedDependency(parameter, prime(e.getValue()), Arguments.positionOf(parameters, parameter)));
    }
    return resolved;
  }

  /**
   * Calls the resolver bound to {@code point} with the point's parameters and config and
   * returns the provider it produces, wrapped for injection.
   */
  public Invocable prime(InjectionPoint point) {
    Invocable resolver = registry.lookup(point.name());
    if (resolver == null) {
      throw new UnresolvedDependencyException(point);
    }
    Object provider = callInject(resolver, point.parameters(), point.config());
    return wrap(Invocables.asProvider(provider, point));
  }

  public Object callInject(Invocable target, Object... args) {
    return callInject(target, args == null ? List.of() : Arrays.asList(args), Map.of());
  }

  /**
   * Calls {@code target}, adding a value for every injectable parameter the caller did not
   * supply by keyword or by position.
   */
  public Object callInject(Invocable target, List<?> args, Map<String, ?> kwargs) {
    List<?> positional = args == null ? List.of() : args;
    Map<String, Object> arguments = kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs);

    for (ResolvedDependency dependency : resolveDependencies(target)) {
      if (!dependency.suppliedBy(positional.size(), arguments)) {
        arguments.put(dependency.parameter(), dependency.provider().call());
      }
    }
    return target.call(positional, arguments);
  }

  /**
   * Returns a callable that injects dependencies into {@code target} on every call, or
   * {@code target} itself when it has nothing to inject.
   */
  public Invocable wrap(Invocable target) {
    if (inspector.inspect(target).isEmpty()) {
      return target;
    }
    return new InjectingInvocable(this, target);
  }

  // =========================================================================
  // Accessors
  // =========================================================================

  public ResolverRegistry registry() {
    return registry;
  }

  public SignatureInspector inspector() {
    return inspector;
  }

  ResolutionCache cache() {
    return cache;
  }
}
