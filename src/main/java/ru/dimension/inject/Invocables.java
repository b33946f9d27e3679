package ru.dimension.inject;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.*;
import java.util.*;
import java.util.function.Supplier;

/**
 * Factories for {@link Invocable}: reflective methods and constructors, suppliers,
 * programmatic signatures and decoration layers.
 */
public final class Invocables {

  private Invocables() {}

  // =========================================================================
  // Reflective invocables
  // =========================================================================

  /**
   * A static method, or an instance method whose receiver is passed as the first positional
   * argument.
   */
  public static Invocable of(Method method) {
    return new MethodInvocable(method, null);
  }

  /**
   * An instance method bound to {@code receiver}.
   */
  public static Invocable of(Object receiver, Method method) {
    Objects.requireNonNull(receiver, "receiver");
    if (!method.getDeclaringClass().isInstance(receiver)) {
      throw new IllegalArgumentException(
          method + " cannot be bound to an instance of " + receiver.getClass().getName());
    }
    return new MethodInvocable(method, receiver);
  }

  /**
   * The single method named {@code methodName} on the receiver's class, bound to the receiver.
   */
  public static Invocable of(Object receiver, String methodName) {
    return of(receiver, findMethod(receiver.getClass(), methodName));
  }

  /**
   * The constructor of {@code type}: the one annotated with {@code jakarta.inject.Inject},
   * else the only declared one, else the no-arg one.
   */
  public static Invocable of(Class<?> type) {
    return new ConstructorInvocable(findConstructor(type));
  }

  public static Invocable of(Supplier<?> supplier) {
    return new SupplierInvocable(supplier);
  }

  /**
   * Coerces a resolver's result into a provider.
   */
  static Invocable asProvider(Object candidate, InjectionPoint point) {
    if (candidate instanceof Invocable invocable) return invocable;
    if (candidate instanceof Supplier<?> supplier) return of(supplier);
    throw new InjectionException(
        "Resolver for injection point '" + point.name() + "' returned "
            + (candidate == null ? "null" : candidate.getClass().getName())
            + " instead of a provider");
  }

  private static Method findMethod(Class<?> type, String methodName) {
    Method found = null;
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Method m : c.getDeclaredMethods()) {
        if (m.isSynthetic() || m.isBridge() || !m.getName().equals(methodName)) continue;
        if (found != null && !overrides(found, m)) {
          throw new IllegalArgumentException(
              "Method name '" + methodName + "' is ambiguous in " + type.getName());
        }
        if (found == null) found = m;
      }
    }
    if (found == null) {
      throw new IllegalArgumentException("No method '" + methodName + "' in " + type.getName());
    }
    return found;
  }

  private static boolean overrides(Method sub, Method sup) {
    return sub.getName().equals(sup.getName())
        && Arrays.equals(sub.getParameterTypes(), sup.getParameterTypes());
  }

  private static Constructor<?> findConstructor(Class<?> type) {
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      throw new IllegalArgumentException("Cannot instantiate " + type.getName());
    }
    Constructor<?>[] ctors = type.getDeclaredConstructors();
    Constructor<?> inject = null;

    for (Constructor<?> c : ctors) {
      if (c.isAnnotationPresent(jakarta.inject.Inject.class)) {
        if (inject != null) {
          throw new IllegalStateException("Multiple @Inject constructors in " + type.getName());
        }
        inject = c;
      }
    }

    if (inject == null && ctors.length == 1) {
      inject = ctors[0];
    }

    if (inject == null) {
      try {
        inject = type.getDeclaredConstructor();
      } catch (NoSuchMethodException e) {
        throw new IllegalStateException("No @Inject, single or default constructor in " + type.getName(), e);
      }
    }
    return inject;
  }

  // =========================================================================
  // Reflective parameter description
  // =========================================================================

  private static List<ParameterSpec> describe(Executable executable) {
    Parameter[] params = executable.getParameters();
    List<ParameterSpec> specs = new ArrayList<>(params.length);
    boolean keywordsSeen = false;

    for (int i = 0; i < params.length; i++) {
      Parameter p = params[i];

      if (executable.isVarArgs() && i == params.length - 1) {
        specs.add(new ParameterSpec(p.getName(), ParameterSpec.Kind.VAR_POSITIONAL, false, null, null));
        continue;
      }

      if (p.isAnnotationPresent(KeywordArguments.class)) {
        if (keywordsSeen || !Map.class.isAssignableFrom(p.getType())) {
          throw new IllegalStateException(
              "@KeywordArguments must mark a single Map parameter: " + executable);
        }
        keywordsSeen = true;
        specs.add(new ParameterSpec(p.getName(), ParameterSpec.Kind.VAR_KEYWORD, false, null, null));
        continue;
      }

      boolean assisted = p.isAnnotationPresent(Assisted.class);
      specs.add(new ParameterSpec(
          p.getName(),
          ParameterSpec.Kind.POSITIONAL,
          !assisted,
          assisted ? defaultValue(p.getType()) : null,
          readMarker(p)));
    }
    return List.copyOf(specs);
  }

  private static InjectionPoint readMarker(Parameter p) {
    Inject inject = p.getAnnotation(Inject.class);
    if (inject != null) {
      return InjectionPoint.fromAnnotation(inject);
    }
    jakarta.inject.Named named = p.getAnnotation(jakarta.inject.Named.class);
    if (named != null && named.value() != null && !named.value().isBlank()) {
      return InjectionPoint.inject(named.value());
    }
    return null;
  }

  private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
      boolean.class, false,
      byte.class, (byte) 0,
      char.class, (char) 0,
      short.class, (short) 0,
      int.class, 0,
      long.class, 0L,
      float.class, 0f,
      double.class, 0d
  );

  private static Object defaultValue(Class<?> type) {
    return type.isPrimitive() ? PRIMITIVE_DEFAULTS.get(type) : null;
  }

  private static Object[] toActualArguments(Executable executable, Object[] bound) {
    if (!executable.isVarArgs()) return bound;

    Object[] actual = bound.clone();
    int last = actual.length - 1;
    List<?> rest = (List<?>) bound[last];
    Class<?> component = executable.getParameterTypes()[last].getComponentType();
    Object array = Array.newInstance(component, rest.size());
    for (int i = 0; i < rest.size(); i++) {
      Array.set(array, i, rest.get(i));
    }
    actual[last] = array;
    return actual;
  }

  private static final class MethodInvocable implements Invocable {
    private final Method method;
    private final Object receiver;
    private final List<ParameterSpec> parameters;

    private MethodInvocable(Method method, Object receiver) {
      this.method = Objects.requireNonNull(method, "method");
      this.receiver = receiver;
      List<ParameterSpec> specs = describe(method);
      if (receiver == null && !Modifier.isStatic(method.getModifiers())) {
        List<ParameterSpec> withSelf = new ArrayList<>(specs.size() + 1);
        withSelf.add(ParameterSpec.required("self"));
        withSelf.addAll(specs);
        specs = List.copyOf(withSelf);
      }
      this.parameters = specs;
      if (!method.trySetAccessible()) {
        throw new IllegalStateException("Cannot access method " + this);
      }
    }

    @Override
    public List<ParameterSpec> parameters() {
      return parameters;
    }

    @Override
    public Object invoke(Object[] bound) throws Throwable {
      Object target = receiver;
      Object[] args = bound;
      if (parameters.size() != method.getParameterCount()) {
        target = bound[0];
        args = Arrays.copyOfRange(bound, 1, bound.length);
      }
      try {
        return method.invoke(target, toActualArguments(method, args));
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof MethodInvocable m)) return false;
      return method.equals(m.method) && receiver == m.receiver;
    }

    @Override
    public int hashCode() {
      return 31 * method.hashCode() + System.identityHashCode(receiver);
    }

    @Override
    public String toString() {
      return method.getDeclaringClass().getName() + "#" + method.getName();
    }
  }

  private static final class ConstructorInvocable implements Invocable {
    private final Constructor<?> constructor;
    private final MethodHandle handle;
    private final List<ParameterSpec> parameters;

    private ConstructorInvocable(Constructor<?> constructor) {
      this.constructor = constructor;
      this.parameters = describe(constructor);
      Class<?> type = constructor.getDeclaringClass();
      try {
        MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(type, MethodHandles.lookup());
        this.handle = lookup.unreflectConstructor(constructor).asFixedArity();
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot access constructor of " + type.getName(), e);
      }
    }

    @Override
    public List<ParameterSpec> parameters() {
      return parameters;
    }

    @Override
    public Object invoke(Object[] bound) throws Throwable {
      return handle.invokeWithArguments(toActualArguments(constructor, bound));
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof ConstructorInvocable c && constructor.equals(c.constructor);
    }

    @Override
    public int hashCode() {
      return constructor.hashCode();
    }

    @Override
    public String toString() {
      return constructor.getDeclaringClass().getName() + ".<init>";
    }
  }

  private static final class SupplierInvocable implements Invocable {
    private final Supplier<?> supplier;

    private SupplierInvocable(Supplier<?> supplier) {
      this.supplier = Objects.requireNonNull(supplier, "supplier");
    }

    @Override
    public List<ParameterSpec> parameters() {
      return List.of();
    }

    @Override
    public Object invoke(Object[] bound) {
      return supplier.get();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof SupplierInvocable s && supplier == s.supplier;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(supplier);
    }

    @Override
    public String toString() {
      return "supplier " + supplier;
    }
  }

  // =========================================================================
  // Decoration
  // =========================================================================

  /**
   * Wraps {@code target} in a layer that accepts any arguments and hands them to
   * {@code interceptor}. The layer keeps a back-reference to {@code target}, so inspecting
   * it yields the target's injection points.
   */
  public static Invocable decorate(Invocable target, Interceptor interceptor) {
    return new DecoratedInvocable(target, interceptor);
  }

  static final List<ParameterSpec> PASS_THROUGH = List.of(
      new ParameterSpec("args", ParameterSpec.Kind.VAR_POSITIONAL, false, null, null),
      new ParameterSpec("kwargs", ParameterSpec.Kind.VAR_KEYWORD, false, null, null));

  private static final class DecoratedInvocable implements Invocable {
    private final Invocable target;
    private final Interceptor interceptor;

    private DecoratedInvocable(Invocable target, Interceptor interceptor) {
      this.target = Objects.requireNonNull(target, "target");
      this.interceptor = Objects.requireNonNull(interceptor, "interceptor");
    }

    @Override
    public List<ParameterSpec> parameters() {
      return PASS_THROUGH;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object invoke(Object[] bound) throws Throwable {
      return interceptor.intercept(target, (List<Object>) bound[0], (Map<String, Object>) bound[1]);
    }

    @Override
    public Invocable wrapped() {
      return target;
    }

    @Override
    public String toString() {
      return "decorated " + target;
    }
  }

  // =========================================================================
  // Programmatic signatures
  // =========================================================================

  public static SignatureBuilder builder() {
    return new SignatureBuilder("invocable");
  }

  public static SignatureBuilder builder(String displayName) {
    return new SignatureBuilder(displayName);
  }

  /**
   * Body of a programmatic invocable. Receives the bound arguments keyed by parameter
   * name, in declaration order; variadic parameters hold a {@code List} or a {@code Map}.
   */
  @FunctionalInterface
  public interface Body {
    Object apply(Map<String, Object> arguments) throws Exception;
  }

  public static final class SignatureBuilder {
    private final String displayName;
    private final List<ParameterSpec> parameters = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private boolean varPositional;
    private boolean varKeyword;
    private boolean optionalSeen;

    private SignatureBuilder(String displayName) {
      this.displayName = Objects.requireNonNull(displayName, "displayName");
    }

    /** A required positional parameter. */
    public SignatureBuilder param(String name) {
      return add(new ParameterSpec(name, kindForNamed(), true, null, null));
    }

    /** A required positional parameter with a declared injection marker. */
    public SignatureBuilder param(String name, InjectionPoint marker) {
      return add(new ParameterSpec(name, kindForNamed(), true, null, Objects.requireNonNull(marker, "marker")));
    }

    /** An optional parameter; an {@link InjectionPoint} default makes it an explicit injection point. */
    public SignatureBuilder optional(String name, Object defaultValue) {
      return add(new ParameterSpec(name, kindForNamed(), false, defaultValue, null));
    }

    /** A required parameter that can only be passed by name. */
    public SignatureBuilder keywordOnly(String name) {
      return add(new ParameterSpec(name, ParameterSpec.Kind.KEYWORD_ONLY, true, null, null));
    }

    public SignatureBuilder keywordOnly(String name, Object defaultValue) {
      return add(new ParameterSpec(name, ParameterSpec.Kind.KEYWORD_ONLY, false, defaultValue, null));
    }

    public SignatureBuilder varArgs(String name) {
      if (varPositional || varKeyword) {
        throw new IllegalStateException("Variadic positional parameter must precede keywords and appear once");
      }
      varPositional = true;
      return add(new ParameterSpec(name, ParameterSpec.Kind.VAR_POSITIONAL, false, null, null));
    }

    public SignatureBuilder varKeywords(String name) {
      if (varKeyword) {
        throw new IllegalStateException("Only one variadic keyword parameter is allowed");
      }
      varKeyword = true;
      return add(new ParameterSpec(name, ParameterSpec.Kind.VAR_KEYWORD, false, null, null));
    }

    public Invocable body(Body body) {
      return new LambdaInvocable(displayName, List.copyOf(parameters), Objects.requireNonNull(body, "body"));
    }

    private ParameterSpec.Kind kindForNamed() {
      if (varKeyword) {
        throw new IllegalStateException("No parameter may follow the variadic keyword parameter");
      }
      return varPositional ? ParameterSpec.Kind.KEYWORD_ONLY : ParameterSpec.Kind.POSITIONAL;
    }

    private SignatureBuilder add(ParameterSpec spec) {
      if (!names.add(spec.name())) {
        throw new IllegalArgumentException("Duplicate parameter '" + spec.name() + "'");
      }
      if (spec.kind() == ParameterSpec.Kind.POSITIONAL && !spec.required()) {
        optionalSeen = true;
      } else if (spec.kind() == ParameterSpec.Kind.POSITIONAL && optionalSeen) {
        throw new IllegalArgumentException(
            "Required parameter '" + spec.name() + "' follows an optional one");
      }
      parameters.add(spec);
      return this;
    }
  }

  private static final class LambdaInvocable implements Invocable {
    private final String displayName;
    private final List<ParameterSpec> parameters;
    private final Body body;

    private LambdaInvocable(String displayName, List<ParameterSpec> parameters, Body body) {
      this.displayName = displayName;
      this.parameters = parameters;
      this.body = body;
    }

    @Override
    public List<ParameterSpec> parameters() {
      return parameters;
    }

    @Override
    public Object invoke(Object[] bound) throws Exception {
      Map<String, Object> arguments = new LinkedHashMap<>();
      for (int i = 0; i < bound.length; i++) {
        arguments.put(parameters.get(i).name(), bound[i]);
      }
      return body.apply(arguments);
    }

    @Override
    public String toString() {
      return displayName;
    }
  }
}
