package ru.dimension.inject;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to resolver bindings.
 *
 * A resolver is an {@link Invocable} that receives an injection point's parameters and config
 * and returns a provider. Providers and values are registered as resolvers that accept no
 * arguments. Reads are lock-free; mutations are serialized and each successful one invalidates
 * the {@link ResolutionCache}.
 */
public final class ResolverRegistry {

  private static final Logger log = LoggerFactory.getLogger(ResolverRegistry.class);

  private final Map<String, Invocable> resolvers = new ConcurrentHashMap<>();
  private final ResolutionCache cache;

  public ResolverRegistry(ResolutionCache cache) {
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  // =========================================================================
  // Registration API
  // =========================================================================

  /**
   * Binds {@code resolver} to {@code name} and every alias, replacing prior bindings.
   */
  public synchronized void addResolver(String name, Invocable resolver, String... aliases) {
    Objects.requireNonNull(resolver, "resolver");
    List<String> names = names(name, aliases);
    for (String n : names) {
      resolvers.put(n, resolver);
    }
    cache.invalidateAll();
    log.debug("Bound resolver {} to {}", resolver, names);
  }

  public void addResolver(String name, Resolver resolver, String... aliases) {
    addResolver(name, Resolver.asInvocable(name, resolver), aliases);
  }

  /**
   * Binds a provider, called with no arguments on every injection.
   */
  public void addProvider(String name, Invocable provider, String... aliases) {
    addResolver(name, nullResolver(name, provider), aliases);
  }

  public void addProvider(String name, Supplier<?> provider, String... aliases) {
    addProvider(name, Invocables.of(provider), aliases);
  }

  /**
   * Binds a singleton: every injection receives the same {@code value}.
   */
  public void addValue(String name, Object value, String... aliases) {
    addProvider(name, Invocables.of(() -> value), aliases);
  }

  public synchronized void remove(String name) {
    if (name == null || resolvers.remove(name) == null) {
      throw new UnknownBindingException(name);
    }
    cache.invalidateAll();
    log.debug("Removed binding {}", name);
  }

  // =========================================================================
  // Lookup
  // =========================================================================

  /**
   * The resolver bound to {@code name}, or {@code null}.
   */
  public Invocable lookup(String name) {
    return resolvers.get(name);
  }

  public boolean contains(String name) {
    return resolvers.containsKey(name);
  }

  public SortedSet<String> names() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(resolvers.keySet()));
  }

  private static List<String> names(String name, String... aliases) {
    List<String> names = new ArrayList<>(1 + (aliases == null ? 0 : aliases.length));
    names.add(requireName(name));
    if (aliases != null) {
      for (String alias : aliases) {
        names.add(requireName(alias));
      }
    }
    return names;
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Binding name must be non-blank");
    }
    return name;
  }

  // =========================================================================
  // Provider adapter
  // =========================================================================

  private static Invocable nullResolver(String name, Invocable provider) {
    Objects.requireNonNull(provider, "provider");
    return new NullResolver(name, provider);
  }

  /**
   * Resolver for a plain provider: returns the provider unchanged, rejects any arguments.
   */
  private static final class NullResolver implements Invocable {
    private final String name;
    private final Invocable provider;

    private NullResolver(String name, Invocable provider) {
      this.name = name;
      this.provider = provider;
    }

    @Override
    public List<ParameterSpec> parameters() {
      return Invocables.PASS_THROUGH;
    }

    @Override
    public Object invoke(Object[] bound) {
      List<?> parameters = (List<?>) bound[0];
      Map<?, ?> config = (Map<?, ?>) bound[1];
      if (!parameters.isEmpty() || !config.isEmpty()) {
        throw new InvalidConfigurationException(
            "The dependency provider for '" + name + "' does not accept configuration (it is not a resolver)"
                + ", got parameters " + parameters + " and config " + config);
      }
      return provider;
    }

    @Override
    public String toString() {
      return "provider '" + name + "' (" + provider + ")";
    }
  }
}
