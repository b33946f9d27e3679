package ru.dimension.inject;

import java.util.*;
import java.util.function.Supplier;

/**
 * Entry point for assembling a {@link ResolutionEngine} at startup.
 *
 * <pre>
 *   ResolutionEngine engine = DimensionInject.builder()
 *       .value("config", config)
 *       .value("request", request, "req", "rq")
 *       .module(new StorageModule())
 *       .exposeEngine("injector")
 *       .build();
 * </pre>
 */
public final class DimensionInject {

  private DimensionInject() {}

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Set<String> neverInject = new LinkedHashSet<>(SignatureInspector.Config.defaults().neverInject());
    private final List<Registration> registrations = new ArrayList<>();
    private final List<String> engineNames = new ArrayList<>();

    /**
     * Parameter names that are never injected implicitly. Replaces the default ({@code self}).
     */
    public Builder neverInject(String... names) {
      neverInject.clear();
      neverInject.addAll(List.of(names));
      return this;
    }

    public Builder value(String name, Object value, String... aliases) {
      registrations.add(engine -> engine.addValue(name, value, aliases));
      return this;
    }

    public Builder provider(String name, Supplier<?> provider, String... aliases) {
      Objects.requireNonNull(provider, "provider");
      registrations.add(engine -> engine.addProvider(name, provider, aliases));
      return this;
    }

    public Builder provider(String name, Invocable provider, String... aliases) {
      Objects.requireNonNull(provider, "provider");
      registrations.add(engine -> engine.addProvider(name, provider, aliases));
      return this;
    }

    public Builder resolver(String name, Resolver resolver, String... aliases) {
      Objects.requireNonNull(resolver, "resolver");
      registrations.add(engine -> engine.addResolver(name, resolver, aliases));
      return this;
    }

    public Builder resolver(String name, Invocable resolver, String... aliases) {
      Objects.requireNonNull(resolver, "resolver");
      registrations.add(engine -> engine.addResolver(name, resolver, aliases));
      return this;
    }

    /**
     * Registers the {@link Provides} and {@link Resolves} methods of {@code module}.
     */
    public Builder module(Object module) {
      Objects.requireNonNull(module, "module");
      registrations.add(engine -> engine.install(module));
      return this;
    }

    /**
     * Makes the built engine itself injectable under {@code name}.
     */
    public Builder exposeEngine(String name, String... aliases) {
      engineNames.add(name);
      engineNames.addAll(List.of(aliases));
      return this;
    }

    /**
     * Registrations are applied in the order they were declared; a later one with the same
     * name replaces an earlier one.
     */
    public ResolutionEngine build() {
      ResolutionEngine engine = new ResolutionEngine(
          new SignatureInspector(new SignatureInspector.Config(neverInject)));

      if (!engineNames.isEmpty()) {
        List<String> aliases = engineNames.subList(1, engineNames.size());
        engine.addValue(engineNames.get(0), engine, aliases.toArray(new String[0]));
      }
      for (Registration registration : registrations) {
        registration.apply(engine);
      }
      return engine;
    }

    @FunctionalInterface
    private interface Registration {
      void apply(ResolutionEngine engine);
    }
  }
}
