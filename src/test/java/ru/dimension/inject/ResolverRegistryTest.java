package ru.dimension.inject;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResolverRegistryTest {

  private ResolutionCache cache;
  private ResolverRegistry registry;

  @BeforeEach
  void setUp() {
    cache = new ResolutionCache();
    registry = new ResolverRegistry(cache);
  }

  @Test
  @DisplayName("A resolver is bound under its name and every alias")
  void aliases() {
    Invocable resolver = Resolver.asInvocable("r", (parameters, config) -> (Supplier<Integer>) () -> 1);
    registry.addResolver("request", resolver, "req", "rq");

    assertSame(resolver, registry.lookup("request"));
    assertSame(resolver, registry.lookup("req"));
    assertSame(resolver, registry.lookup("rq"));
    assertEquals(Set.of("req", "request", "rq"), registry.names());
  }

  @Test
  @DisplayName("Rebinding a name replaces the previous binding")
  void overwrite() {
    registry.addValue("v", 1);
    registry.addValue("v", 2);

    Invocable provider = (Invocable) registry.lookup("v").call();
    assertEquals(2, provider.call());
  }

  @Test
  @DisplayName("Provider bindings return the provider unchanged when called without arguments")
  void nullResolverReturnsProvider() {
    Invocable provider = Invocables.of(() -> "x");
    registry.addProvider("x", provider);

    assertSame(provider, registry.lookup("x").call());
  }

  @Test
  @DisplayName("Provider bindings reject parameters and config")
  void nullResolverRejectsArguments() {
    registry.addValue("x", "value");
    Invocable resolver = registry.lookup("x");

    InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
        () -> resolver.call("p"));
    assertTrue(e.getMessage().contains("'x'"));
    assertThrows(InvalidConfigurationException.class,
        () -> resolver.call(List.of(), Map.of("k", "v")));
  }

  @Test
  @DisplayName("Values are returned as the same object every time")
  void valueIsSingleton() {
    Object value = new Object();
    registry.addValue("v", value);
    Invocable provider = (Invocable) registry.lookup("v").call();

    assertSame(value, provider.call());
    assertSame(value, provider.call());
  }

  @Test
  @DisplayName("Removing an unknown name fails, removing a known one unbinds it")
  void remove() {
    assertThrows(UnknownBindingException.class, () -> registry.remove("missing"));

    registry.addValue("a", 1, "b");
    registry.remove("a");

    assertFalse(registry.contains("a"));
    assertTrue(registry.contains("b"));
    assertThrows(UnknownBindingException.class, () -> registry.remove("a"));
  }

  @Test
  @DisplayName("Every mutation invalidates the resolution cache")
  void mutationsInvalidateCache() {
    Invocable target = Invocables.of(() -> "t");

    cache.get(target, t -> List.of());
    assertEquals(1, cache.size());
    registry.addValue("a", 1);
    assertEquals(0, cache.size());

    cache.get(target, t -> List.of());
    registry.addProvider("b", () -> 2);
    assertEquals(0, cache.size());

    cache.get(target, t -> List.of());
    registry.remove("a");
    assertEquals(0, cache.size());
  }

  @Test
  @DisplayName("A failed removal leaves the cache intact")
  void failedRemovalKeepsCache() {
    Invocable target = Invocables.of(() -> "t");
    cache.get(target, t -> List.of());

    assertThrows(UnknownBindingException.class, () -> registry.remove("missing"));
    assertEquals(1, cache.size());
  }

  @Test
  @DisplayName("Blank names are rejected")
  void blankNames() {
    assertThrows(IllegalArgumentException.class, () -> registry.addValue("", 1));
    assertThrows(IllegalArgumentException.class, () -> registry.addValue("a", 1, " "));
  }
}
