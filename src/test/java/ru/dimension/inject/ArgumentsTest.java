package ru.dimension.inject;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

  private final Invocable target = Invocables.builder("target")
      .param("a")
      .optional("b", "B")
      .varArgs("rest")
      .keywordOnly("flag", false)
      .varKeywords("extra")
      .body(args -> args);

  @Test
  @DisplayName("Positionals fill slots in order and overflow into the variadic slot")
  void positionalBinding() {
    Object[] bound = Arguments.bind(target, List.of(1, 2, 3, 4), Map.of());

    assertArrayEquals(new Object[] {1, 2, List.of(3, 4), false, Map.of()}, bound);
  }

  @Test
  @DisplayName("Keywords fill named slots, unknown names go to the keyword map")
  void keywordBinding() {
    Object[] bound = Arguments.bind(target, List.of(), Map.of("a", 1, "flag", true, "other", "x"));

    assertArrayEquals(new Object[] {1, "B", List.of(), true, Map.of("other", "x")}, bound);
  }

  @Test
  @DisplayName("Missing required arguments fail")
  void missingRequired() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> Arguments.bind(target, List.of(), Map.of()));

    assertTrue(e.getMessage().contains("missing required argument 'a'"));
  }

  @Test
  @DisplayName("A slot supplied by position and keyword fails")
  void multipleValues() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> Arguments.bind(target, List.of(1), Map.of("a", 2)));

    assertTrue(e.getMessage().contains("multiple values for argument 'a'"));
  }

  @Test
  @DisplayName("Without variadic slots, surplus arguments fail")
  void surplusArguments() {
    Invocable strict = Invocables.builder("strict").param("a").body(args -> null);

    assertThrows(IllegalArgumentException.class, () -> Arguments.bind(strict, List.of(1, 2), Map.of()));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> Arguments.bind(strict, List.of(), Map.of("a", 1, "b", 2)));
    assertTrue(e.getMessage().contains("unexpected keyword argument 'b'"));
  }

  @Test
  @DisplayName("Keyword-only slots are not reachable by position")
  void keywordOnlyByName() {
    Invocable kw = Invocables.builder("kw").varArgs("rest").keywordOnly("k").body(args -> null);

    assertThrows(IllegalArgumentException.class, () -> Arguments.bind(kw, List.of(1), Map.of()));
    assertArrayEquals(new Object[] {List.of(1), 2}, Arguments.bind(kw, List.of(1), Map.of("k", 2)));
  }

  @Test
  @DisplayName("Positions count only positional slots before any variadic one")
  void positions() {
    assertEquals(0, Arguments.positionOf(target.parameters(), "a"));
    assertEquals(1, Arguments.positionOf(target.parameters(), "b"));
    assertEquals(-1, Arguments.positionOf(target.parameters(), "flag"));
    assertEquals(-1, Arguments.positionOf(target.parameters(), "missing"));
  }
}
