package ru.dimension.inject;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.dimension.inject.handlers.Handlers;
import ru.dimension.inject.handlers.Report;
import ru.dimension.inject.handlers.Tally;

class InvocablesTest {

  @Nested
  @DisplayName("Methods")
  class MethodTests {

    @Test
    @DisplayName("Bound methods accept positional and keyword arguments")
    void boundMethod() {
      Invocable greet = Invocables.of(new Handlers(), "greet");

      assertEquals("Hi, Ann", greet.call("Hi", "Ann"));
      assertEquals("Hi, Bob", greet.call(List.of(), Map.of("greeting", "Hi", "name", "Bob")));
      assertEquals("Hi, stranger", greet.call("Hi"));
    }

    @Test
    @DisplayName("Assisted primitives default to zero and keyword maps collect the rest")
    void assistedAndKeywords() {
      Invocable describe = Invocables.of(new Handlers(), "describe");

      assertEquals("ax0{}", describe.call("a"));
      assertEquals("ax3{mode=fast}", describe.call(List.of("a", 3), Map.of("mode", "fast")));
    }

    @Test
    @DisplayName("Java varargs receive the surplus positionals")
    void varargs() throws Exception {
      Invocable sum = Invocables.of(Handlers.class.getMethod("sum", int.class, int[].class));

      assertEquals(1, sum.call(1));
      assertEquals(10, sum.call(1, 2, 3, 4));
    }

    @Test
    @DisplayName("Unbound instance methods take the receiver first")
    void unboundMethod() throws Exception {
      Invocable greet = Invocables.of(Handlers.class.getMethod("greet", String.class, String.class));

      assertEquals("Yo, Cy", greet.call(new Handlers(), "Yo", "Cy"));
    }

    @Test
    @DisplayName("Checked exceptions are wrapped, unchecked ones propagate")
    void exceptions() throws Exception {
      Invocable fail = Invocables.of(Handlers.class.getMethod("fail"));
      InvocationFailedException e = assertThrows(InvocationFailedException.class, () -> fail.call());
      assertEquals("checked failure", e.getCause().getMessage());

      Invocable boom = Invocables.of(() -> {
        throw new IllegalStateException("boom");
      });
      assertThrows(IllegalStateException.class, () -> boom.call());
    }

    @Test
    @DisplayName("Equal methods on the same receiver are equal invocables")
    void equality() {
      Handlers handlers = new Handlers();

      assertEquals(Invocables.of(handlers, "greet"), Invocables.of(handlers, "greet"));
      assertNotEquals(Invocables.of(handlers, "greet"), Invocables.of(new Handlers(), "greet"));
    }

    @Test
    @DisplayName("Unknown method names are rejected")
    void unknownMethod() {
      assertThrows(IllegalArgumentException.class, () -> Invocables.of(new Handlers(), "nope"));
    }
  }

  @Nested
  @DisplayName("Constructors")
  class ConstructorTests {

    @Test
    @DisplayName("The @Inject constructor is used")
    void injectConstructor() {
      Tally tally = new Tally();
      Report report = (Report) Invocables.of(Report.class).call(tally, "Q3");

      assertSame(tally, report.tally);
      assertEquals("Q3", report.heading);
    }

    @Test
    @DisplayName("Interfaces cannot be instantiated")
    void interfaceRejected() {
      assertThrows(IllegalArgumentException.class, () -> Invocables.of(Runnable.class));
    }
  }

  @Nested
  @DisplayName("Programmatic signatures")
  class BuilderTests {

    @Test
    @DisplayName("The body receives bound arguments by name")
    void body() {
      Invocable add = Invocables.builder("add")
          .param("a")
          .optional("b", 10)
          .body(args -> (Integer) args.get("a") + (Integer) args.get("b"));

      assertEquals(11, add.call(1));
      assertEquals(3, add.call(1, 2));
      assertEquals("add", add.toString());
    }

    @Test
    @DisplayName("Invalid parameter orders are rejected")
    void invalidOrder() {
      assertThrows(IllegalArgumentException.class,
          () -> Invocables.builder().optional("a", 1).param("b"));
      assertThrows(IllegalArgumentException.class,
          () -> Invocables.builder().param("a").param("a"));
      assertThrows(IllegalStateException.class,
          () -> Invocables.builder().varKeywords("k").param("a"));
    }
  }

  @Test
  @DisplayName("Decoration layers see the caller's arguments and keep a back-reference")
  void decorate() {
    Invocable inner = Invocables.builder().param("a").body(args -> args.get("a"));
    Invocable decorated = Invocables.decorate(inner,
        (target, args, kwargs) -> "<" + target.call(args, kwargs) + ">");

    assertSame(inner, decorated.wrapped());
    assertEquals("<x>", decorated.call("x"));
    assertEquals("<y>", decorated.call(List.of(), Map.of("a", "y")));
  }
}
