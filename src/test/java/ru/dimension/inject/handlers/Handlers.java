package ru.dimension.inject.handlers;

import jakarta.inject.Named;
import java.util.Map;
import ru.dimension.inject.Assisted;
import ru.dimension.inject.Inject;
import ru.dimension.inject.KeywordArguments;

public class Handlers {

  public String greet(String greeting, @Assisted String name) {
    return greeting + ", " + (name == null ? "stranger" : name);
  }

  public boolean count(Tally c, @Named("c") Tally other) {
    c.increment("counter_used");
    return c == other;
  }

  public int special(@Inject(value = "c", parameters = "special_called",
                             config = @Inject.Option(key = "increment", value = "10")) Tally counter) {
    counter.increment("counter_used");
    return counter.get("special_called");
  }

  public String describe(String first, @Assisted int times, @KeywordArguments Map<String, Object> options) {
    return first + "x" + times + options;
  }

  public static int sum(int base, int... rest) {
    int total = base;
    for (int r : rest) {
      total += r;
    }
    return total;
  }

  public static void fail() throws Exception {
    throw new Exception("checked failure");
  }
}
