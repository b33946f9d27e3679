package ru.dimension.inject.handlers;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe named counters.
 */
public class Tally {

  private final Map<String, Integer> counts = new ConcurrentHashMap<>();

  public void add(String key, int amount) {
    counts.merge(key, amount, Integer::sum);
  }

  public void increment(String key) {
    add(key, 1);
  }

  public int get(String key) {
    return counts.getOrDefault(key, 0);
  }
}
