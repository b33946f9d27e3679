package ru.dimension.inject;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes, per target callable, the dependencies needed to call it.
 *
 * Reads never lock. A miss computes outside any lock; concurrent misses for the same target
 * may both compute, and one result wins. Entries are installed fully formed, and an entry
 * computed before {@link #invalidateAll()} is never left installed after it.
 */
public final class ResolutionCache {

  private static final Logger log = LoggerFactory.getLogger(ResolutionCache.class);

  private final Map<Invocable, List<ResolvedDependency>> entries = new ConcurrentHashMap<>();
  private volatile long generation;

  public List<ResolvedDependency> get(Invocable target, Function<Invocable, List<ResolvedDependency>> resolver) {
    Objects.requireNonNull(target, "target");
    List<ResolvedDependency> cached = entries.get(target);
    if (cached != null) return cached;

    long observed = generation;
    List<ResolvedDependency> computed = List.copyOf(resolver.apply(target));

    if (observed == generation) {
      List<ResolvedDependency> raced = entries.putIfAbsent(target, computed);
      if (raced != null) return raced;
      // An invalidation slipped in between the check and the put
      if (observed != generation) {
        entries.remove(target, computed);
      } else {
        log.trace("Cached {} dependencies for {}", computed.size(), target);
      }
    }
    return computed;
  }

  public List<ResolvedDependency> peek(Invocable target) {
    return entries.get(target);
  }

  /**
   * Drops every entry. Callers serialize invalidations with each other.
   */
  public void invalidateAll() {
    generation++;
    entries.clear();
    log.debug("Resolution cache invalidated (generation {})", generation);
  }

  public int size() {
    return entries.size();
  }
}
