package com.gentoro.duosmium.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.gentoro.duosmium.results.interpreter.Interpretation;
import com.gentoro.duosmium.results.interpreter.Interpreter;
import com.gentoro.duosmium.results.loader.RecordLoader;
import com.gentoro.duosmium.store.ResultsStore;
import java.time.Duration;

/**
 * Read-through cache of interpreted tournaments keyed by (id, file modification time).
 *
 * <p>A record edited on disk gets a new key, so stale interpretations are never served; older
 * versions of the same id are evicted when the new one is loaded. Capacity is bounded and entries
 * expire after a period without access. With caching disabled every call loads and interprets the
 * record again.
 */
public class InterpretationCache {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(InterpretationCache.class);

  record Key(String id, long version) {}

  private final ResultsStore store;
  private final RecordLoader loader;
  private final Interpreter interpreter;
  private final Cache<Key, Interpretation> cache;

  public InterpretationCache(
      ResultsStore store,
      RecordLoader loader,
      Interpreter interpreter,
      boolean enabled,
      long maximumSize,
      Duration expireAfterAccess) {
    this.store = store;
    this.loader = loader;
    this.interpreter = interpreter;
    this.cache =
        enabled
            ? Caffeine.newBuilder()
                .maximumSize(Math.max(1, maximumSize))
                .expireAfterAccess(expireAfterAccess)
                .recordStats()
                .build()
            : null;
  }

  /**
   * Interpretation of the current version of a tournament.
   *
   * @throws com.gentoro.duosmium.exception.NotFoundException when the record does not exist
   */
  public Interpretation get(String id) {
    if (cache == null) {
      return compute(id);
    }
    Key key = new Key(id, store.version(id));
    Interpretation cached = cache.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    cache.asMap().keySet().removeIf(k -> k.id().equals(id) && k.version() != key.version());
    return cache.get(key, k -> compute(k.id()));
  }

  /** Loads and interprets without touching the cache. */
  public Interpretation compute(String id) {
    long start = System.nanoTime();
    Interpretation interpretation = interpreter.interpret(loader.load(id, store.read(id)));
    log.debug("Interpreted {} in {} ms", id, (System.nanoTime() - start) / 1_000_000);
    return interpretation;
  }

  public void invalidateAll() {
    if (cache != null) cache.invalidateAll();
  }

  public long size() {
    if (cache == null) return 0;
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public boolean enabled() {
    return cache != null;
  }
}
