package io.intellixity.polystage.pipeline.cache;

import io.intellixity.polystage.model.PipelineResult;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU result cache with a TTL per entry.\n
 *
 * - LRU eviction: access-order LinkedHashMap bounded by maxEntries\n
 * - TTL: expire-after-write, checked on lookup and by {@link #sweepExpired()}\n
 */
public final class InMemoryResultCache implements ResultCache {
  private final int maxEntries;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<String, Entry> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry(PipelineResult result, long createdAt, long ttlMillis) {
    boolean isExpired(long now) {
      return (now - createdAt) >= ttlMillis;
    }
  }

  public InMemoryResultCache(int maxEntries) {
    this(maxEntries, System::currentTimeMillis);
  }

  public InMemoryResultCache(int maxEntries, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    this.maxEntries = maxEntries;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  @Override
  public synchronized Optional<PipelineResult> get(String fingerprint) {
    Objects.requireNonNull(fingerprint, "fingerprint");
    Entry e = map.get(fingerprint);
    if (e == null) return Optional.empty();
    if (e.isExpired(nowMillis.getAsLong())) {
      map.remove(fingerprint);
      return Optional.empty();
    }
    return Optional.of(e.result());
  }

  @Override
  public synchronized void put(String fingerprint, PipelineResult result, Duration ttl) {
    Objects.requireNonNull(fingerprint, "fingerprint");
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(ttl, "ttl");
    long ttlMillis = ttl.toMillis();
    if (ttlMillis <= 0) return;
    map.put(fingerprint, new Entry(result, nowMillis.getAsLong(), ttlMillis));
    evictIfNeeded();
  }

  @Override
  public synchronized int sweepExpired() {
    if (map.isEmpty()) return 0;
    long now = nowMillis.getAsLong();
    int removed = 0;
    Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().isExpired(now)) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  @Override
  public synchronized int size() {
    return map.size();
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
    }
  }
}
