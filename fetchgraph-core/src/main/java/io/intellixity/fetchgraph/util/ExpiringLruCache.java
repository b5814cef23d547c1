package io.intellixity.fetchgraph.util;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Size-bounded LRU map whose entries also expire after a time-to-live since write and, optionally, after an
 * idle period since last read. A zero duration disables that expiry.
 * <p>
 * All operations synchronize on the cache; the loader passed to {@link #computeIfAbsent} runs under that lock.
 */
public final class ExpiringLruCache<K, V> {
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier clock;
  private final LinkedHashMap<K, Slot<V>> slots;

  private static final class Slot<V> {
    final V value;
    final long writtenAt;
    long readAt;

    Slot(V value, long now) {
      this.value = value;
      this.writtenAt = now;
      this.readAt = now;
    }
  }

  public ExpiringLruCache(int maxEntries, Duration ttl, Duration idle) {
    this(maxEntries, ttl, idle, System::currentTimeMillis);
  }

  public ExpiringLruCache(int maxEntries, Duration ttl, Duration idle, LongSupplier clockMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    this.ttlMillis = nonNegative(ttl, "ttl");
    this.idleMillis = nonNegative(idle, "idle");
    this.clock = Objects.requireNonNull(clockMillis, "clockMillis");
    this.slots = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, Slot<V>> eldest) {
        return size() > maxEntries;
      }
    };
  }

  public synchronized V getIfPresent(K key) {
    Objects.requireNonNull(key, "key");
    Slot<V> slot = slots.get(key);
    if (slot == null) return null;
    long now = clock.getAsLong();
    if (expired(slot, now)) {
      slots.remove(key);
      return null;
    }
    slot.readAt = now;
    return slot.value;
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    slots.put(key, new Slot<>(value, clock.getAsLong()));
  }

  public synchronized V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
    Objects.requireNonNull(loader, "loader");
    V cached = getIfPresent(key);
    if (cached != null) return cached;
    V loaded = Objects.requireNonNull(loader.apply(key), "loader returned null");
    put(key, loaded);
    return loaded;
  }

  public synchronized void invalidate(K key) {
    slots.remove(key);
  }

  public synchronized void invalidateAll() {
    slots.clear();
  }

  /** Live entries; expired ones are dropped first. */
  public synchronized int size() {
    long now = clock.getAsLong();
    slots.values().removeIf(s -> expired(s, now));
    return slots.size();
  }

  private boolean expired(Slot<V> slot, long now) {
    return (ttlMillis > 0 && now - slot.writtenAt >= ttlMillis)
        || (idleMillis > 0 && now - slot.readAt >= idleMillis);
  }

  private static long nonNegative(Duration d, String name) {
    if (d == null) return 0;
    if (d.isNegative()) throw new IllegalArgumentException(name + " must not be negative");
    return d.toMillis();
  }
}
