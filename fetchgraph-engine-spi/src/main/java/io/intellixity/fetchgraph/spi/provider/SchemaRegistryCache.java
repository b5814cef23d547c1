package io.intellixity.fetchgraph.spi.provider;

import io.intellixity.fetchgraph.schema.SchemaDefinition;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.util.ExpiringLruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Built {@link SchemaRegistry} instances keyed by provider (or tenant) key.
 * <p>
 * Entries are evicted least-recently-used beyond {@code maxEntries}, and expire after {@code ttl} since build
 * or {@code idle} since last use; a zero duration disables that bound.
 */
public final class SchemaRegistryCache {
  private static final Logger log = LoggerFactory.getLogger(SchemaRegistryCache.class);

  private final ExpiringLruCache<String, SchemaRegistry> cache;

  public SchemaRegistryCache(int maxEntries, Duration ttl, Duration idle) {
    this.cache = new ExpiringLruCache<>(maxEntries, ttl, idle);
  }

  public SchemaRegistryCache(int maxEntries, Duration ttl, Duration idle, LongSupplier clockMillis) {
    this.cache = new ExpiringLruCache<>(maxEntries, ttl, idle, clockMillis);
  }

  /** Cached registry for {@code key}, building it from {@code definition} on a miss. */
  public SchemaRegistry get(String key, Supplier<SchemaDefinition> definition) {
    Objects.requireNonNull(definition, "definition");
    return cache.computeIfAbsent(key, k -> {
      SchemaDefinition d = Objects.requireNonNull(definition.get(), "definition returned null");
      SchemaRegistry registry = SchemaRegistry.of(d);
      log.debug("fetchgraph.schema op=build key={} entities={} relations={}", k, d.entities().size(), d.relations().size());
      return registry;
    });
  }

  public void invalidate(String key) {
    cache.invalidate(key);
  }

  public int size() {
    return cache.size();
  }
}
