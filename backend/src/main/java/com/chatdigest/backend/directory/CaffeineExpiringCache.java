package com.chatdigest.backend.directory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link ExpiringCache} on top of a size-bounded Caffeine cache. Freshness is judged against the
 * injected {@link Clock} at read time, so different callers may apply different TTLs to the same
 * entry.
 */
public class CaffeineExpiringCache<K, V> implements ExpiringCache<K, V> {

  private final Cache<K, Entry<V>> cache;
  private final Clock clock;

  public CaffeineExpiringCache(long maximumSize, Clock clock) {
    this.cache = Caffeine.newBuilder().maximumSize(maximumSize).build();
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public V getOrRefresh(K key, Duration ttl, Function<? super K, ? extends V> loader) {
    Optional<V> fresh = getIfFresh(key, ttl);
    if (fresh.isPresent()) {
      return fresh.get();
    }
    V value = loader.apply(key);
    put(key, value);
    return value;
  }

  @Override
  public Optional<V> getIfFresh(K key, Duration ttl) {
    Entry<V> entry = cache.getIfPresent(key);
    if (entry == null || !entry.loadedAt().plus(ttl).isAfter(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void put(K key, V value) {
    cache.put(key, new Entry<>(value, clock.instant()));
  }

  @Override
  public void invalidate(K key) {
    cache.invalidate(key);
  }

  private record Entry<V>(V value, Instant loadedAt) {}
}
