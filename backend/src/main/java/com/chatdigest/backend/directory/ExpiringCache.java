package com.chatdigest.backend.directory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/** Key-value cache whose entries are reloaded once they are older than the caller's TTL. */
public interface ExpiringCache<K, V> {

  /**
   * Returns the cached value when it is younger than {@code ttl}, otherwise loads a fresh one with
   * {@code loader}, stores it and returns it. Loader exceptions propagate and leave the cache as it
   * was.
   */
  V getOrRefresh(K key, Duration ttl, Function<? super K, ? extends V> loader);

  Optional<V> getIfFresh(K key, Duration ttl);

  void put(K key, V value);

  void invalidate(K key);
}
