package com.chatdigest.backend.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatdigest.backend.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CaffeineExpiringCacheTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
  private final CaffeineExpiringCache<String, String> cache = new CaffeineExpiringCache<>(100, clock);

  @Test
  void servesCachedValueWhileFresh() {
    AtomicInteger loads = new AtomicInteger();

    cache.getOrRefresh("U1", Duration.ofHours(1), key -> "v" + loads.incrementAndGet());
    clock.advance(Duration.ofMinutes(59));
    String value = cache.getOrRefresh("U1", Duration.ofHours(1), key -> "v" + loads.incrementAndGet());

    assertThat(value).isEqualTo("v1");
    assertThat(loads).hasValue(1);
  }

  @Test
  void reloadsOnceTtlElapsed() {
    AtomicInteger loads = new AtomicInteger();

    cache.getOrRefresh("U1", Duration.ofHours(1), key -> "v" + loads.incrementAndGet());
    clock.advance(Duration.ofHours(1));
    String value = cache.getOrRefresh("U1", Duration.ofHours(1), key -> "v" + loads.incrementAndGet());

    assertThat(value).isEqualTo("v2");
    assertThat(cache.getIfFresh("U1", Duration.ofHours(1))).contains("v2");
  }

  @Test
  void failedLoadLeavesPreviousEntry() {
    cache.put("U1", "old");
    clock.advance(Duration.ofHours(2));

    assertThatThrownBy(
            () ->
                cache.getOrRefresh(
                    "U1",
                    Duration.ofHours(1),
                    key -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(cache.getIfFresh("U1", Duration.ofHours(3))).contains("old");
  }

  @Test
  void invalidateDropsEntry() {
    cache.put("U1", "value");

    cache.invalidate("U1");

    assertThat(cache.getIfFresh("U1", Duration.ofDays(1))).isEmpty();
  }
}
