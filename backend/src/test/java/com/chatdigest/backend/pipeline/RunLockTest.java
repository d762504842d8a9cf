package com.chatdigest.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RunLockTest {

  private final RunLock lock = new RunLock();

  @Test
  void returnsResultAndReleases() {
    assertThat(lock.runExclusive("ingestion", () -> 42)).isEqualTo(42);
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  void releasesAfterFailure() {
    assertThatThrownBy(
            () ->
                lock.runExclusive(
                    "purge",
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  void rejectsOverlappingRunFromAnotherThread() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    CompletableFuture<String> first =
        CompletableFuture.supplyAsync(
            () ->
                lock.runExclusive(
                    "scheduled cycle",
                    () -> {
                      started.countDown();
                      try {
                        release.await(5, TimeUnit.SECONDS);
                      } catch (InterruptedException exception) {
                        Thread.currentThread().interrupt();
                      }
                      return "done";
                    }));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    try {
      assertThatThrownBy(() -> lock.runExclusive("ingestion", () -> "second"))
          .isInstanceOf(RunInProgressException.class)
          .hasMessageContaining("ingestion")
          .hasMessageContaining("scheduled cycle");
    } finally {
      release.countDown();
    }
    assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("done");
  }
}
