package com.chatdigest.backend.pipeline;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/** Process-wide mutex that keeps pipeline runs from overlapping. Never waits for the holder. */
@Component
public class RunLock {

  private final ReentrantLock lock = new ReentrantLock();
  private volatile String activeRun;

  public <T> T runExclusive(String runName, Supplier<T> work) {
    if (!lock.tryLock()) {
      throw new RunInProgressException(runName, activeRun);
    }
    try {
      activeRun = runName;
      return work.get();
    } finally {
      activeRun = null;
      lock.unlock();
    }
  }

  public boolean isLocked() {
    return lock.isLocked();
  }
}
