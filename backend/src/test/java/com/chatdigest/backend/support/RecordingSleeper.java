package com.chatdigest.backend.support;

import com.chatdigest.backend.shared.time.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class RecordingSleeper implements Sleeper {

  private final List<Duration> sleeps = new ArrayList<>();

  @Override
  public void sleep(Duration duration) {
    sleeps.add(duration);
  }

  public List<Duration> sleeps() {
    return sleeps;
  }
}
