package com.chatdigest.backend.digest.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
public class DigestConfiguration {

  private static final AtomicInteger LOOKUP_SEQUENCE = new AtomicInteger();

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService directoryLookupExecutor(DigestProperties properties) {
    int threads = Math.max(1, properties.getDirectory().getLookupThreads());
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("directory-lookup-" + LOOKUP_SEQUENCE.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(threads, factory);
  }
}
