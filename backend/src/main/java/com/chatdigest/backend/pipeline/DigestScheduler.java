package com.chatdigest.backend.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "app.digest.schedule",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DigestScheduler {

  private static final Logger log = LoggerFactory.getLogger(DigestScheduler.class);

  private final DigestPipelineService pipelineService;

  public DigestScheduler(DigestPipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @Scheduled(
      cron = "${app.digest.schedule.cron:0 0 23 * * *}",
      zone = "${app.digest.schedule.zone:UTC}")
  public void runCycle() {
    try {
      pipelineService.runScheduledCycle();
    } catch (RunInProgressException exception) {
      log.info("Skipping scheduled digest cycle: {}", exception.getMessage());
    } catch (RuntimeException exception) {
      log.error("Scheduled digest cycle failed", exception);
    }
  }
}
