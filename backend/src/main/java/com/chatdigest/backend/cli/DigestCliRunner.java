package com.chatdigest.backend.cli;

import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.ingest.IngestionReport;
import com.chatdigest.backend.pipeline.CycleReport;
import com.chatdigest.backend.pipeline.DigestPipelineService;
import com.chatdigest.backend.pipeline.SummaryWindow;
import com.chatdigest.backend.summary.SummaryOutcome;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * One-shot command mode. The command comes from the first non-option argument or from {@code
 * app.digest.cli.command}:
 *
 * <ul>
 *   <li>{@code ingest [--since=<instant|date>]}
 *   <li>{@code summarize --conversation=<uuid> --start=<instant|date> --end=<instant|date>
 *       [--interval=<duration>]}
 *   <li>{@code purge --days=<n>}
 *   <li>{@code cycle}
 * </ul>
 *
 * Dates without a time are read as midnight in the schedule zone. The process exits with 1 when the
 * command fails.
 */
@Component
@ConditionalOnProperty(prefix = "app.digest.cli", name = "enabled", havingValue = "true")
@Slf4j
public class DigestCliRunner implements ApplicationRunner, ExitCodeGenerator {

  private final DigestPipelineService pipelineService;
  private final DigestProperties properties;
  private volatile int exitCode;

  public DigestCliRunner(DigestPipelineService pipelineService, DigestProperties properties) {
    this.pipelineService = pipelineService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    String command = resolveCommand(args);
    try {
      switch (command) {
        case "ingest" -> ingest(args);
        case "summarize" -> summarize(args);
        case "purge" -> purge(args);
        case "cycle" -> cycle();
        default -> throw new IllegalArgumentException("Unknown command '" + command + "'");
      }
      exitCode = 0;
    } catch (RuntimeException exception) {
      log.error("Command '{}' failed: {}", command, exception.getMessage(), exception);
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private String resolveCommand(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    String command =
        !positional.isEmpty() ? positional.get(0) : properties.getCli().getCommand();
    return StringUtils.hasText(command) ? command.trim().toLowerCase(Locale.ROOT) : "";
  }

  private void ingest(ApplicationArguments args) {
    String since = option(args, "since");
    IngestionReport report = pipelineService.runIngestion(since != null ? parseInstant(since) : null);
    log.info(
        "Ingestion finished: {} conversations, {} skipped, {} created, {} updated",
        report.conversationsIngested(),
        report.conversationsSkipped(),
        report.messagesCreated(),
        report.messagesUpdated());
  }

  private void summarize(ApplicationArguments args) {
    UUID conversationId = UUID.fromString(requiredOption(args, "conversation"));
    Instant start = parseInstant(requiredOption(args, "start"));
    Instant end = parseInstant(requiredOption(args, "end"));
    String interval = option(args, "interval");
    List<SummaryWindow> windows =
        interval != null
            ? SummaryWindow.split(start, end, Duration.parse(interval))
            : List.of(new SummaryWindow(start, end));
    for (SummaryWindow window : windows) {
      SummaryOutcome outcome =
          pipelineService.runSummarization(conversationId, window.start(), window.end());
      if (outcome.isEmpty()) {
        log.info("No messages between {} and {}", window.start(), window.end());
      } else {
        log.info(
            "Stored {} summary {} for {} .. {}",
            outcome.summary().getOrigin(),
            outcome.summary().getId(),
            window.start(),
            window.end());
      }
    }
  }

  private void purge(ApplicationArguments args) {
    int days = Integer.parseInt(requiredOption(args, "days"));
    int deleted = pipelineService.purgeOlderThan(days);
    log.info("Purged {} messages older than {} days", deleted, days);
  }

  private void cycle() {
    CycleReport report = pipelineService.runScheduledCycle();
    if (report.failed() > 0) {
      throw new IllegalStateException(report.failed() + " conversation digests failed");
    }
  }

  Instant parseInstant(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException notInstant) {
      ZoneId zone = properties.getSchedule().zoneId();
      return LocalDate.parse(value).atStartOfDay(zone).toInstant();
    }
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty() || !StringUtils.hasText(values.get(0))) {
      return null;
    }
    return values.get(0).trim();
  }

  private static String requiredOption(ApplicationArguments args, String name) {
    String value = option(args, name);
    if (value == null) {
      throw new IllegalArgumentException("Missing required option --" + name);
    }
    return value;
  }
}
