package com.chatdigest.backend.digest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.digest")
public class DigestProperties {

  @Valid private Posting posting = new Posting();

  @Valid private Retention retention = new Retention();

  @Valid private Model model = new Model();

  @Valid private Schedule schedule = new Schedule();

  @Valid private Summary summary = new Summary();

  @Valid private Ingestion ingestion = new Ingestion();

  @Valid private Directory directory = new Directory();

  private Cli cli = new Cli();

  public Posting getPosting() {
    return posting;
  }

  public void setPosting(Posting posting) {
    this.posting = posting;
  }

  public Retention getRetention() {
    return retention;
  }

  public void setRetention(Retention retention) {
    this.retention = retention;
  }

  public Model getModel() {
    return model;
  }

  public void setModel(Model model) {
    this.model = model;
  }

  public Schedule getSchedule() {
    return schedule;
  }

  public void setSchedule(Schedule schedule) {
    this.schedule = schedule;
  }

  public Summary getSummary() {
    return summary;
  }

  public void setSummary(Summary summary) {
    this.summary = summary;
  }

  public Ingestion getIngestion() {
    return ingestion;
  }

  public void setIngestion(Ingestion ingestion) {
    this.ingestion = ingestion;
  }

  public Directory getDirectory() {
    return directory;
  }

  public void setDirectory(Directory directory) {
    this.directory = directory;
  }

  public Cli getCli() {
    return cli;
  }

  public void setCli(Cli cli) {
    this.cli = cli;
  }

  public static class Posting {

    /** Destination channel for rendered digests. Empty disables posting. */
    private String channel;

    /** Longest recap rendered into a digest section; Slack rejects section text above 3000. */
    @Min(1)
    private int recapLimit = 3000;

    @Min(10)
    private int highlightTextLimit = 100;

    @Min(10)
    private int taskTitleLimit = 150;

    /** Number of users listed under mention statistics. */
    @Min(1)
    private int mentionRankLimit = 10;

    public boolean isConfigured() {
      return StringUtils.hasText(channel);
    }

    public String getChannel() {
      return channel;
    }

    public void setChannel(String channel) {
      this.channel = channel;
    }

    public int getRecapLimit() {
      return recapLimit;
    }

    public void setRecapLimit(int recapLimit) {
      this.recapLimit = recapLimit;
    }

    public int getHighlightTextLimit() {
      return highlightTextLimit;
    }

    public void setHighlightTextLimit(int highlightTextLimit) {
      this.highlightTextLimit = highlightTextLimit;
    }

    public int getTaskTitleLimit() {
      return taskTitleLimit;
    }

    public void setTaskTitleLimit(int taskTitleLimit) {
      this.taskTitleLimit = taskTitleLimit;
    }

    public int getMentionRankLimit() {
      return mentionRankLimit;
    }

    public void setMentionRankLimit(int mentionRankLimit) {
      this.mentionRankLimit = mentionRankLimit;
    }
  }

  public static class Retention {

    /** Age in days after which raw messages are purged. Empty disables the purge. */
    @Min(1)
    private Integer days;

    public boolean isEnabled() {
      return days != null;
    }

    public Integer getDays() {
      return days;
    }

    public void setDays(Integer days) {
      this.days = days;
    }
  }

  public static class Model {

    /** Credential of the generative service. Without it every summary takes the heuristic path. */
    private String apiKey;

    private String baseUrl = "https://api.openai.com";

    private String model = "gpt-4o-mini";

    private double temperature = 0.1d;

    @Min(1)
    private int maxAttempts = 2;

    @NotNull private Duration retryDelay = Duration.ofMillis(250);

    public boolean isConfigured() {
      return StringUtils.hasText(apiKey);
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }
  }

  public static class Schedule {

    private boolean enabled = true;

    /** Six-field Spring cron expression of the digest cycle. */
    @NotBlank private String cron = "0 0 23 * * *";

    /** Zone used for the cron trigger, window boundaries and due-date parsing. */
    @NotBlank private String zone = "UTC";

    public ZoneId zoneId() {
      return ZoneId.of(zone);
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }
  }

  public static class Summary {

    /** Length of the window summarized by each scheduled cycle. */
    @NotNull private Duration window = Duration.ofDays(1);

    @Min(1)
    private int highlightLimit = 5;

    @Min(1)
    private int mentionContextLimit = 3;

    @Min(5)
    private int mentionContextLength = 30;

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public int getHighlightLimit() {
      return highlightLimit;
    }

    public void setHighlightLimit(int highlightLimit) {
      this.highlightLimit = highlightLimit;
    }

    public int getMentionContextLimit() {
      return mentionContextLimit;
    }

    public void setMentionContextLimit(int mentionContextLimit) {
      this.mentionContextLimit = mentionContextLimit;
    }

    public int getMentionContextLength() {
      return mentionContextLength;
    }

    public void setMentionContextLength(int mentionContextLength) {
      this.mentionContextLength = mentionContextLength;
    }
  }

  public static class Ingestion {

    /** Pause between conversations to stay under per-workspace rate limits. */
    @NotNull private Duration interConversationDelay = Duration.ofSeconds(1);

    private boolean resolvePermalinks = true;

    /** Warms the user directory from users.list before the first conversation is ingested. */
    private boolean preloadDirectory = false;

    public Duration getInterConversationDelay() {
      return interConversationDelay;
    }

    public void setInterConversationDelay(Duration interConversationDelay) {
      this.interConversationDelay = interConversationDelay;
    }

    public boolean isResolvePermalinks() {
      return resolvePermalinks;
    }

    public void setResolvePermalinks(boolean resolvePermalinks) {
      this.resolvePermalinks = resolvePermalinks;
    }

    public boolean isPreloadDirectory() {
      return preloadDirectory;
    }

    public void setPreloadDirectory(boolean preloadDirectory) {
      this.preloadDirectory = preloadDirectory;
    }
  }

  public static class Directory {

    @NotNull private Duration ttl = Duration.ofHours(1);

    @Min(1)
    private long maximumSize = 10_000;

    @Min(1)
    private int lookupThreads = 4;

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public long getMaximumSize() {
      return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
    }

    public int getLookupThreads() {
      return lookupThreads;
    }

    public void setLookupThreads(int lookupThreads) {
      this.lookupThreads = lookupThreads;
    }
  }

  /**
   * One-shot command line mode. When enabled the application runs a single pipeline command and
   * exits with its status instead of waiting for the schedule.
   */
  public static class Cli {

    private boolean enabled = false;

    /** One of {@code ingest}, {@code summarize}, {@code purge} or {@code cycle}. */
    private String command;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getCommand() {
      return command;
    }

    public void setCommand(String command) {
      this.command = command;
    }
  }
}
