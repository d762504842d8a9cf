package com.chatdigest.backend.slack.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.slack")
public class SlackProperties {

  /** Bot token used for every Web API call. */
  @NotBlank private String botToken;

  /**
   * Number of retries after a rate-limited response. A call is attempted at most
   * {@code maxRetries + 1} times.
   */
  @Min(0)
  private int maxRetries = 3;

  /** Initial backoff after a rate-limited response. Doubled on each further retry. */
  @NotNull private Duration baseBackoff = Duration.ofSeconds(1);

  @Min(1)
  private int historyPageSize = 100;

  @Min(1)
  private int listPageSize = 200;

  /** Conversation types requested from conversations.list. */
  @NotEmpty
  private List<String> conversationTypes =
      new ArrayList<>(List.of("public_channel", "private_channel", "mpim", "im"));

  public String getBotToken() {
    return botToken;
  }

  public void setBotToken(String botToken) {
    this.botToken = botToken;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getBaseBackoff() {
    return baseBackoff;
  }

  public void setBaseBackoff(Duration baseBackoff) {
    this.baseBackoff = baseBackoff;
  }

  public int getHistoryPageSize() {
    return historyPageSize;
  }

  public void setHistoryPageSize(int historyPageSize) {
    this.historyPageSize = historyPageSize;
  }

  public int getListPageSize() {
    return listPageSize;
  }

  public void setListPageSize(int listPageSize) {
    this.listPageSize = listPageSize;
  }

  public List<String> getConversationTypes() {
    return conversationTypes;
  }

  public void setConversationTypes(List<String> conversationTypes) {
    this.conversationTypes = conversationTypes;
  }
}
