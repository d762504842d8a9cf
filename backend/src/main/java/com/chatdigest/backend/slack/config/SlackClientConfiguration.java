package com.chatdigest.backend.slack.config;

import com.chatdigest.backend.shared.time.Sleeper;
import com.chatdigest.backend.slack.client.ChatPlatformClient;
import com.chatdigest.backend.slack.client.RateLimitedCaller;
import com.chatdigest.backend.slack.client.SlackApiClient;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SlackClientConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return Sleeper.threadSleeper();
  }

  @Bean
  public Slack slack() {
    return Slack.getInstance();
  }

  @Bean
  public MethodsClient slackMethodsClient(Slack slack, SlackProperties properties) {
    return slack.methods(properties.getBotToken());
  }

  @Bean
  public RateLimitedCaller slackRateLimitedCaller(SlackProperties properties, Sleeper sleeper) {
    return new RateLimitedCaller(properties.getMaxRetries(), properties.getBaseBackoff(), sleeper);
  }

  @Bean
  public ChatPlatformClient chatPlatformClient(
      MethodsClient slackMethodsClient,
      RateLimitedCaller slackRateLimitedCaller,
      SlackProperties properties) {
    return new SlackApiClient(slackMethodsClient, slackRateLimitedCaller, properties);
  }
}
