package com.chatdigest.backend.summary.config;

import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.shared.time.Sleeper;
import com.chatdigest.backend.summary.ModelSummarizer;
import com.chatdigest.backend.summary.SpringAiModelSummarizer;
import com.chatdigest.backend.summary.model.ModelSummaryResponse;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the model summary path. Absent an API key, no {@link ModelSummarizer} bean exists. */
@Configuration
@ConditionalOnExpression("!'${app.digest.model.api-key:}'.isBlank()")
public class ModelSummarizerConfiguration {

  @Bean
  public OpenAiApi digestOpenAiApi(DigestProperties properties) {
    DigestProperties.Model model = properties.getModel();
    return OpenAiApi.builder().baseUrl(model.getBaseUrl()).apiKey(model.getApiKey()).build();
  }

  @Bean
  public OpenAiChatModel digestChatModel(OpenAiApi digestOpenAiApi, DigestProperties properties) {
    DigestProperties.Model model = properties.getModel();
    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(model.getModel())
            .temperature(model.getTemperature())
            .responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build())
            .build();
    return OpenAiChatModel.builder().openAiApi(digestOpenAiApi).defaultOptions(options).build();
  }

  @Bean
  public ChatClient digestChatClient(OpenAiChatModel digestChatModel) {
    return ChatClient.builder(digestChatModel).build();
  }

  @Bean
  public BeanOutputConverter<ModelSummaryResponse> modelSummaryOutputConverter() {
    return new BeanOutputConverter<>(ModelSummaryResponse.class);
  }

  @Bean
  public ModelSummarizer modelSummarizer(
      ChatClient digestChatClient,
      BeanOutputConverter<ModelSummaryResponse> modelSummaryOutputConverter,
      DigestProperties properties,
      Sleeper sleeper) {
    return new SpringAiModelSummarizer(
        digestChatClient, modelSummaryOutputConverter, properties, sleeper);
  }
}
