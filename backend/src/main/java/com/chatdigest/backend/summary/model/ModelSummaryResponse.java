package com.chatdigest.backend.summary.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** JSON object the model is asked to return. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelSummaryResponse(
    String summary,
    List<ModelHighlight> highlights,
    List<ModelTask> tasks,
    List<ModelMention> mentions) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ModelHighlight(String ts, String text, String reason) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ModelTask(String title, String owner, String dueDate, Double confidence, String ts) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ModelMention(String userId, Integer count, List<String> contexts) {}
}
