package com.chatdigest.backend.summary;

/** The model path could not produce a usable summary; callers fall back to the heuristic path. */
public class ModelSummarizationException extends RuntimeException {

  public ModelSummarizationException(String message) {
    super(message);
  }

  public ModelSummarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
