package com.chatdigest.backend.conversation.domain;

import java.time.LocalDate;

/**
 * Candidate follow-up extracted from a message. {@code ownerId} and {@code dueDate} are optional;
 * {@code confidence} is in the range [0, 1].
 */
public record ActionItem(
    String title,
    String ownerId,
    LocalDate dueDate,
    double confidence,
    String sourceTs,
    String permalink) {

  public ActionItem {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("title must not be blank");
    }
    confidence = Math.max(0.0d, Math.min(1.0d, confidence));
  }
}
