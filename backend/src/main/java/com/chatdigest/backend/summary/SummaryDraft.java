package com.chatdigest.backend.summary;

import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.conversation.domain.SummaryOrigin;

/** Generated summary before it is persisted. */
public record SummaryDraft(String recap, DigestContent content, SummaryOrigin origin) {

  public SummaryDraft {
    if (recap == null) {
      throw new IllegalArgumentException("recap must not be null");
    }
    content = content == null ? DigestContent.empty() : content;
  }
}
