package com.chatdigest.backend.summary;

import java.util.UUID;

public class ConversationNotFoundException extends RuntimeException {

  public ConversationNotFoundException(UUID conversationId) {
    super("Conversation " + conversationId + " does not exist");
  }
}
