package com.chatdigest.backend.conversation.store;

public enum UpsertOutcome {
  CREATED,
  UPDATED,
  UNCHANGED
}
