package com.chatdigest.backend.conversation.domain;

public enum ConversationKind {
  CHANNEL,
  GROUP,
  IM,
  MPIM
}
