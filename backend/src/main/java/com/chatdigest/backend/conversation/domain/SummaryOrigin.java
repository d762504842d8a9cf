package com.chatdigest.backend.conversation.domain;

/** Which strategy produced a stored summary. */
public enum SummaryOrigin {
  MODEL,
  HEURISTIC
}
