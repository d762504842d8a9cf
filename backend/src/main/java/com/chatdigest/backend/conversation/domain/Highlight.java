package com.chatdigest.backend.conversation.domain;

/** A message singled out in a digest, referenced by its timestamp. */
public record Highlight(String ts, String authorId, String text, String permalink, String reason) {}
