package com.chatdigest.backend.slack.client;

import com.chatdigest.backend.conversation.domain.ConversationKind;

public record PlatformConversation(String id, String name, ConversationKind kind, boolean archived) {}
