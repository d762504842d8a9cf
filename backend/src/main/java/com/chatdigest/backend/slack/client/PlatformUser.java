package com.chatdigest.backend.slack.client;

public record PlatformUser(
    String id,
    String name,
    String realName,
    String displayName,
    String email,
    String avatarUrl,
    boolean bot,
    boolean deleted) {}
