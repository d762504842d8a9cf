package com.chatdigest.backend.conversation.domain;

import org.springframework.util.StringUtils;

/**
 * Resolved identity of a chat user. A placeholder stands in for users the platform could not
 * resolve; it is cached like any other record but never written to the store.
 */
public record UserRecord(
    String id,
    String displayName,
    String realName,
    String email,
    String avatarUrl,
    boolean bot,
    boolean placeholder) {

  public static UserRecord placeholder(String id) {
    return new UserRecord(id, id, null, null, null, false, true);
  }

  public static UserRecord fromEntity(DirectoryUser user) {
    return new UserRecord(
        user.getExternalId(),
        user.getDisplayName(),
        user.getRealName(),
        user.getEmail(),
        user.getAvatarUrl(),
        user.isBot(),
        false);
  }

  /** Best label for rendering: display name, then real name, then the raw id. */
  public String label() {
    if (StringUtils.hasText(displayName)) {
      return displayName;
    }
    return StringUtils.hasText(realName) ? realName : id;
  }
}
