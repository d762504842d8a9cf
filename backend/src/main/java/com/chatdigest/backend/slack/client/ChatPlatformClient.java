package com.chatdigest.backend.slack.client;

import com.slack.api.model.block.LayoutBlock;
import java.util.List;
import java.util.Optional;

/**
 * Sole point of contact with the chat platform. Every implementation routes its calls through a
 * {@link RateLimitedCaller}, so callers see either a result or a typed {@link ChatApiException}.
 */
public interface ChatPlatformClient {

  CursorPage<PlatformConversation> listConversations(String cursor);

  /** Empty when the conversation no longer exists or the bot lost access to it. */
  Optional<PlatformConversation> conversationInfo(String conversationId);

  /** History newer than {@code oldestTs} (exclusive); {@code oldestTs} may be {@code null}. */
  CursorPage<PlatformMessage> history(String conversationId, String oldestTs, String cursor);

  CursorPage<PlatformMessage> replies(String conversationId, String threadTs, String cursor);

  PlatformUser userInfo(String userId);

  CursorPage<PlatformUser> listUsers(String cursor);

  /** Posts a message and returns its timestamp. */
  String postMessage(String channel, String fallbackText, List<LayoutBlock> blocks);

  String permalink(String conversationId, String ts);
}
