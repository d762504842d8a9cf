package com.chatdigest.backend.slack.client;

import com.chatdigest.backend.conversation.domain.ConversationKind;
import com.chatdigest.backend.slack.config.SlackProperties;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.SlackApiTextResponse;
import com.slack.api.methods.request.chat.ChatGetPermalinkRequest;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.conversations.ConversationsHistoryRequest;
import com.slack.api.methods.request.conversations.ConversationsInfoRequest;
import com.slack.api.methods.request.conversations.ConversationsListRequest;
import com.slack.api.methods.request.conversations.ConversationsRepliesRequest;
import com.slack.api.methods.request.users.UsersInfoRequest;
import com.slack.api.methods.request.users.UsersListRequest;
import com.slack.api.methods.response.chat.ChatGetPermalinkResponse;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import com.slack.api.methods.response.conversations.ConversationsHistoryResponse;
import com.slack.api.methods.response.conversations.ConversationsInfoResponse;
import com.slack.api.methods.response.conversations.ConversationsListResponse;
import com.slack.api.methods.response.conversations.ConversationsRepliesResponse;
import com.slack.api.methods.response.users.UsersInfoResponse;
import com.slack.api.methods.response.users.UsersListResponse;
import com.slack.api.model.Conversation;
import com.slack.api.model.ConversationType;
import com.slack.api.model.Message;
import com.slack.api.model.Reaction;
import com.slack.api.model.ResponseMetadata;
import com.slack.api.model.User;
import com.slack.api.model.block.LayoutBlock;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/** Slack Web API implementation of {@link ChatPlatformClient} backed by {@link MethodsClient}. */
@Slf4j
public class SlackApiClient implements ChatPlatformClient {

  private static final Set<String> INACCESSIBLE_CODES =
      Set.of("channel_not_found", "not_in_channel", "missing_scope", "is_archived");
  private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

  private final MethodsClient methods;
  private final RateLimitedCaller caller;
  private final SlackProperties properties;

  public SlackApiClient(MethodsClient methods, RateLimitedCaller caller, SlackProperties properties) {
    this.methods = Objects.requireNonNull(methods, "methods must not be null");
    this.caller = Objects.requireNonNull(caller, "caller must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  @Override
  public CursorPage<PlatformConversation> listConversations(String cursor) {
    ConversationsListRequest request =
        ConversationsListRequest.builder()
            .types(conversationTypes())
            .excludeArchived(true)
            .limit(properties.getListPageSize())
            .cursor(cursor)
            .build();
    ConversationsListResponse response =
        invoke("conversations.list", () -> methods.conversationsList(request));
    List<PlatformConversation> conversations = new ArrayList<>();
    if (response.getChannels() != null) {
      response.getChannels().forEach(channel -> conversations.add(toConversation(channel)));
    }
    return new CursorPage<>(conversations, nextCursor(response.getResponseMetadata()));
  }

  @Override
  public Optional<PlatformConversation> conversationInfo(String conversationId) {
    ConversationsInfoRequest request =
        ConversationsInfoRequest.builder().channel(conversationId).build();
    try {
      ConversationsInfoResponse response =
          invoke("conversations.info", () -> methods.conversationsInfo(request));
      return Optional.ofNullable(response.getChannel()).map(SlackApiClient::toConversation);
    } catch (ChatApiException exception) {
      if (INACCESSIBLE_CODES.contains(exception.getCode())) {
        log.info("Conversation {} is not accessible: {}", conversationId, exception.getCode());
        return Optional.empty();
      }
      throw exception;
    }
  }

  @Override
  public CursorPage<PlatformMessage> history(String conversationId, String oldestTs, String cursor) {
    ConversationsHistoryRequest request =
        ConversationsHistoryRequest.builder()
            .channel(conversationId)
            .oldest(oldestTs)
            .inclusive(false)
            .limit(properties.getHistoryPageSize())
            .cursor(cursor)
            .build();
    ConversationsHistoryResponse response =
        invoke("conversations.history", () -> methods.conversationsHistory(request));
    return new CursorPage<>(
        toMessages(response.getMessages()), nextCursor(response.getResponseMetadata()));
  }

  @Override
  public CursorPage<PlatformMessage> replies(String conversationId, String threadTs, String cursor) {
    ConversationsRepliesRequest request =
        ConversationsRepliesRequest.builder()
            .channel(conversationId)
            .ts(threadTs)
            .limit(properties.getHistoryPageSize())
            .cursor(cursor)
            .build();
    ConversationsRepliesResponse response =
        invoke("conversations.replies", () -> methods.conversationsReplies(request));
    return new CursorPage<>(
        toMessages(response.getMessages()), nextCursor(response.getResponseMetadata()));
  }

  @Override
  public PlatformUser userInfo(String userId) {
    UsersInfoRequest request = UsersInfoRequest.builder().user(userId).build();
    UsersInfoResponse response = invoke("users.info", () -> methods.usersInfo(request));
    if (response.getUser() == null) {
      throw new ChatApiException("users.info", "user_not_found", "No user returned for " + userId);
    }
    return toUser(response.getUser());
  }

  @Override
  public CursorPage<PlatformUser> listUsers(String cursor) {
    UsersListRequest request =
        UsersListRequest.builder().limit(properties.getListPageSize()).cursor(cursor).build();
    UsersListResponse response = invoke("users.list", () -> methods.usersList(request));
    List<PlatformUser> users = new ArrayList<>();
    if (response.getMembers() != null) {
      response.getMembers().forEach(member -> users.add(toUser(member)));
    }
    return new CursorPage<>(users, nextCursor(response.getResponseMetadata()));
  }

  @Override
  public String postMessage(String channel, String fallbackText, List<LayoutBlock> blocks) {
    ChatPostMessageRequest request =
        ChatPostMessageRequest.builder()
            .channel(channel)
            .text(fallbackText)
            .blocks(blocks)
            .unfurlLinks(false)
            .build();
    ChatPostMessageResponse response =
        invoke("chat.postMessage", () -> methods.chatPostMessage(request));
    return response.getTs();
  }

  @Override
  public String permalink(String conversationId, String ts) {
    ChatGetPermalinkRequest request =
        ChatGetPermalinkRequest.builder().channel(conversationId).messageTs(ts).build();
    ChatGetPermalinkResponse response =
        invoke("chat.getPermalink", () -> methods.chatGetPermalink(request));
    return response.getPermalink();
  }

  @FunctionalInterface
  interface SlackCall<T> {
    T execute() throws IOException, SlackApiException;
  }

  <T extends SlackApiTextResponse> T invoke(String operation, SlackCall<T> call) {
    return caller.call(operation, () -> unwrap(operation, execute(operation, call)));
  }

  private static <T> T execute(String operation, SlackCall<T> call) {
    try {
      return call.execute();
    } catch (SlackApiException exception) {
      throw translate(operation, exception);
    } catch (IOException exception) {
      throw new ChatApiException(
          operation, "io_error", "Slack " + operation + " I/O failure: " + exception.getMessage(), exception);
    }
  }

  private static <T extends SlackApiTextResponse> T unwrap(String operation, T response) {
    if (response == null) {
      throw new ChatApiException(operation, "empty_response", "Slack " + operation + " returned no body");
    }
    if (response.isOk()) {
      if (StringUtils.hasText(response.getWarning())) {
        log.debug("Slack {} warning: {}", operation, response.getWarning());
      }
      return response;
    }
    String error = response.getError();
    if (RateLimitedException.CODE.equals(error)) {
      throw new RateLimitedException(operation, null);
    }
    throw new ChatApiException(operation, error, "Slack " + operation + " failed: " + error);
  }

  private static ChatApiException translate(String operation, SlackApiException exception) {
    int status = exception.getResponse() != null ? exception.getResponse().code() : -1;
    if (status == 429) {
      return new RateLimitedException(
          operation, parseRetryAfter(exception.getResponse().header("Retry-After")));
    }
    String code =
        exception.getError() != null && StringUtils.hasText(exception.getError().getError())
            ? exception.getError().getError()
            : "http_" + status;
    if (RateLimitedException.CODE.equals(code)) {
      return new RateLimitedException(operation, null);
    }
    return new ChatApiException(
        operation, code, "Slack " + operation + " failed with HTTP " + status + ": " + code, exception);
  }

  static Duration parseRetryAfter(String header) {
    if (!StringUtils.hasText(header)) {
      return DEFAULT_RETRY_AFTER;
    }
    try {
      long seconds = Long.parseLong(header.trim());
      return seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
    } catch (NumberFormatException exception) {
      log.debug("Ignoring malformed Retry-After header '{}'", header);
      return DEFAULT_RETRY_AFTER;
    }
  }

  private List<ConversationType> conversationTypes() {
    List<ConversationType> types = new ArrayList<>();
    for (String type : properties.getConversationTypes()) {
      types.add(ConversationType.valueOf(type.trim().toUpperCase(Locale.ROOT)));
    }
    return types;
  }

  private static String nextCursor(ResponseMetadata metadata) {
    return metadata != null && StringUtils.hasText(metadata.getNextCursor())
        ? metadata.getNextCursor()
        : null;
  }

  static PlatformConversation toConversation(Conversation channel) {
    ConversationKind kind;
    if (channel.isIm()) {
      kind = ConversationKind.IM;
    } else if (channel.isMpim()) {
      kind = ConversationKind.MPIM;
    } else if (channel.isPrivate() || channel.isGroup()) {
      kind = ConversationKind.GROUP;
    } else {
      kind = ConversationKind.CHANNEL;
    }
    String name = StringUtils.hasText(channel.getName()) ? channel.getName() : channel.getUser();
    return new PlatformConversation(channel.getId(), name, kind, channel.isArchived());
  }

  static List<PlatformMessage> toMessages(List<Message> messages) {
    if (messages == null || messages.isEmpty()) {
      return List.of();
    }
    List<PlatformMessage> result = new ArrayList<>(messages.size());
    for (Message message : messages) {
      Map<String, List<String>> reactions = new LinkedHashMap<>();
      if (message.getReactions() != null) {
        for (Reaction reaction : message.getReactions()) {
          reactions.put(
              reaction.getName(), reaction.getUsers() == null ? List.of() : reaction.getUsers());
        }
      }
      result.add(
          new PlatformMessage(
              message.getTs(),
              message.getUser(),
              message.getText(),
              message.getThreadTs(),
              message.getReplyCount() == null ? 0 : message.getReplyCount(),
              reactions,
              message.getSubtype()));
    }
    return result;
  }

  static PlatformUser toUser(User user) {
    User.Profile profile = user.getProfile();
    return new PlatformUser(
        user.getId(),
        user.getName(),
        user.getRealName(),
        profile != null ? profile.getDisplayName() : null,
        profile != null ? profile.getEmail() : null,
        profile != null ? profile.getImage72() : null,
        user.isBot(),
        user.isDeleted());
  }
}
