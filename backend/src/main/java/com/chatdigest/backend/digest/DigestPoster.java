package com.chatdigest.backend.digest;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import com.chatdigest.backend.conversation.store.ConversationStore;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.slack.client.ChatPlatformClient;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Publishes summaries to the digest channel. The summary row is only stamped after the platform
 * accepted the message; a failed post leaves the row unposted so a later run can try again.
 */
@Service
@Slf4j
public class DigestPoster {

  private final ChatPlatformClient platformClient;
  private final ConversationStore store;
  private final DigestBlockRenderer renderer;
  private final DigestProperties.Posting posting;

  public DigestPoster(
      ChatPlatformClient platformClient,
      ConversationStore store,
      DigestBlockRenderer renderer,
      DigestProperties properties) {
    this.platformClient = Objects.requireNonNull(platformClient, "platformClient must not be null");
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    this.posting = properties.getPosting();
  }

  public boolean isConfigured() {
    return posting.isConfigured();
  }

  public DigestMessageRef post(DigestSummary summary) {
    if (!isConfigured()) {
      throw new DigestNotConfiguredException();
    }
    Conversation conversation = summary.getConversation();
    RenderedDigest rendered = renderer.render(conversation, summary);
    String ts = platformClient.postMessage(posting.getChannel(), rendered.fallbackText(), rendered.blocks());
    DigestMessageRef ref = new DigestMessageRef(posting.getChannel(), ts);
    try {
      store.markPosted(summary, ref.asReference());
    } catch (DataAccessException exception) {
      log.warn(
          "Digest for #{} was posted as {} but could not be marked as posted",
          conversation.getName(),
          ref.asReference(),
          exception);
    }
    log.info("Posted digest for #{} to {} ({})", conversation.getName(), ref.channel(), ts);
    return ref;
  }
}
