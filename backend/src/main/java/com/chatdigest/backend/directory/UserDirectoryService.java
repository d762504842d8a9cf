package com.chatdigest.backend.directory;

import com.chatdigest.backend.conversation.domain.DirectoryUser;
import com.chatdigest.backend.conversation.domain.UserRecord;
import com.chatdigest.backend.conversation.store.ConversationStore;
import com.chatdigest.backend.digest.config.DigestProperties;
import com.chatdigest.backend.slack.client.ChatApiException;
import com.chatdigest.backend.slack.client.ChatPlatformClient;
import com.chatdigest.backend.slack.client.CursorPage;
import com.chatdigest.backend.slack.client.PlatformUser;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves chat user ids to identity records. Lookups go through an in-memory TTL cache, then the
 * persisted directory, then the platform. Platform results are written through to the store;
 * unresolvable users are represented by placeholders that are cached but never persisted.
 */
@Service
@Slf4j
public class UserDirectoryService {

  private final ChatPlatformClient platformClient;
  private final ConversationStore store;
  private final ExpiringCache<String, UserRecord> cache;
  private final ExecutorService lookupExecutor;
  private final Clock clock;
  private final Duration ttl;

  @Autowired
  public UserDirectoryService(
      ChatPlatformClient platformClient,
      ConversationStore store,
      DigestProperties properties,
      Clock clock,
      @Qualifier("directoryLookupExecutor") ExecutorService lookupExecutor) {
    this(
        platformClient,
        store,
        new CaffeineExpiringCache<>(properties.getDirectory().getMaximumSize(), clock),
        properties.getDirectory().getTtl(),
        clock,
        lookupExecutor);
  }

  UserDirectoryService(
      ChatPlatformClient platformClient,
      ConversationStore store,
      ExpiringCache<String, UserRecord> cache,
      Duration ttl,
      Clock clock,
      ExecutorService lookupExecutor) {
    this.platformClient = Objects.requireNonNull(platformClient, "platformClient must not be null");
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.cache = Objects.requireNonNull(cache, "cache must not be null");
    this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.lookupExecutor = Objects.requireNonNull(lookupExecutor, "lookupExecutor must not be null");
  }

  public UserRecord resolveUser(String userId) {
    if (!StringUtils.hasText(userId)) {
      throw new IllegalArgumentException("userId must not be blank");
    }
    return cache.getOrRefresh(userId, ttl, this::load);
  }

  /** Resolves every distinct id concurrently and returns the records keyed by id, in input order. */
  public Map<String, UserRecord> resolveAll(Collection<String> userIds) {
    Set<String> distinct = new LinkedHashSet<>();
    for (String userId : userIds) {
      if (StringUtils.hasText(userId)) {
        distinct.add(userId);
      }
    }
    Map<String, CompletableFuture<UserRecord>> pending = new LinkedHashMap<>();
    for (String userId : distinct) {
      pending.put(userId, CompletableFuture.supplyAsync(() -> resolveUser(userId), lookupExecutor));
    }
    try {
      CompletableFuture.allOf(pending.values().toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException exception) {
      if (exception.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw exception;
    }
    Map<String, UserRecord> resolved = new LinkedHashMap<>();
    pending.forEach((userId, future) -> resolved.put(userId, future.join()));
    return resolved;
  }

  /** Ids among {@code userIds} that the persisted directory knows to be bots. */
  public Set<String> botIds(Collection<String> userIds) {
    if (userIds == null || userIds.isEmpty()) {
      return Set.of();
    }
    return store.findUsers(userIds).stream()
        .filter(DirectoryUser::isBot)
        .map(DirectoryUser::getExternalId)
        .collect(Collectors.toSet());
  }

  /** Pages through the full workspace directory and warms both the store and the cache. */
  public int preloadDirectory() {
    int loaded = 0;
    String cursor = null;
    do {
      CursorPage<PlatformUser> page = platformClient.listUsers(cursor);
      for (PlatformUser user : page.items()) {
        if (user.deleted() || !StringUtils.hasText(user.id())) {
          continue;
        }
        UserRecord record = toRecord(user);
        store.upsertUser(record);
        cache.put(record.id(), record);
        loaded++;
      }
      cursor = page.nextCursor();
    } while (StringUtils.hasText(cursor));
    log.info("Preloaded {} directory users", loaded);
    return loaded;
  }

  private UserRecord load(String userId) {
    List<DirectoryUser> stored = store.findUsers(List.of(userId));
    if (!stored.isEmpty()) {
      DirectoryUser user = stored.get(0);
      if (user.getRefreshedAt() != null && user.getRefreshedAt().plus(ttl).isAfter(clock.instant())) {
        return UserRecord.fromEntity(user);
      }
    }
    try {
      UserRecord record = toRecord(platformClient.userInfo(userId));
      store.upsertUser(record);
      return record;
    } catch (ChatApiException exception) {
      log.warn(
          "Falling back to placeholder for user {}: {} ({})",
          userId,
          exception.getMessage(),
          exception.getCode());
      return UserRecord.placeholder(userId);
    }
  }

  private static UserRecord toRecord(PlatformUser user) {
    String displayName = StringUtils.hasText(user.displayName()) ? user.displayName() : user.name();
    return new UserRecord(
        user.id(), displayName, user.realName(), user.email(), user.avatarUrl(), user.bot(), false);
  }
}
