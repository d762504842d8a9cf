package com.chatdigest.backend.conversation.domain;

import com.chatdigest.backend.conversation.persistence.ReactionsJsonConverter;
import com.chatdigest.backend.conversation.persistence.StringListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(
    name = "conversation_message",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_conversation_message_conversation_ts",
            columnNames = {"conversation_id", "ts"}))
public class ConversationMessage {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "conversation_id")
  private Conversation conversation;

  @Column(name = "ts", nullable = false, length = 32)
  private String ts;

  @Column(name = "author_id", length = 64)
  private String authorId;

  @Column(name = "text", columnDefinition = "text")
  private String text;

  @Column(name = "thread_ts", length = 32)
  private String threadTs;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "reactions", columnDefinition = "jsonb")
  @Convert(converter = ReactionsJsonConverter.class)
  private Map<String, List<String>> reactions = new LinkedHashMap<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "mentions", columnDefinition = "jsonb")
  @Convert(converter = StringListJsonConverter.class)
  private List<String> mentions = List.of();

  @Column(name = "permalink", length = 1024)
  private String permalink;

  @Column(name = "posted_at", nullable = false)
  private Instant postedAt;

  @Column(name = "received_at", nullable = false, updatable = false)
  private Instant receivedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ConversationMessage() {}

  public ConversationMessage(Conversation conversation, String ts, Instant postedAt) {
    this.conversation = conversation;
    this.ts = ts;
    this.postedAt = postedAt;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    receivedAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public boolean isThreadRoot() {
    return threadTs != null && threadTs.equals(ts);
  }

  public UUID getId() {
    return id;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public String getTs() {
    return ts;
  }

  public String getAuthorId() {
    return authorId;
  }

  public void setAuthorId(String authorId) {
    this.authorId = authorId;
  }

  public String getText() {
    return text;
  }

  public void setText(String text) {
    this.text = text;
  }

  public String getThreadTs() {
    return threadTs;
  }

  public void setThreadTs(String threadTs) {
    this.threadTs = threadTs;
  }

  public Map<String, List<String>> getReactions() {
    return reactions;
  }

  public void setReactions(Map<String, List<String>> reactions) {
    this.reactions = reactions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(reactions);
  }

  public List<String> getMentions() {
    return mentions;
  }

  public void setMentions(List<String> mentions) {
    this.mentions = mentions == null ? List.of() : List.copyOf(mentions);
  }

  public String getPermalink() {
    return permalink;
  }

  public void setPermalink(String permalink) {
    this.permalink = permalink;
  }

  public Instant getPostedAt() {
    return postedAt;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
