package com.chatdigest.backend.conversation.domain;

import com.chatdigest.backend.conversation.persistence.DigestContentJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One generated summary of a conversation window. Rows are append-only; the poster only stamps
 * {@code postedAt} and {@code postedRef}. Summaries outlive the purge of their source messages.
 */
@Entity
@Table(name = "digest_summary")
public class DigestSummary {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "conversation_id")
  private Conversation conversation;

  @Column(name = "window_start", nullable = false, updatable = false)
  private Instant windowStart;

  @Column(name = "window_end", nullable = false, updatable = false)
  private Instant windowEnd;

  @Column(name = "recap", nullable = false, columnDefinition = "text")
  private String recap;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "content", columnDefinition = "jsonb")
  @Convert(converter = DigestContentJsonConverter.class)
  private DigestContent content = DigestContent.empty();

  @Enumerated(EnumType.STRING)
  @Column(name = "origin", nullable = false, length = 16)
  private SummaryOrigin origin;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "posted_at")
  private Instant postedAt;

  @Column(name = "posted_ref", length = 128)
  private String postedRef;

  protected DigestSummary() {}

  public DigestSummary(
      Conversation conversation,
      Instant windowStart,
      Instant windowEnd,
      String recap,
      DigestContent content,
      SummaryOrigin origin) {
    if (windowStart.isAfter(windowEnd)) {
      throw new IllegalArgumentException("windowStart must not be after windowEnd");
    }
    this.conversation = conversation;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;
    this.recap = recap;
    this.content = content == null ? DigestContent.empty() : content;
    this.origin = origin;
  }

  @PrePersist
  void onPersist() {
    createdAt = Instant.now();
  }

  public boolean isPosted() {
    return postedAt != null;
  }

  public void markPosted(String ref, Instant at) {
    this.postedRef = ref;
    this.postedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public Instant getWindowStart() {
    return windowStart;
  }

  public Instant getWindowEnd() {
    return windowEnd;
  }

  public String getRecap() {
    return recap;
  }

  public DigestContent getContent() {
    return content;
  }

  public SummaryOrigin getOrigin() {
    return origin;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getPostedAt() {
    return postedAt;
  }

  public String getPostedRef() {
    return postedRef;
  }
}
