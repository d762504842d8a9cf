package com.chatdigest.backend.conversation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "conversation")
public class Conversation {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "external_id", nullable = false, unique = true, length = 64)
  private String externalId;

  @Column(name = "name")
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 16)
  private ConversationKind kind;

  /** Timestamp of the newest top-level message durably ingested, or {@code null}. */
  @Column(name = "watermark_ts", length = 32)
  private String watermarkTs;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Conversation() {}

  public Conversation(String externalId, String name, ConversationKind kind) {
    this.externalId = externalId;
    this.name = name;
    this.kind = kind;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getExternalId() {
    return externalId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public ConversationKind getKind() {
    return kind;
  }

  public void setKind(ConversationKind kind) {
    this.kind = kind;
  }

  public String getWatermarkTs() {
    return watermarkTs;
  }

  public void setWatermarkTs(String watermarkTs) {
    this.watermarkTs = watermarkTs;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
