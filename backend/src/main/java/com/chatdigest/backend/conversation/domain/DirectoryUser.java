package com.chatdigest.backend.conversation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "directory_user")
public class DirectoryUser {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "external_id", nullable = false, unique = true, length = 64)
  private String externalId;

  @Column(name = "display_name")
  private String displayName;

  @Column(name = "real_name")
  private String realName;

  @Column(name = "email", length = 320)
  private String email;

  @Column(name = "avatar_url", length = 1024)
  private String avatarUrl;

  @Column(name = "bot", nullable = false)
  private boolean bot;

  @Column(name = "refreshed_at", nullable = false)
  private Instant refreshedAt;

  protected DirectoryUser() {}

  public DirectoryUser(String externalId) {
    this.externalId = externalId;
  }

  public UUID getId() {
    return id;
  }

  public String getExternalId() {
    return externalId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public String getRealName() {
    return realName;
  }

  public void setRealName(String realName) {
    this.realName = realName;
  }

  public String getEmail() {
    return email;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public void setAvatarUrl(String avatarUrl) {
    this.avatarUrl = avatarUrl;
  }

  public boolean isBot() {
    return bot;
  }

  public void setBot(boolean bot) {
    this.bot = bot;
  }

  public Instant getRefreshedAt() {
    return refreshedAt;
  }

  public void setRefreshedAt(Instant refreshedAt) {
    this.refreshedAt = refreshedAt;
  }
}
