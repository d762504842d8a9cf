package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.DigestSummary;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DigestSummaryRepository extends JpaRepository<DigestSummary, UUID> {

  @EntityGraph(attributePaths = "conversation")
  Optional<DigestSummary> findFirstByConversationAndWindowStartAndWindowEndOrderByCreatedAtDesc(
      Conversation conversation, Instant windowStart, Instant windowEnd);
}
