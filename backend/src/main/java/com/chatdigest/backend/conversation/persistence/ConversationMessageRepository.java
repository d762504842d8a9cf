package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.conversation.domain.Conversation;
import com.chatdigest.backend.conversation.domain.ConversationMessage;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, UUID> {

  Optional<ConversationMessage> findByConversationAndTs(Conversation conversation, String ts);

  List<ConversationMessage> findByConversationAndPostedAtBetweenOrderByPostedAtAscTsAsc(
      Conversation conversation, Instant start, Instant end);

  @Modifying
  @Query("delete from ConversationMessage m where m.postedAt < :cutoff")
  int deleteByPostedAtBefore(@Param("cutoff") Instant cutoff);
}
