package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.conversation.domain.Conversation;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  Optional<Conversation> findByExternalId(String externalId);
}
