package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.conversation.domain.DirectoryUser;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DirectoryUserRepository extends JpaRepository<DirectoryUser, UUID> {

  Optional<DirectoryUser> findByExternalId(String externalId);

  List<DirectoryUser> findByExternalIdIn(Collection<String> externalIds);
}
