package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.conversation.domain.DigestContent;
import com.chatdigest.backend.shared.json.AbstractJsonbAttributeConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter(autoApply = false)
public class DigestContentJsonConverter extends AbstractJsonbAttributeConverter<DigestContent> {

  public DigestContentJsonConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected DigestContent emptyValue() {
    return DigestContent.empty();
  }
}
