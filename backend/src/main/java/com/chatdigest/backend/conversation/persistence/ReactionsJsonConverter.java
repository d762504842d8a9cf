package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.shared.json.AbstractJsonbAttributeConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reaction name to the ids of users who reacted, in the order reactions were first seen. */
@Converter(autoApply = false)
public class ReactionsJsonConverter
    extends AbstractJsonbAttributeConverter<Map<String, List<String>>> {

  public ReactionsJsonConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected Map<String, List<String>> emptyValue() {
    return new LinkedHashMap<>();
  }

  @Override
  protected boolean isEmpty(Map<String, List<String>> attribute) {
    return attribute == null || attribute.isEmpty();
  }
}
