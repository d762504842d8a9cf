package com.chatdigest.backend.conversation.persistence;

import com.chatdigest.backend.shared.json.AbstractJsonbAttributeConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.List;

@Converter(autoApply = false)
public class StringListJsonConverter extends AbstractJsonbAttributeConverter<List<String>> {

  public StringListJsonConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<String> emptyValue() {
    return List.of();
  }

  @Override
  protected boolean isEmpty(List<String> attribute) {
    return attribute == null || attribute.isEmpty();
  }
}
