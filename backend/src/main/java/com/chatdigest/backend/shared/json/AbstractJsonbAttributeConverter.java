package com.chatdigest.backend.shared.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Maps a typed attribute to a {@code jsonb} column through Jackson. Generic element types are
 * described with a {@link TypeReference}, so collections and maps survive the round trip. A
 * {@code null} column reads back as {@link #emptyValue()}.
 */
public abstract class AbstractJsonbAttributeConverter<T> implements AttributeConverter<T, JsonNode> {

  protected static final JsonMapper MAPPER =
      JsonMapper.builder()
          .findAndAddModules()
          .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  private final JavaType type;

  protected AbstractJsonbAttributeConverter(TypeReference<T> typeReference) {
    this.type = MAPPER.getTypeFactory().constructType(typeReference);
  }

  protected abstract T emptyValue();

  protected boolean isEmpty(T attribute) {
    return attribute == null;
  }

  @Override
  public JsonNode convertToDatabaseColumn(T attribute) {
    if (isEmpty(attribute)) {
      return null;
    }
    return MAPPER.valueToTree(attribute);
  }

  @Override
  public T convertToEntityAttribute(JsonNode dbData) {
    if (dbData == null || dbData.isNull() || dbData.isMissingNode()) {
      return emptyValue();
    }
    try {
      T value = MAPPER.treeToValue(dbData, type);
      return value != null ? value : emptyValue();
    } catch (JsonProcessingException exception) {
      throw new IllegalStateException("Failed to convert JSON to " + type.toCanonical(), exception);
    }
  }
}
