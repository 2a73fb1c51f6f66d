package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.server.store.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Encodes stored values as JSON text so the file stays readable and independent of Java
 * serialization.
 */
class JsonValueCodec {

  private final ObjectMapper objectMapper;

  JsonValueCodec() {
    this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
  }

  String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StorageException("Unable to encode " + value.getClass().getSimpleName(), e);
    }
  }

  <T> T read(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new StorageException("Corrupt stored " + type.getSimpleName(), e);
    }
  }
}
