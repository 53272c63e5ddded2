/*
 * どこで: Dispatch データアクセス
 * 何を: payload/配信済みチャネルを jsonb 文字列と相互変換する
 * なぜ: 各リポジトリで ObjectMapper の例外処理を重複させないため
 */
package com.example.dispatch.repository;

import com.example.dispatch.model.NotificationPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PayloadJsonCodec {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String writePayload(NotificationPayload payload) {
    return write(payload);
  }

  public NotificationPayload readPayload(String json) {
    try {
      return objectMapper.readValue(json, NotificationPayload.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload parse failure", ex);
    }
  }

  public String writeChannels(List<String> channels) {
    return write(channels == null ? List.of() : channels);
  }

  public List<String> readChannels(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("delivered channels parse failure", ex);
    }
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("json serialization failure", ex);
    }
  }
}
