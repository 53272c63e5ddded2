/*
 * どこで: Dispatch ドメインモデル
 * 何を: 配信内容(宛先/タイトル/本文/チャネル/任意データ)を保持する
 * なぜ: jsonb 列とチャネルアダプタ間で同じ構造を受け渡すため
 */
package com.example.dispatch.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPayload(
    String recipient, String title, String body, List<String> channels, Map<String, Object> data) {

  public NotificationPayload {
    channels = channels == null ? List.of() : List.copyOf(channels);
    // data は null 値を許容するため Map.copyOf ではなく LinkedHashMap で複製する
    data =
        data == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public NotificationPayload withChannels(List<String> newChannels) {
    return new NotificationPayload(recipient, title, body, newChannels, data);
  }
}
