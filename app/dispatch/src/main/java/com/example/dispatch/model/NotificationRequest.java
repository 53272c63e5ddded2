/*
 * どこで: Dispatch ドメインモデル
 * 何を: 呼び出し元から受け付ける通知要求を表現する
 * なぜ: template 展開/購読設定/schedule/grouping の判定入力をまとめるため
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

@Builder
public record NotificationRequest(
    UUID jobId,
    String userId,
    String type,
    Priority priority,
    List<String> channels,
    String templateId,
    String title,
    String body,
    Map<String, Object> data,
    ScheduleRequest schedule,
    Integer maxAttempts,
    Instant expiresAt,
    String traceId) {

  public NotificationRequest {
    channels = channels == null ? List.of() : List.copyOf(channels);
    data = data == null ? Map.of() : data;
  }
}
