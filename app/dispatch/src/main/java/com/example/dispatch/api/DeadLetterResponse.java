/*
 * どこで: Dispatch 運用 API
 * 何を: dead letter 1 件のレスポンスを表す
 * なぜ: 失敗理由と最終 payload を運用者へ提示するため
 */
package com.example.dispatch.api;

import com.example.dispatch.model.DeadLetterRecord;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.model.Priority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeadLetterResponse(
    UUID deadLetterId,
    UUID jobId,
    String userId,
    String type,
    Priority priority,
    NotificationPayload payload,
    int attempt,
    String reason,
    Instant createdAt,
    Instant replayedAt) {

  static DeadLetterResponse from(DeadLetterRecord record) {
    return new DeadLetterResponse(
        record.deadLetterId(),
        record.jobId(),
        record.userId(),
        record.type(),
        record.priority(),
        record.payload(),
        record.attempt(),
        record.reason(),
        record.createdAt(),
        record.replayedAt());
  }
}
