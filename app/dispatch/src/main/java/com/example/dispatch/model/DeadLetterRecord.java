/*
 * どこで: Dispatch ドメインモデル
 * 何を: notification_dead_letters の 1 行を表現する
 * なぜ: 失敗ジョブの理由と最終 payload を運用者へ提示するため
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record DeadLetterRecord(
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

  public boolean isReplayed() {
    return replayedAt != null;
  }
}
