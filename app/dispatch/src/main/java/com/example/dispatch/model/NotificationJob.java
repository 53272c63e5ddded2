/*
 * どこで: Dispatch ドメインモデル
 * 何を: notification_jobs の 1 行(配信ジョブ)を表現する
 * なぜ: キュー/ワーカー/運用 API で同じジョブ表現を共有するため
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record NotificationJob(
    UUID jobId,
    String userId,
    String type,
    Priority priority,
    NotificationPayload payload,
    JobState state,
    int attempt,
    int maxAttempts,
    Instant notBefore,
    String leaseOwner,
    Instant leaseExpiresAt,
    String groupKey,
    UUID scheduleId,
    String traceId,
    List<String> deliveredChannels,
    String lastError,
    Instant expiresAt,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt) {

  public NotificationJob {
    deliveredChannels = deliveredChannels == null ? List.of() : List.copyOf(deliveredChannels);
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  /** まだ配信に成功していないチャネルを payload の並び順で返す。 */
  public List<String> remainingChannels() {
    return payload.channels().stream().filter(channel -> !deliveredChannels.contains(channel)).toList();
  }
}
