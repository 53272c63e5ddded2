/*
 * どこで: Dispatch 運用 API
 * 何を: ジョブ状態照会のレスポンスを表す
 * なぜ: リース情報など内部項目を除いた形で返すため
 */
package com.example.dispatch.api;

import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobStatusResponse(
    UUID jobId,
    String userId,
    String type,
    Priority priority,
    JobState state,
    int attempt,
    int maxAttempts,
    Instant notBefore,
    String groupKey,
    List<String> deliveredChannels,
    String lastError,
    Instant createdAt,
    Instant completedAt) {

  static JobStatusResponse from(NotificationJob job) {
    return new JobStatusResponse(
        job.jobId(),
        job.userId(),
        job.type(),
        job.priority(),
        job.state(),
        job.attempt(),
        job.maxAttempts(),
        job.notBefore(),
        job.groupKey(),
        job.deliveredChannels(),
        job.lastError(),
        job.createdAt(),
        job.completedAt());
  }
}
