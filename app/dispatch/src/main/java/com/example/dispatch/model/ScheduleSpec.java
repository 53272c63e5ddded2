/*
 * どこで: Dispatch ドメインモデル
 * 何を: schedule_specs の 1 行(定期/単発の配信予定)を表現する
 * なぜ: 次回発火時刻の計算と materialize の入力を一つにまとめるため
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

@Builder(toBuilder = true)
public record ScheduleSpec(
    UUID specId,
    String userId,
    String type,
    Priority priority,
    NotificationPayload payload,
    String cronExpression,
    Instant fireAt,
    String timezone,
    boolean skipWeekends,
    boolean skipHolidays,
    String holidayRegion,
    Integer maxOccurrences,
    int occurrencesSoFar,
    int maxAttempts,
    Instant nextFireAt,
    Instant endAt,
    ScheduleStatus status,
    String traceId,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isRecurring() {
    return cronExpression != null;
  }

  public boolean isExhausted() {
    return maxOccurrences != null && occurrencesSoFar >= maxOccurrences;
  }
}
