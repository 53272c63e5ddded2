/*
 * どこで: Dispatch ドメインモデル
 * 何を: 通知要求に付随する配信予定(cron または単発時刻)を保持する
 * なぜ: 受付時に scheduler へ登録するか遅延 enqueue するかを判定するため
 */
package com.example.dispatch.model;

import java.time.Instant;
import lombok.Builder;

@Builder
public record ScheduleRequest(
    String cronExpression,
    Instant fireAt,
    String timezone,
    boolean skipWeekends,
    boolean skipHolidays,
    String holidayRegion,
    Integer maxOccurrences,
    Instant endAt) {

  public boolean isRecurring() {
    return cronExpression != null && !cronExpression.isBlank();
  }
}
