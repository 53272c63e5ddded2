/*
 * どこで: Dispatch scheduler
 * 何を: 5 フィールドの cron 式を Spring の CronExpression へ変換する
 * なぜ: 標準 cron 表記で受け付け、秒フィールド付きの Spring 形式で評価するため
 */
package com.example.dispatch.service.schedule;

import com.example.dispatch.service.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

public final class CronSchedule {

  private CronSchedule() {}

  /**
   * 5 フィールド (minute hour day-of-month month day-of-week) の cron 式を解釈する。
   *
   * <p>day-of-month と day-of-week を両方制限する式は受け付けない。標準 cron はこの 2 つを OR で
   * 評価するが、CronExpression は AND で評価するため、同じ式でも発火日が変わってしまう。どちらか一方を
   * {@code *} か {@code ?} にすること。
   *
   * @throws InvalidScheduleException 式が空、フィールド数が 5 でない、両方の日フィールドを制限している、
   *     または構文が不正な場合
   */
  public static CronExpression parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidScheduleException("cron expression is required");
    }
    final String trimmed = expression.trim();
    final String[] fields = trimmed.split("\\s+");
    if (fields.length != 5) {
      throw new InvalidScheduleException(
          "cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + expression);
    }
    if (restricts(fields[2]) && restricts(fields[4])) {
      throw new InvalidScheduleException(
          "cron expression must not restrict both day-of-month and day-of-week: " + expression);
    }
    try {
      return CronExpression.parse("0 " + trimmed);
    } catch (IllegalArgumentException ex) {
      throw new InvalidScheduleException("invalid cron expression: " + expression, ex);
    }
  }

  private static boolean restricts(String field) {
    return !"*".equals(field) && !"?".equals(field);
  }
}
