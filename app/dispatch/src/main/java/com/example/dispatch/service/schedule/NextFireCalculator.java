/*
 * どこで: Dispatch scheduler
 * 何を: 配信予定の次回発火時刻を、タイムゾーン/週末/休日スキップを考慮して求める
 * なぜ: DST をまたいでも「現地時刻 09:00」のような予定を保つため
 */
package com.example.dispatch.service.schedule;

import com.example.dispatch.config.SchedulerProperties;
import com.example.dispatch.model.ScheduleSpec;
import com.example.dispatch.service.InvalidScheduleException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NextFireCalculator {

  private final HolidayCalendar holidayCalendar;
  private final SchedulerProperties properties;

  /**
   * {@code after} より後の次回発火時刻を返す。
   *
   * <p>単発予定は未発火なら fireAt(スキップ対象日なら次の対象日の同じ現地時刻)、発火済みなら空。
   * 探索が max-search-days を超えた場合も空を返す。
   */
  public Optional<Instant> computeNextFire(ScheduleSpec spec, Instant after) {
    final ZoneId zone = resolveZone(spec.timezone());
    if (spec.isRecurring()) {
      return nextCronFire(CronSchedule.parse(spec.cronExpression()), after, zone, spec);
    }
    if (spec.occurrencesSoFar() > 0 || spec.fireAt() == null) {
      return Optional.empty();
    }
    return nextEligibleOneShot(spec.fireAt(), zone, spec);
  }

  public ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException ex) {
      throw new InvalidScheduleException("invalid timezone: " + timezone, ex);
    }
  }

  private Optional<Instant> nextCronFire(
      CronExpression cron, Instant after, ZoneId zone, ScheduleSpec spec) {
    ZonedDateTime cursor = after.atZone(zone);
    final LocalDate searchLimit = cursor.toLocalDate().plusDays(properties.maxSearchDays());
    while (true) {
      final ZonedDateTime candidate = cron.next(cursor);
      if (candidate == null || candidate.toLocalDate().isAfter(searchLimit)) {
        return Optional.empty();
      }
      if (isEligibleDay(candidate.toLocalDate(), spec)) {
        return Optional.of(candidate.toInstant());
      }
      // スキップ対象日の残り候補は飛ばし、翌日 0 時から評価し直す
      cursor = candidate.toLocalDate().plusDays(1).atStartOfDay(zone).minusSeconds(1);
    }
  }

  private Optional<Instant> nextEligibleOneShot(Instant fireAt, ZoneId zone, ScheduleSpec spec) {
    final ZonedDateTime requested = fireAt.atZone(zone);
    final LocalTime localTime = requested.toLocalTime();
    LocalDate date = requested.toLocalDate();
    for (int day = 0; day <= properties.maxSearchDays(); day++) {
      if (isEligibleDay(date, spec)) {
        // 存在しない現地時刻 (DST の spring forward) は ZonedDateTime.of が後ろへずらす
        return Optional.of(
            day == 0 ? fireAt : ZonedDateTime.of(date, localTime, zone).toInstant());
      }
      date = date.plusDays(1);
    }
    return Optional.empty();
  }

  private boolean isEligibleDay(LocalDate date, ScheduleSpec spec) {
    if (spec.skipWeekends()
        && (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY)) {
      return false;
    }
    return !(spec.skipHolidays() && holidayCalendar.isHoliday(date, resolveRegion(spec)));
  }

  private String resolveRegion(ScheduleSpec spec) {
    return spec.holidayRegion() != null ? spec.holidayRegion() : properties.defaultRegion();
  }
}
