/*
 * Where: Dispatch scheduler
 * What: Answers holiday lookups from dispatch.scheduler.holidays
 * Why: Keep the calendar as plain configuration until a calendar service is wired in
 */
package com.example.dispatch.service.schedule;

import com.example.dispatch.config.SchedulerProperties;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfiguredHolidayCalendar implements HolidayCalendar {

  private final SchedulerProperties properties;

  @Override
  public boolean isHoliday(LocalDate date, String region) {
    if (region == null) {
      return false;
    }
    final List<LocalDate> holidays = properties.holidays().get(region);
    return holidays != null && holidays.contains(date);
  }
}
