/*
 * どこで: Dispatch scheduler
 * 何を: 地域ごとの休日判定を抽象化する
 * なぜ: 暦データの供給元を scheduler から切り離すため
 */
package com.example.dispatch.service.schedule;

import java.time.LocalDate;

public interface HolidayCalendar {

  boolean isHoliday(LocalDate date, String region);
}
