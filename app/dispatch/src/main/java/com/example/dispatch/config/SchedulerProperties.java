/*
 * どこで: Dispatch アプリの設定バインド
 * 何を: scheduler の tick 間隔/探索上限/ユーザーあたりの予定数上限/休日カレンダーを保持する
 * なぜ: 休日スキップの暦を配布物に含めず環境から与えるため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "dispatch.scheduler")
@Validated
public record SchedulerProperties(
    boolean enabled,
    Duration tickInterval,
    @Positive int batchSize,
    @Positive int maxSearchDays,
    @Positive int maxActivePerUser,
    String defaultRegion,
    Map<String, List<LocalDate>> holidays) {

  public SchedulerProperties {
    holidays = holidays == null ? Map.of() : Map.copyOf(holidays);
  }
}
