/*
 * どこで: Dispatch scheduler ワーカー
 * 何を: 一定間隔で期限到来の配信予定を materialize する
 * なぜ: 定期配信を発火時刻に近いタイミングでキューへ載せるため
 */
package com.example.dispatch.service.schedule;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulerWorker {

  private final NotificationScheduler scheduler;

  @Scheduled(fixedDelayString = "${dispatch.scheduler.tick-interval}")
  public void run() {
    scheduler.tick();
  }
}
