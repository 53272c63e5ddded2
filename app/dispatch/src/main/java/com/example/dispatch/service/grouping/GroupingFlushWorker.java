/*
 * どこで: Dispatch grouping ワーカー
 * 何を: 期限を過ぎた OPEN 窓を定期的に flush する
 * なぜ: 後続の候補が来ない窓でも digest を遅延なく配信するため
 */
package com.example.dispatch.service.grouping;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.grouping.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class GroupingFlushWorker {

  private final GroupingEngine groupingEngine;
  private final Clock clock;

  @Scheduled(
      fixedDelayString = "${dispatch.grouping.flush-interval}",
      initialDelayString = "${dispatch.grouping.flush-interval}")
  public void run() {
    groupingEngine.flushDue(Instant.now(clock));
  }
}
