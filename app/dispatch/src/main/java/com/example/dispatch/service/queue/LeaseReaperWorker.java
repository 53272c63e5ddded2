/*
 * Where: Dispatch maintenance worker
 * What: Returns expired leases to the queue and refreshes the backlog gauge
 * Why: Jobs held by a crashed worker must become visible again without losing an attempt
 */
package com.example.dispatch.service.queue;

import com.example.dispatch.service.DispatchMetrics;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.maintenance.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LeaseReaperWorker {

  private final PriorityQueueStore queueStore;
  private final DispatchMetrics metrics;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${dispatch.maintenance.reap-interval}")
  public void run() {
    queueStore.reapExpiredLeases(Instant.now(clock));
    metrics.updateBacklogCurrent(queueStore.getQueueDepth(null));
  }
}
