/*
 * Where: Dispatch cleanup worker
 * What: Triggers retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.dispatch.service.retention;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dispatch.retention.enabled", havingValue = "true")
public class DispatchRetentionWorker {

  private final DispatchRetentionService retentionService;

  @Scheduled(fixedDelayString = "${dispatch.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
