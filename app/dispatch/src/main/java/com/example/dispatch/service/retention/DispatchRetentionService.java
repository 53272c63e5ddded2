/*
 * Where: Dispatch service layer
 * What: Applies retention policy to succeeded jobs, closed group windows and closed schedules
 * Why: Prevent unbounded growth while keeping dead jobs and anomalous active records
 */
package com.example.dispatch.service.retention;

import com.example.dispatch.config.DispatchRetentionProperties;
import com.example.dispatch.repository.GroupWindowRepository;
import com.example.dispatch.repository.JobQueueRepository;
import com.example.dispatch.repository.ScheduleSpecRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchRetentionService.class);

  private final JobQueueRepository jobQueueRepository;
  private final GroupWindowRepository groupWindowRepository;
  private final ScheduleSpecRepository scheduleSpecRepository;
  private final DispatchRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = jobQueueRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "dispatch retention found stale active jobs count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deletedJobs = jobQueueRepository.deleteSucceededOlderThan(threshold);
    final int deletedWindows = groupWindowRepository.deleteClosedOlderThan(threshold);
    final int deletedSchedules = scheduleSpecRepository.deleteClosedOlderThan(threshold);
    logger.info(
        "dispatch retention cleanup deleted jobs={} windows={} schedules={} threshold={}",
        deletedJobs,
        deletedWindows,
        deletedSchedules,
        threshold);
  }
}
