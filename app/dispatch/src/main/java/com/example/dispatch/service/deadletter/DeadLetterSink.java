/*
 * どこで: Dispatch dead-letter
 * 何を: dead へ落ちたジョブの記録、件数/一覧の参照、replay 用の取り出しを担う
 * なぜ: 失敗理由と最終 payload を残し、運用者が調査と再投入を行えるようにするため
 */
package com.example.dispatch.service.deadletter;

import com.example.dispatch.model.DeadLetterRecord;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.repository.DeadLetterRepository;
import com.example.dispatch.service.DeadLetterNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeadLetterSink {

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterSink.class);

  private final DeadLetterRepository deadLetterRepository;

  /** 呼び出し元のトランザクション内で 1 行追記する。 */
  public DeadLetterRecord record(NotificationJob job, String reason, Instant now) {
    final DeadLetterRecord record =
        new DeadLetterRecord(
            UUID.randomUUID(),
            job.jobId(),
            job.userId(),
            job.type(),
            job.priority(),
            job.payload(),
            job.attempt(),
            reason,
            now,
            null);
    deadLetterRepository.insert(record);
    logger.warn(
        "job dead-lettered jobId={} userId={} type={} attempt={} reason={}",
        job.jobId(),
        job.userId(),
        job.type(),
        job.attempt(),
        reason);
    return record;
  }

  /**
   * replay 前の最新レコードに replayed_at を記録して返す。
   *
   * @throws DeadLetterNotFoundException 未 replay のレコードが無い場合
   */
  public DeadLetterRecord claimForReplay(UUID jobId, Instant now) {
    final DeadLetterRecord record =
        deadLetterRepository
            .findLatestOpenByJobIdForUpdate(jobId)
            .orElseThrow(() -> new DeadLetterNotFoundException(jobId));
    deadLetterRepository.markReplayed(record.deadLetterId(), now);
    return new DeadLetterRecord(
        record.deadLetterId(),
        record.jobId(),
        record.userId(),
        record.type(),
        record.priority(),
        record.payload(),
        record.attempt(),
        record.reason(),
        record.createdAt(),
        now);
  }

  public long count() {
    return deadLetterRepository.countOpen();
  }

  public List<DeadLetterRecord> recent(int limit) {
    return deadLetterRepository.findRecentOpen(limit);
  }

  public List<DeadLetterRecord> history(UUID jobId) {
    return deadLetterRepository.findByJobId(jobId);
  }
}
