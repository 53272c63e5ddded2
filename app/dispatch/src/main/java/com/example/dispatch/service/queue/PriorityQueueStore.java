/*
 * どこで: Dispatch キュー
 * 何を: ジョブの enqueue/lease/ack/lease 回収/replay を状態遷移として提供する
 * なぜ: 優先度順の取り出しと再試行・dead 判定をワーカーから切り離して一元管理するため
 */
package com.example.dispatch.service.queue;

import com.example.dispatch.config.DispatchQueueProperties;
import com.example.dispatch.config.DispatchWorkerProperties;
import com.example.dispatch.model.AckOutcome;
import com.example.dispatch.model.DeadLetterRecord;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import com.example.dispatch.repository.JobQueueRepository;
import com.example.dispatch.service.DispatchMetrics;
import com.example.dispatch.service.DuplicateJobException;
import com.example.dispatch.service.InvalidJobStateException;
import com.example.dispatch.service.JobNotFoundException;
import com.example.dispatch.service.deadletter.DeadLetterSink;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class PriorityQueueStore {

  private static final Logger logger = LoggerFactory.getLogger(PriorityQueueStore.class);

  private final JobQueueRepository jobQueueRepository;
  private final DeadLetterSink deadLetterSink;
  private final BackoffPolicy backoffPolicy;
  private final DispatchQueueProperties properties;
  private final DispatchWorkerProperties workerProperties;
  private final DispatchMetrics metrics;
  private final PlatformTransactionManager transactionManager;

  /**
   * ジョブを登録する。not_before が未来なら SCHEDULED、それ以外は QUEUED で入る。
   *
   * @throws DuplicateJobException 同じ jobId が既にキューか group 窓に存在する場合
   */
  public NotificationJob enqueue(NotificationJob job, Instant now) {
    final NotificationJob stored = prepare(job, now);
    // ON CONFLICT DO NOTHING で判定し、呼び出し元トランザクションを壊さない
    if (jobQueueRepository.insertIfAbsent(stored) == 0) {
      throw new DuplicateJobException(job.jobId());
    }
    logEnqueued(stored);
    return stored;
  }

  /**
   * flush 中の窓から digest を登録する。windowId の窓に属するメンバーの jobId は重複扱いしない。
   *
   * @throws DuplicateJobException 同じ jobId が既にキューか他の窓に存在する場合
   */
  public NotificationJob enqueueFromWindow(NotificationJob digest, UUID windowId, Instant now) {
    final NotificationJob stored = prepare(digest, now);
    if (jobQueueRepository.insertIfAbsent(stored, windowId) == 0) {
      throw new DuplicateJobException(digest.jobId());
    }
    logEnqueued(stored);
    return stored;
  }

  private NotificationJob prepare(NotificationJob job, Instant now) {
    final Instant notBefore = job.notBefore() == null ? now : job.notBefore();
    final JobState state = notBefore.isAfter(now) ? JobState.SCHEDULED : JobState.QUEUED;
    final int maxAttempts =
        job.maxAttempts() > 0 ? job.maxAttempts() : properties.maxAttemptsFor(job.priority());
    return job.toBuilder()
        .state(state)
        .attempt(0)
        .maxAttempts(maxAttempts)
        .notBefore(notBefore)
        .leaseOwner(null)
        .leaseExpiresAt(null)
        .createdAt(job.createdAt() == null ? now : job.createdAt())
        .updatedAt(now)
        .build();
  }

  private void logEnqueued(NotificationJob stored) {
    logger.info(
        "job enqueued jobId={} userId={} type={} priority={} state={} notBefore={}",
        stored.jobId(),
        stored.userId(),
        stored.type(),
        stored.priority(),
        stored.state(),
        stored.notBefore());
  }

  public List<NotificationJob> lease(String workerId, int batchSize, Instant now) {
    final Instant leaseUntil = now.plus(properties.lease());
    return jobQueueRepository.claimDue(batchSize, now, leaseUntil, workerId);
  }

  /** LEASED から DELIVERING へ進める。lease を失っていれば false。 */
  public boolean markDelivering(NotificationJob job, String workerId, Instant now) {
    final int updated = jobQueueRepository.markDelivering(job.jobId(), workerId, now);
    if (updated == 0) {
      logger.warn("job delivery skipped because lease was lost jobId={} workerId={}", job.jobId(), workerId);
      return false;
    }
    return true;
  }

  /**
   * 配信試行の結果を反映する。
   *
   * <p>{@code job.deliveredChannels()} は今回までに成功したチャネルとして保存される。
   *
   * @return 遷移後の状態。lease を失っていた場合は空
   */
  public Optional<JobState> ack(
      NotificationJob job, String workerId, AckOutcome outcome, String reason, Instant now) {
    return switch (outcome) {
      case SUCCESS -> ackSuccess(job, workerId, now);
      case RETRY -> ackRetry(job, workerId, reason, now);
      case THROTTLED -> ackThrottled(job, workerId, reason, now);
      case DEAD -> routeToDeadLetter(job, workerId, Math.min(job.attempt() + 1, job.maxAttempts()), reason, now);
    };
  }

  /** lease 期限切れのジョブを QUEUED へ戻し、戻した件数を返す。 */
  public int reapExpiredLeases(Instant now) {
    final List<UUID> reaped = jobQueueRepository.reapExpiredLeases(now);
    if (!reaped.isEmpty()) {
      logger.warn("expired leases reaped count={} jobIds={}", reaped.size(), reaped);
    }
    metrics.recordLeasesReaped(reaped.size());
    return reaped.size();
  }

  /**
   * DEAD のジョブを attempt 0 で QUEUED へ戻し、dead-letter レコードに replay 済みを記録する。
   *
   * @throws com.example.dispatch.service.DeadLetterNotFoundException 未 replay のレコードが無い場合
   * @throws InvalidJobStateException ジョブが DEAD でない場合
   */
  public DeadLetterRecord replayDead(UUID jobId, Instant now) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final DeadLetterRecord replayed =
        transactionTemplate.execute(
            status -> {
              final DeadLetterRecord record = deadLetterSink.claimForReplay(jobId, now);
              if (jobQueueRepository.resetDeadForReplay(jobId, now) == 0) {
                // 例外で抜けるため dead-letter 側の replayed_at もロールバックされる
                final JobState actual =
                    jobQueueRepository
                        .findById(jobId)
                        .map(NotificationJob::state)
                        .orElseThrow(() -> new JobNotFoundException(jobId));
                throw new InvalidJobStateException(jobId, actual, JobState.DEAD);
              }
              return record;
            });
    logger.info("dead letter replayed jobId={} deadLetterId={}", jobId, replayed.deadLetterId());
    return replayed;
  }

  public Optional<NotificationJob> findById(UUID jobId) {
    return jobQueueRepository.findById(jobId);
  }

  /** priority が null の場合は全優先度の合計。 */
  public long getQueueDepth(Priority priority) {
    return jobQueueRepository.countWaiting(priority);
  }

  private Optional<JobState> ackSuccess(NotificationJob job, String workerId, Instant now) {
    final int updated =
        jobQueueRepository.markSucceeded(job.jobId(), workerId, job.deliveredChannels(), now);
    if (updated == 0) {
      logger.warn(
          "job delivered but lease was lost jobId={} workerId={}", job.jobId(), workerId);
      return Optional.empty();
    }
    metrics.recordDeliveryResult("succeeded");
    metrics.recordDeliveryE2eDelay(job.createdAt(), now);
    return Optional.of(JobState.SUCCEEDED);
  }

  private Optional<JobState> ackRetry(NotificationJob job, String workerId, String reason, Instant now) {
    final int nextAttempt = job.attempt() + 1;
    if (nextAttempt >= job.maxAttempts()) {
      return routeToDeadLetter(job, workerId, job.maxAttempts(), reason, now);
    }
    final Duration backoff = backoffPolicy.computeBackoff(nextAttempt);
    final int updated =
        jobQueueRepository.markRequeued(
            job.jobId(),
            workerId,
            nextAttempt,
            now.plus(backoff),
            job.deliveredChannels(),
            truncateError(reason),
            now);
    if (updated == 0) {
      logger.warn(
          "job retry skipped because lease was lost jobId={} attempt={}", job.jobId(), nextAttempt);
      return Optional.empty();
    }
    metrics.recordDeliveryResult("retry");
    logger.warn(
        "job retry scheduled jobId={} attempt={} backoffMs={} reason={}",
        job.jobId(),
        nextAttempt,
        backoff.toMillis(),
        reason);
    return Optional.of(JobState.QUEUED);
  }

  private Optional<JobState> ackThrottled(
      NotificationJob job, String workerId, String reason, Instant now) {
    // rate limit 待ちは配信失敗ではないため attempt を消費しない
    final Instant notBefore = now.plus(workerProperties.throttleDelay());
    final int updated =
        jobQueueRepository.markRequeued(
            job.jobId(), workerId, job.attempt(), notBefore, job.deliveredChannels(), truncateError(reason), now);
    if (updated == 0) {
      logger.warn("job throttle requeue skipped because lease was lost jobId={}", job.jobId());
      return Optional.empty();
    }
    metrics.recordDeliveryResult("throttled");
    logger.info("job throttled jobId={} notBefore={} reason={}", job.jobId(), notBefore, reason);
    return Optional.of(JobState.QUEUED);
  }

  @VisibleForTesting
  Optional<JobState> routeToDeadLetter(
      NotificationJob job, String workerId, int attempt, String reason, Instant now) {
    final String truncated = truncateError(reason);
    // DEAD 更新と dead-letter 追記を同一トランザクションにまとめ、lease 喪失時は両方取り消す
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean moved =
        transactionTemplate.execute(
            status -> {
              final int count =
                  jobQueueRepository.markDead(
                      job.jobId(), workerId, attempt, job.deliveredChannels(), truncated, now);
              if (count == 0) {
                status.setRollbackOnly();
                return false;
              }
              deadLetterSink.record(job.toBuilder().attempt(attempt).build(), truncated, now);
              return true;
            });
    if (!Boolean.TRUE.equals(moved)) {
      logger.warn(
          "job dead-letter skipped because lease was lost jobId={} workerId={}", job.jobId(), workerId);
      return Optional.empty();
    }
    metrics.recordDeliveryResult("dead");
    metrics.recordDlqMoved();
    return Optional.of(JobState.DEAD);
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
