/*
 * どこで: Dispatch 配信層
 * 何を: lease したジョブをチャネルごとに rate limit 判定・送信し、結果をキューへ ack する
 * なぜ: 配信 1 件分の判断(期限切れ/throttle/retry/dead)をワーカーループから切り離すため
 */
package com.example.dispatch.service.dispatch;

import com.example.common.TraceIds;
import com.example.dispatch.config.DispatchWorkerProperties;
import com.example.dispatch.model.AckOutcome;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.service.dispatch.DeliveryFailureClassifier.Classification;
import com.example.dispatch.service.queue.PriorityQueueStore;
import com.example.dispatch.service.ratelimit.RateLimitKeys;
import com.example.dispatch.service.ratelimit.RateLimiter;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchJobProcessor {

  private static final Logger logger = LoggerFactory.getLogger(DispatchJobProcessor.class);
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_TRACE_ID = "trace_id";

  private final PriorityQueueStore queueStore;
  private final RateLimiter rateLimiter;
  private final ChannelAdapterRegistry adapterRegistry;
  private final ChannelDeliveryInvoker deliveryInvoker;
  private final DeliveryFailureClassifier classifier;
  private final DispatchWorkerProperties properties;
  private final Clock clock;

  /**
   * 1 バッチ分を lease して処理する。
   *
   * @return lease できたジョブ数。0 ならキューが空
   */
  public int runOnce(String workerId) {
    final Instant now = Instant.now(clock);
    // lease は単一 SQL で確定させ、送信 IO を長期トランザクションに載せない
    final List<NotificationJob> leased = queueStore.lease(workerId, properties.batchSize(), now);
    for (NotificationJob job : leased) {
      MDC.put(MDC_JOB_ID, job.jobId().toString());
      MDC.put(MDC_TRACE_ID, TraceIds.orNew(job.traceId()));
      try {
        process(job, workerId);
      } catch (RuntimeException ex) {
        // ack できなかったジョブは lease 期限切れ後に reaper が戻す
        logger.error("job processing failed; lease left to expire jobId={} workerId={}", job.jobId(), workerId, ex);
      } finally {
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_TRACE_ID);
      }
    }
    return leased.size();
  }

  @VisibleForTesting
  Optional<JobState> process(NotificationJob job, String workerId) {
    final Instant startedAt = Instant.now(clock);
    if (job.isExpiredAt(startedAt)) {
      return queueStore.ack(job, workerId, AckOutcome.DEAD, "expired", startedAt);
    }
    if (!queueStore.markDelivering(job, workerId, startedAt)) {
      return Optional.empty();
    }
    final List<String> delivered = new ArrayList<>(job.deliveredChannels());
    for (String channel : job.remainingChannels()) {
      if (!acquire(job, channel)) {
        return ack(job, delivered, workerId, AckOutcome.THROTTLED, "rate limited channel=" + channel);
      }
      final Classification classification =
          adapterRegistry
              .find(channel)
              .map(adapter -> classifier.classify(deliveryInvoker.invoke(adapter, job.payload(), channel), channel))
              .orElseGet(() -> classifier.missingAdapter(channel));
      if (classification.outcome() != AckOutcome.SUCCESS) {
        return ack(job, delivered, workerId, classification.outcome(), classification.reason());
      }
      delivered.add(channel);
      logger.debug("channel delivered jobId={} channel={}", job.jobId(), channel);
    }
    return ack(job, delivered, workerId, AckOutcome.SUCCESS, null);
  }

  // 共有のチャネル bucket は、そのユーザーの bucket が通ったときだけ消費する
  private boolean acquire(NotificationJob job, String channel) {
    return rateLimiter.tryAcquire(RateLimitKeys.user(job.userId(), channel))
        && rateLimiter.tryAcquire(RateLimitKeys.channel(channel));
  }

  private Optional<JobState> ack(
      NotificationJob job, List<String> delivered, String workerId, AckOutcome outcome, String reason) {
    final NotificationJob progressed = job.toBuilder().deliveredChannels(delivered).build();
    return queueStore.ack(progressed, workerId, outcome, reason, Instant.now(clock));
  }
}
