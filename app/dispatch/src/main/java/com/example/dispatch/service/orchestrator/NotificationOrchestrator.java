/*
 * どこで: Dispatch 受付層
 * 何を: 通知要求を購読設定/テンプレート/schedule/grouping に振り分けて受け付け、運用向け照会をまとめて提供する
 * なぜ: 呼び出し元が各コンポーネントの配線を知らずに submit と状態照会だけで済むようにするため
 */
package com.example.dispatch.service.orchestrator;

import com.example.common.TraceIds;
import com.example.dispatch.config.DispatchQueueProperties;
import com.example.dispatch.model.DeadLetterRecord;
import com.example.dispatch.model.GroupingRule;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.OfferResult;
import com.example.dispatch.model.Priority;
import com.example.dispatch.model.ScheduleRequest;
import com.example.dispatch.model.ScheduleSpec;
import com.example.dispatch.model.ScheduleStatus;
import com.example.dispatch.model.SubmissionReceipt;
import com.example.dispatch.service.InvalidScheduleException;
import com.example.dispatch.service.deadletter.DeadLetterSink;
import com.example.dispatch.service.grouping.GroupingEngine;
import com.example.dispatch.service.grouping.GroupingRuleRegistry;
import com.example.dispatch.service.orchestrator.TemplateRenderer.RenderedTemplate;
import com.example.dispatch.service.queue.PriorityQueueStore;
import com.example.dispatch.service.schedule.NextFireCalculator;
import com.example.dispatch.service.schedule.NotificationScheduler;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(NotificationOrchestrator.class);

  private final PriorityQueueStore queueStore;
  private final DeadLetterSink deadLetterSink;
  private final NotificationScheduler scheduler;
  private final NextFireCalculator nextFireCalculator;
  private final GroupingEngine groupingEngine;
  private final GroupingRuleRegistry groupingRuleRegistry;
  private final TemplateRenderer templateRenderer;
  private final PreferenceStore preferenceStore;
  private final DispatchQueueProperties queueProperties;
  private final Clock clock;

  /**
   * 通知要求を受け付け、処理区分を返す。配信はワーカーが非同期に行う。
   *
   * @throws com.example.dispatch.service.DuplicateJobException 指定 jobId が既に存在する場合
   * @throws IllegalArgumentException 要求内容が不正な場合
   */
  public SubmissionReceipt submit(NotificationRequest request) {
    validate(request);
    final String traceId = TraceIds.orNew(request.traceId());
    final Priority priority = request.priority() == null ? Priority.MEDIUM : request.priority();
    final List<String> channels =
        request.channels().stream()
            .distinct()
            .filter(channel -> preferenceStore.shouldSend(request.userId(), request.type(), channel))
            .toList();
    if (channels.isEmpty()) {
      logger.info(
          "notification suppressed by preferences userId={} type={} traceId={}",
          request.userId(),
          request.type(),
          traceId);
      return SubmissionReceipt.suppressed();
    }
    final NotificationPayload payload = buildPayload(request, channels);
    final int maxAttempts =
        request.maxAttempts() != null ? request.maxAttempts() : queueProperties.maxAttemptsFor(priority);
    final ScheduleRequest schedule = request.schedule();
    if (schedule != null && schedule.isRecurring()) {
      final ScheduleSpec spec =
          scheduler.register(
              request.userId(), request.type(), priority, payload, maxAttempts, schedule, traceId);
      return SubmissionReceipt.recurring(spec.specId());
    }

    final Instant now = Instant.now(clock);
    final UUID jobId = request.jobId() == null ? UUID.randomUUID() : request.jobId();
    final NotificationJob job =
        NotificationJob.builder()
            .jobId(jobId)
            .userId(request.userId())
            .type(request.type())
            .priority(priority)
            .payload(payload)
            .state(JobState.PENDING)
            .maxAttempts(maxAttempts)
            .notBefore(now)
            .traceId(traceId)
            .expiresAt(request.expiresAt())
            .createdAt(now)
            .build();
    if (schedule != null) {
      final Instant fireAt = resolveOneShotFire(request, schedule, priority, payload, maxAttempts, now);
      final NotificationJob stored = queueStore.enqueue(job.toBuilder().notBefore(fireAt).build(), now);
      return stored.state() == JobState.SCHEDULED
          ? SubmissionReceipt.scheduled(jobId)
          : SubmissionReceipt.queued(jobId);
    }
    final Optional<GroupingRule> rule = groupingRuleRegistry.ruleFor(request.type());
    if (rule.isPresent()) {
      final OfferResult offered = groupingEngine.offer(job, rule.get(), now);
      return offered.isBypassed()
          ? SubmissionReceipt.queued(jobId)
          : SubmissionReceipt.grouped(jobId, offered.groupKey());
    }
    queueStore.enqueue(job, now);
    return SubmissionReceipt.queued(jobId);
  }

  /** 窓に保留中のメンバーは、digest の状態に追従した形で返す。 */
  public Optional<NotificationJob> getJobStatus(UUID jobId) {
    return queueStore.findById(jobId).or(() -> groupingEngine.findMemberView(jobId));
  }

  public DeadLetterRecord replayDeadLetter(UUID jobId) {
    return queueStore.replayDead(jobId, Instant.now(clock));
  }

  /** priority が null の場合は全優先度の合計。 */
  public long getQueueDepth(Priority priority) {
    return queueStore.getQueueDepth(priority);
  }

  public long getDeadLetterCount() {
    return deadLetterSink.count();
  }

  public List<DeadLetterRecord> getRecentDeadLetters(int limit) {
    return deadLetterSink.recent(limit);
  }

  public List<DeadLetterRecord> getDeadLetterHistory(UUID jobId) {
    return deadLetterSink.history(jobId);
  }

  public Optional<NotificationJob> flushGroup(String groupKey) {
    return groupingEngine.flush(groupKey, Instant.now(clock));
  }

  public boolean cancelGroup(String groupKey) {
    return groupingEngine.cancel(groupKey, Instant.now(clock));
  }

  public void cancelSchedule(UUID specId) {
    scheduler.cancel(specId);
  }

  public ScheduleSpec updateSchedule(UUID specId, ScheduleRequest schedule) {
    return scheduler.update(specId, schedule);
  }

  public List<ScheduleSpec> getActiveSchedules(String userId) {
    return scheduler.findActive(userId);
  }

  private Instant resolveOneShotFire(
      NotificationRequest request,
      ScheduleRequest schedule,
      Priority priority,
      NotificationPayload payload,
      int maxAttempts,
      Instant now) {
    if (schedule.fireAt() == null) {
      throw new InvalidScheduleException("schedule requires cron expression or fire_at");
    }
    // 単発予定は schedule_specs を作らず、スキップ判定だけ共有して not_before に載せる
    final ScheduleSpec oneShot =
        ScheduleSpec.builder()
            .userId(request.userId())
            .type(request.type())
            .priority(priority)
            .payload(payload)
            .fireAt(schedule.fireAt())
            .timezone(schedule.timezone())
            .skipWeekends(schedule.skipWeekends())
            .skipHolidays(schedule.skipHolidays())
            .holidayRegion(schedule.holidayRegion())
            .maxAttempts(maxAttempts)
            .status(ScheduleStatus.ACTIVE)
            .build();
    return nextFireCalculator
        .computeNextFire(oneShot, now)
        .filter(fire -> schedule.endAt() == null || !fire.isAfter(schedule.endAt()))
        .orElseThrow(() -> new InvalidScheduleException("schedule has no upcoming fire time"));
  }

  private NotificationPayload buildPayload(NotificationRequest request, List<String> channels) {
    if (request.templateId() != null && !request.templateId().isBlank()) {
      final RenderedTemplate rendered = templateRenderer.render(request.templateId(), request.data());
      return new NotificationPayload(
          request.userId(), rendered.title(), rendered.body(), channels, request.data());
    }
    return new NotificationPayload(request.userId(), request.title(), request.body(), channels, request.data());
  }

  private void validate(NotificationRequest request) {
    if (request.userId() == null || request.userId().isBlank()) {
      throw new IllegalArgumentException("user_id is required");
    }
    if (request.type() == null || request.type().isBlank()) {
      throw new IllegalArgumentException("type is required");
    }
    if (request.channels().isEmpty()) {
      throw new IllegalArgumentException("channels must not be empty");
    }
    if (request.maxAttempts() != null && request.maxAttempts() < 1) {
      throw new IllegalArgumentException("max_attempts must be >= 1");
    }
  }
}
