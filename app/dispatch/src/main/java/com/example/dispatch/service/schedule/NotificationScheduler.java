/*
 * どこで: Dispatch scheduler
 * 何を: 配信予定の登録/変更/取消と、期限到来分のジョブ化(materialize)を行う
 * なぜ: 定期配信を発火ごとに 1 回だけキューへ投入するため
 */
package com.example.dispatch.service.schedule;

import com.example.dispatch.config.SchedulerProperties;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.model.Priority;
import com.example.dispatch.model.ScheduleRequest;
import com.example.dispatch.model.ScheduleSpec;
import com.example.dispatch.model.ScheduleStatus;
import com.example.dispatch.repository.ScheduleSpecRepository;
import com.example.dispatch.service.DispatchMetrics;
import com.example.dispatch.service.DuplicateJobException;
import com.example.dispatch.service.InvalidScheduleException;
import com.example.dispatch.service.ScheduleNotFoundException;
import com.example.dispatch.service.queue.PriorityQueueStore;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationScheduler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationScheduler.class);
  private static final int MAX_UPDATE_ATTEMPTS = 3;

  private final ScheduleSpecRepository scheduleSpecRepository;
  private final PriorityQueueStore queueStore;
  private final NextFireCalculator nextFireCalculator;
  private final SchedulerProperties properties;
  private final DispatchMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 配信予定を登録し、初回の発火時刻を確定させる。
   *
   * @throws InvalidScheduleException cron/タイムゾーンが不正、発火時刻が見つからない、
   *     またはユーザーの ACTIVE な予定が上限に達している場合
   */
  public ScheduleSpec register(
      String userId,
      String type,
      Priority priority,
      NotificationPayload payload,
      int maxAttempts,
      ScheduleRequest request,
      String traceId) {
    requireTrigger(request);
    final int active = scheduleSpecRepository.countActiveByUserId(userId);
    if (active >= properties.maxActivePerUser()) {
      logger.warn("schedule rejected by per-user limit userId={} active={}", userId, active);
      throw new InvalidScheduleException(
          "user has reached the active schedule limit of " + properties.maxActivePerUser());
    }
    final Instant now = Instant.now(clock);
    final ScheduleSpec draft =
        withTrigger(ScheduleSpec.builder(), request)
            .specId(UUID.randomUUID())
            .userId(userId)
            .type(type)
            .priority(priority)
            .payload(payload)
            .occurrencesSoFar(0)
            .maxAttempts(maxAttempts)
            .status(ScheduleStatus.ACTIVE)
            .traceId(traceId)
            .createdAt(now)
            .updatedAt(now)
            .build();
    if (draft.maxOccurrences() != null && draft.maxOccurrences() < 1) {
      throw new InvalidScheduleException("max_occurrences must be >= 1");
    }
    final ScheduleSpec spec = draft.toBuilder().nextFireAt(firstFire(draft, now)).build();
    scheduleSpecRepository.insert(spec);
    logger.info(
        "schedule registered specId={} userId={} type={} cron={} timezone={} nextFireAt={}",
        spec.specId(),
        userId,
        type,
        spec.cronExpression(),
        spec.timezone(),
        spec.nextFireAt());
    return spec;
  }

  /**
   * ACTIVE な予定の発火条件を置き換え、次回発火時刻を現在時刻から計算し直す。
   *
   * <p>payload と発火済み回数は引き継ぐ。更新は next_fire_at の CAS で行うため、同時に materialize
   * された場合は読み直してから適用する。
   *
   * @throws ScheduleNotFoundException 予定が無いか ACTIVE でない場合
   * @throws InvalidScheduleException 新しい発火条件が不正、または発火時刻が見つからない場合
   */
  public ScheduleSpec update(UUID specId, ScheduleRequest request) {
    requireTrigger(request);
    for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
      final ScheduleSpec current =
          scheduleSpecRepository
              .findById(specId)
              .filter(spec -> spec.status() == ScheduleStatus.ACTIVE)
              .orElseThrow(() -> new ScheduleNotFoundException(specId));
      final Instant now = Instant.now(clock);
      final ScheduleSpec draft = withTrigger(current.toBuilder(), request).updatedAt(now).build();
      if (draft.maxOccurrences() != null && draft.maxOccurrences() <= current.occurrencesSoFar()) {
        throw new InvalidScheduleException(
            "max_occurrences must exceed occurrences already fired (" + current.occurrencesSoFar() + ")");
      }
      final ScheduleSpec updated = draft.toBuilder().nextFireAt(firstFire(draft, now)).build();
      if (scheduleSpecRepository.updateTrigger(updated, current.nextFireAt()) == 1) {
        logger.info(
            "schedule updated specId={} cron={} timezone={} nextFireAt={}",
            specId,
            updated.cronExpression(),
            updated.timezone(),
            updated.nextFireAt());
        return updated;
      }
      logger.debug("schedule update raced with materialize specId={} attempt={}", specId, attempt);
    }
    throw new IllegalStateException("schedule update contention specId=" + specId);
  }

  /** 期限到来分をまとめて materialize し、投入したジョブ数を返す。 */
  public int tick() {
    final Instant now = Instant.now(clock);
    final List<ScheduleSpec> due = scheduleSpecRepository.findDue(now, properties.batchSize());
    int enqueued = 0;
    for (ScheduleSpec spec : due) {
      try {
        if (materialize(spec, now) == MaterializeResult.ENQUEUED) {
          enqueued++;
        }
      } catch (DataAccessException ex) {
        // 取りこぼした発火は next_fire_at が進んでいないため次の tick で再評価される
        logger.error("schedule materialize failed specId={} nextFireAt={}", spec.specId(), spec.nextFireAt(), ex);
      }
    }
    return enqueued;
  }

  /**
   * 1 件の発火をジョブとして投入し、次回発火へ進める。
   *
   * <p>ジョブ ID は (specId, 発火時刻) から決まるため、同じ発火の二重投入は DUPLICATE になる。
   */
  public MaterializeResult materialize(ScheduleSpec spec, Instant now) {
    if (spec.status() != ScheduleStatus.ACTIVE
        || spec.nextFireAt() == null
        || spec.nextFireAt().isAfter(now)) {
      return MaterializeResult.NOT_DUE;
    }
    if (spec.isExhausted()) {
      scheduleSpecRepository.close(spec.specId(), ScheduleStatus.RETIRED, now);
      logger.info("schedule retired because occurrences are exhausted specId={}", spec.specId());
      return record(MaterializeResult.RETIRED);
    }
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final MaterializeResult result =
        transactionTemplate.execute(
            status -> {
              final Instant fireAt = spec.nextFireAt();
              try {
                queueStore.enqueue(toJob(spec, fireAt, now), now);
              } catch (DuplicateJobException ex) {
                return MaterializeResult.DUPLICATE;
              }
              final int occurrences = spec.occurrencesSoFar() + 1;
              final ScheduleSpec fired = spec.toBuilder().occurrencesSoFar(occurrences).build();
              final Optional<Instant> next =
                  fired.isExhausted() ? Optional.empty() : nextFireCalculator.computeNextFire(fired, now);
              final boolean retire =
                  next.isEmpty() || (spec.endAt() != null && next.get().isAfter(spec.endAt()));
              final int updated =
                  scheduleSpecRepository.advance(
                      spec.specId(),
                      fireAt,
                      retire ? null : next.get(),
                      occurrences,
                      retire ? ScheduleStatus.RETIRED : ScheduleStatus.ACTIVE,
                      now);
              if (updated == 0) {
                // 別インスタンスが同じ発火を先に進めた
                status.setRollbackOnly();
                return MaterializeResult.DUPLICATE;
              }
              logger.info(
                  "schedule fired specId={} fireAt={} occurrences={} nextFireAt={} retired={}",
                  spec.specId(),
                  fireAt,
                  occurrences,
                  next.orElse(null),
                  retire);
              return MaterializeResult.ENQUEUED;
            });
    return record(result);
  }

  public void cancel(UUID specId) {
    final int updated = scheduleSpecRepository.close(specId, ScheduleStatus.CANCELLED, Instant.now(clock));
    if (updated == 0) {
      throw new ScheduleNotFoundException(specId);
    }
    logger.info("schedule cancelled specId={}", specId);
  }

  public Optional<ScheduleSpec> findById(UUID specId) {
    return scheduleSpecRepository.findById(specId);
  }

  public List<ScheduleSpec> findActive(String userId) {
    return scheduleSpecRepository.findActiveByUserId(userId);
  }

  private static void requireTrigger(ScheduleRequest request) {
    if (!request.isRecurring() && request.fireAt() == null) {
      throw new InvalidScheduleException("schedule requires cron expression or fire_at");
    }
  }

  private static ScheduleSpec.ScheduleSpecBuilder withTrigger(
      ScheduleSpec.ScheduleSpecBuilder builder, ScheduleRequest request) {
    return builder
        .cronExpression(request.isRecurring() ? request.cronExpression().trim() : null)
        .fireAt(request.isRecurring() ? null : request.fireAt())
        .timezone(request.timezone() == null ? "UTC" : request.timezone())
        .skipWeekends(request.skipWeekends())
        .skipHolidays(request.skipHolidays())
        .holidayRegion(request.holidayRegion())
        .maxOccurrences(request.maxOccurrences())
        .endAt(request.endAt());
  }

  private Instant firstFire(ScheduleSpec draft, Instant now) {
    return nextFireCalculator
        .computeNextFire(draft, now)
        .filter(fire -> draft.endAt() == null || !fire.isAfter(draft.endAt()))
        .orElseThrow(() -> new InvalidScheduleException("schedule has no upcoming fire time"));
  }

  static UUID occurrenceJobId(UUID specId, Instant fireAt) {
    return UUID.nameUUIDFromBytes((specId + "|" + fireAt).getBytes(StandardCharsets.UTF_8));
  }

  private NotificationJob toJob(ScheduleSpec spec, Instant fireAt, Instant now) {
    return NotificationJob.builder()
        .jobId(occurrenceJobId(spec.specId(), fireAt))
        .userId(spec.userId())
        .type(spec.type())
        .priority(spec.priority())
        .payload(spec.payload())
        .state(JobState.PENDING)
        .maxAttempts(spec.maxAttempts())
        .notBefore(fireAt)
        .scheduleId(spec.specId())
        .traceId(spec.traceId())
        .createdAt(now)
        .build();
  }

  private MaterializeResult record(MaterializeResult result) {
    if (result != MaterializeResult.NOT_DUE) {
      metrics.recordScheduleMaterialized(result.name().toLowerCase(Locale.ROOT));
    }
    return result;
  }
}
