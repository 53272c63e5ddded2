/*
 * どこで: Dispatch scheduler のテスト
 * 何を: 予定登録とユーザーあたりの上限、発火条件の変更、materialize の冪等性、回数上限での退役、取消を実 DB で検証する
 * なぜ: 複数インスタンスが同じ発火を処理しても 1 件しか投入されないことを担保するため
 */
package com.example.dispatch.service.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dispatch.AbstractPostgresContainerTest;
import com.example.dispatch.DispatchTestJobs;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import com.example.dispatch.model.ScheduleRequest;
import com.example.dispatch.model.ScheduleSpec;
import com.example.dispatch.model.ScheduleStatus;
import com.example.dispatch.repository.ScheduleSpecRepository;
import com.example.dispatch.service.InvalidScheduleException;
import com.example.dispatch.service.ScheduleNotFoundException;
import com.example.dispatch.service.queue.PriorityQueueStore;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "dispatch.scheduler.max-active-per-user=2")
@ActiveProfiles("test")
class NotificationSchedulerTest extends AbstractPostgresContainerTest {

  @Autowired private NotificationScheduler scheduler;

  @Autowired private ScheduleSpecRepository scheduleSpecRepository;

  @Autowired private PriorityQueueStore queueStore;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM schedule_specs", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
  }

  @Test
  void registerComputesFirstFireAndListsActiveSpec() {
    final ScheduleSpec spec =
        scheduler.register(
            "u_1",
            "digest.daily",
            Priority.LOW,
            DispatchTestJobs.payload("u_1", List.of("email")),
            3,
            ScheduleRequest.builder().cronExpression("0 9 * * *").timezone("Asia/Tokyo").build(),
            "trace-1");

    assertThat(spec.nextFireAt()).isAfter(Instant.now().minusSeconds(1));
    assertThat(scheduler.findActive("u_1")).extracting(ScheduleSpec::specId).containsExactly(spec.specId());
    assertThat(scheduler.findById(spec.specId()).orElseThrow().cronExpression()).isEqualTo("0 9 * * *");
  }

  @Test
  void registerRejectsScheduleEndingBeforeFirstFire() {
    final ScheduleRequest request =
        ScheduleRequest.builder()
            .cronExpression("0 9 * * *")
            .endAt(Instant.now().minus(1, ChronoUnit.DAYS))
            .build();

    assertThatThrownBy(
            () ->
                scheduler.register(
                    "u_1", "digest.daily", Priority.LOW, DispatchTestJobs.payload("u_1", List.of("email")), 3, request, null))
        .isInstanceOf(InvalidScheduleException.class);
    assertThat(scheduler.findActive("u_1")).isEmpty();
  }

  @Test
  void registerRejectsUserAtActiveScheduleLimit() {
    final ScheduleSpec first = register("u_1", daily("UTC"));
    register("u_1", daily("UTC"));

    assertThatThrownBy(() -> register("u_1", daily("UTC")))
        .isInstanceOf(InvalidScheduleException.class)
        .hasMessageContaining("active schedule limit of 2");
    // 他ユーザーには影響しない
    assertThat(register("u_2", daily("UTC")).status()).isEqualTo(ScheduleStatus.ACTIVE);

    scheduler.cancel(first.specId());
    assertThat(register("u_1", daily("UTC")).status()).isEqualTo(ScheduleStatus.ACTIVE);
    assertThat(scheduler.findActive("u_1")).hasSize(2);
  }

  @Test
  void updateReplacesTriggerAndRecomputesNextFire() {
    final ScheduleSpec spec = register("u_1", daily("UTC"));

    final ScheduleSpec updated =
        scheduler.update(
            spec.specId(),
            ScheduleRequest.builder().cronExpression("30 18 * * *").timezone("Asia/Tokyo").build());

    final ScheduleSpec stored = scheduleSpecRepository.findById(spec.specId()).orElseThrow();
    assertThat(stored.cronExpression()).isEqualTo("30 18 * * *");
    assertThat(stored.timezone()).isEqualTo("Asia/Tokyo");
    assertThat(stored.nextFireAt()).isEqualTo(updated.nextFireAt());
    final ZonedDateTime local = stored.nextFireAt().atZone(ZoneId.of("Asia/Tokyo"));
    assertThat(local.getHour()).isEqualTo(18);
    assertThat(local.getMinute()).isEqualTo(30);
    assertThat(stored.type()).isEqualTo("digest.daily");
    assertThat(stored.occurrencesSoFar()).isZero();
  }

  @Test
  void updateKeepsFiredOccurrencesAndRejectsExhaustingLimit() {
    final ScheduleSpec spec = insertDue(null);
    scheduler.materialize(spec, Instant.now());

    assertThatThrownBy(
            () ->
                scheduler.update(
                    spec.specId(), ScheduleRequest.builder().cronExpression("0 10 * * *").maxOccurrences(1).build()))
        .isInstanceOf(InvalidScheduleException.class)
        .hasMessageContaining("occurrences already fired");

    final ScheduleSpec updated =
        scheduler.update(
            spec.specId(), ScheduleRequest.builder().cronExpression("0 10 * * *").maxOccurrences(3).build());

    assertThat(updated.occurrencesSoFar()).isEqualTo(1);
    assertThat(scheduleSpecRepository.findById(spec.specId()).orElseThrow().maxOccurrences()).isEqualTo(3);
  }

  @Test
  void updateRejectsInactiveOrUnknownSpec() {
    final ScheduleSpec spec = insertDue(null);
    scheduler.cancel(spec.specId());

    assertThatThrownBy(() -> scheduler.update(spec.specId(), daily("UTC")))
        .isInstanceOf(ScheduleNotFoundException.class);
    assertThatThrownBy(() -> scheduler.update(UUID.randomUUID(), daily("UTC")))
        .isInstanceOf(ScheduleNotFoundException.class);
  }

  @Test
  void tickMaterializesDueSpecOnlyOnce() {
    final ScheduleSpec spec = insertDue(null);

    assertThat(scheduler.tick()).isEqualTo(1);
    // next_fire_at は翌日以降へ進んでいるため再 tick では投入されない
    assertThat(scheduler.tick()).isZero();

    final NotificationJob job =
        queueStore
            .findById(NotificationScheduler.occurrenceJobId(spec.specId(), spec.nextFireAt()))
            .orElseThrow();
    assertThat(job.scheduleId()).isEqualTo(spec.specId());
    assertThat(job.state()).isEqualTo(JobState.QUEUED);
    final ScheduleSpec advanced = scheduleSpecRepository.findById(spec.specId()).orElseThrow();
    assertThat(advanced.occurrencesSoFar()).isEqualTo(1);
    assertThat(advanced.nextFireAt()).isAfter(spec.nextFireAt());
    assertThat(advanced.status()).isEqualTo(ScheduleStatus.ACTIVE);
  }

  @Test
  void staleSnapshotIsReportedAsDuplicate() {
    final ScheduleSpec spec = insertDue(null);
    final Instant now = Instant.now();

    assertThat(scheduler.materialize(spec, now)).isEqualTo(MaterializeResult.ENQUEUED);
    // 別インスタンスが古いスナップショットで同じ発火を処理したケース
    assertThat(scheduler.materialize(spec, now)).isEqualTo(MaterializeResult.DUPLICATE);

    assertThat(queueStore.getQueueDepth(null)).isEqualTo(1);
    assertThat(scheduleSpecRepository.findById(spec.specId()).orElseThrow().occurrencesSoFar())
        .isEqualTo(1);
  }

  @Test
  void specRetiresWhenMaxOccurrencesIsReached() {
    final ScheduleSpec spec = insertDue(1);

    assertThat(scheduler.materialize(spec, Instant.now())).isEqualTo(MaterializeResult.ENQUEUED);

    final ScheduleSpec retired = scheduleSpecRepository.findById(spec.specId()).orElseThrow();
    assertThat(retired.status()).isEqualTo(ScheduleStatus.RETIRED);
    assertThat(retired.nextFireAt()).isNull();
    assertThat(scheduler.tick()).isZero();
  }

  @Test
  void cancelClosesActiveSpecAndRejectsUnknownId() {
    final ScheduleSpec spec = insertDue(null);

    scheduler.cancel(spec.specId());

    assertThat(scheduleSpecRepository.findById(spec.specId()).orElseThrow().status())
        .isEqualTo(ScheduleStatus.CANCELLED);
    assertThat(scheduler.tick()).isZero();
    assertThatThrownBy(() -> scheduler.cancel(spec.specId()))
        .isInstanceOf(ScheduleNotFoundException.class);
    assertThatThrownBy(() -> scheduler.cancel(UUID.randomUUID()))
        .isInstanceOf(ScheduleNotFoundException.class);
  }

  private ScheduleSpec register(String userId, ScheduleRequest request) {
    return scheduler.register(
        userId, "digest.daily", Priority.LOW, DispatchTestJobs.payload(userId, List.of("email")), 3, request, null);
  }

  private static ScheduleRequest daily(String timezone) {
    return ScheduleRequest.builder().cronExpression("0 9 * * *").timezone(timezone).build();
  }

  private ScheduleSpec insertDue(Integer maxOccurrences) {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final ScheduleSpec spec =
        ScheduleSpec.builder()
            .specId(UUID.randomUUID())
            .userId("u_1")
            .type("digest.daily")
            .priority(Priority.LOW)
            .payload(DispatchTestJobs.payload("u_1", List.of("email")))
            .cronExpression("0 9 * * *")
            .timezone("UTC")
            .maxOccurrences(maxOccurrences)
            .occurrencesSoFar(0)
            .maxAttempts(3)
            .nextFireAt(now.minusSeconds(60))
            .status(ScheduleStatus.ACTIVE)
            .traceId("trace-1")
            .createdAt(now.minusSeconds(120))
            .updatedAt(now.minusSeconds(120))
            .build();
    scheduleSpecRepository.insert(spec);
    return spec;
  }
}
