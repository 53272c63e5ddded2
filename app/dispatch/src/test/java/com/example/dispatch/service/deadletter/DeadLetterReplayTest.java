/*
 * どこで: Dispatch テスト
 * 何を: dead への移送と replay による再投入を実 DB で検証する
 * なぜ: DEAD 更新と dead-letter 追記、replay の状態巻き戻しが一体で動くことを担保するため
 */
package com.example.dispatch.service.deadletter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dispatch.AbstractPostgresContainerTest;
import com.example.dispatch.DispatchTestJobs;
import com.example.dispatch.model.AckOutcome;
import com.example.dispatch.model.DeadLetterRecord;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import com.example.dispatch.service.DeadLetterNotFoundException;
import com.example.dispatch.service.queue.PriorityQueueStore;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeadLetterReplayTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private PriorityQueueStore queueStore;

  @Autowired private DeadLetterSink deadLetterSink;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_dead_letters", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
  }

  @Test
  void permanentFailureIsRecordedAndReplayRequeuesWithFreshAttempts() {
    final NotificationJob job = leasedJob();

    final var dead = queueStore.ack(job, "w-1", AckOutcome.DEAD, "permanent failure channel=email", NOW);

    assertThat(dead).contains(JobState.DEAD);
    assertThat(deadLetterSink.count()).isEqualTo(1);
    final List<DeadLetterRecord> recent = deadLetterSink.recent(10);
    assertThat(recent).hasSize(1);
    assertThat(recent.get(0).reason()).isEqualTo("permanent failure channel=email");
    assertThat(recent.get(0).payload()).isEqualTo(job.payload());
    assertThat(recent.get(0).attempt()).isEqualTo(1);

    final DeadLetterRecord replayed = queueStore.replayDead(job.jobId(), NOW.plusSeconds(60));

    assertThat(replayed.isReplayed()).isTrue();
    assertThat(deadLetterSink.count()).isZero();
    final NotificationJob requeued = queueStore.findById(job.jobId()).orElseThrow();
    assertThat(requeued.state()).isEqualTo(JobState.QUEUED);
    assertThat(requeued.attempt()).isZero();
    assertThat(requeued.lastError()).isNull();
    // 履歴は replay 後も残る
    assertThat(deadLetterSink.history(job.jobId())).hasSize(1);
  }

  @Test
  void replayTwiceFailsBecauseNoOpenDeadLetterRemains() {
    final NotificationJob job = leasedJob();
    queueStore.ack(job, "w-1", AckOutcome.DEAD, "permanent failure", NOW);
    queueStore.replayDead(job.jobId(), NOW.plusSeconds(1));

    assertThatThrownBy(() -> queueStore.replayDead(job.jobId(), NOW.plusSeconds(2)))
        .isInstanceOf(DeadLetterNotFoundException.class);
  }

  @Test
  void deadLetterIsNotWrittenWhenLeaseWasLost() {
    final NotificationJob job = leasedJob();

    final var result = queueStore.ack(job, "someone-else", AckOutcome.DEAD, "permanent failure", NOW);

    assertThat(result).isEmpty();
    assertThat(deadLetterSink.count()).isZero();
    assertThat(queueStore.findById(job.jobId()).orElseThrow().state()).isEqualTo(JobState.LEASED);
  }

  private NotificationJob leasedJob() {
    queueStore.enqueue(DispatchTestJobs.queued("u_1", Priority.MEDIUM, NOW.minusSeconds(1)), NOW);
    final List<NotificationJob> leased = queueStore.lease("w-1", 1, NOW);
    assertThat(leased).hasSize(1);
    return leased.get(0);
  }
}
