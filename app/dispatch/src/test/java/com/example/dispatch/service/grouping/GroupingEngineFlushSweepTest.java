/*
 * どこで: Dispatch grouping のユニットテスト
 * 何を: 期限切れ窓の一括 flush が 1 つの窓の失敗で止まらないことを検証する
 * なぜ: 失敗し続ける窓が window_end 順の先頭に居座り、後続の窓が永久に flush されなくなるのを防ぐため
 */
package com.example.dispatch.service.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dispatch.DispatchTestJobs;
import com.example.dispatch.model.AggregationStrategy;
import com.example.dispatch.model.GroupMember;
import com.example.dispatch.model.GroupWindow;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import com.example.dispatch.model.WindowState;
import com.example.dispatch.repository.GroupWindowRepository;
import com.example.dispatch.service.DispatchMetrics;
import com.example.dispatch.service.DuplicateJobException;
import com.example.dispatch.service.queue.PriorityQueueStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class GroupingEngineFlushSweepTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:10:00Z");

  @Mock private GroupWindowRepository groupWindowRepository;
  @Mock private PriorityQueueStore queueStore;
  @Mock private DigestComposer digestComposer;
  @Mock private DispatchMetrics metrics;

  private GroupingEngine engine;

  @BeforeEach
  void setUp() {
    engine =
        new GroupingEngine(
            groupWindowRepository, queueStore, digestComposer, metrics, new NoOpTransactionManager());
  }

  @Test
  void duplicateInOneWindowDoesNotStopLaterWindows() {
    final GroupWindow stuck = window("u_1:social.like:p-1");
    final GroupWindow next = window("u_2:social.like:p-1");
    final GroupMember stuckMember = member(stuck);
    final GroupMember nextMember = member(next);
    final NotificationJob stuckJob = DispatchTestJobs.queued("u_1", Priority.LOW, NOW);
    final NotificationJob nextJob = DispatchTestJobs.queued("u_2", Priority.LOW, NOW);
    when(groupWindowRepository.findDueOpenWindowIds(NOW, 100))
        .thenReturn(List.of(stuck.windowId(), next.windowId()));
    when(groupWindowRepository.beginFlush(stuck.windowId(), NOW)).thenReturn(Optional.of(stuck));
    when(groupWindowRepository.beginFlush(next.windowId(), NOW)).thenReturn(Optional.of(next));
    when(groupWindowRepository.findMembers(stuck.windowId())).thenReturn(List.of(stuckMember));
    when(groupWindowRepository.findMembers(next.windowId())).thenReturn(List.of(nextMember));
    when(digestComposer.compose(stuck, List.of(stuckMember))).thenReturn(stuckJob);
    when(digestComposer.compose(next, List.of(nextMember))).thenReturn(nextJob);
    when(queueStore.enqueueFromWindow(stuckJob, stuck.windowId(), NOW))
        .thenThrow(new DuplicateJobException(stuckJob.jobId()));
    when(queueStore.enqueueFromWindow(nextJob, next.windowId(), NOW)).thenReturn(nextJob);

    final int flushed = engine.flushDue(NOW);

    assertThat(flushed).isEqualTo(1);
    verify(groupWindowRepository).markFlushed(next.windowId(), nextJob.jobId(), NOW);
    verify(groupWindowRepository, never()).markFlushed(eq(stuck.windowId()), any(), any());
  }

  @Test
  void databaseFailureInOneWindowDoesNotStopLaterWindows() {
    final GroupWindow broken = window("u_1:social.like:p-1");
    final GroupWindow next = window("u_2:social.like:p-1");
    when(groupWindowRepository.findDueOpenWindowIds(NOW, 100))
        .thenReturn(List.of(broken.windowId(), next.windowId()));
    when(groupWindowRepository.beginFlush(broken.windowId(), NOW))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));
    when(groupWindowRepository.beginFlush(next.windowId(), NOW)).thenReturn(Optional.of(next));
    when(groupWindowRepository.findMembers(next.windowId())).thenReturn(List.of());

    assertThat(engine.flushDue(NOW)).isZero();

    verify(groupWindowRepository).markFlushed(next.windowId(), null, NOW);
  }

  private static GroupWindow window(String groupKey) {
    final Instant start = NOW.minusSeconds(600);
    return new GroupWindow(
        UUID.randomUUID(),
        groupKey,
        groupKey.substring(0, groupKey.indexOf(':')),
        "social.like",
        AggregationStrategy.COUNT,
        start,
        NOW.minusSeconds(300),
        WindowState.FLUSHING,
        1,
        null,
        start,
        start,
        null);
  }

  private static GroupMember member(GroupWindow window) {
    return new GroupMember(
        window.windowId(),
        0,
        UUID.randomUUID(),
        window.userId(),
        window.type(),
        Priority.LOW,
        DispatchTestJobs.payload(window.userId(), List.of("push")),
        3,
        null,
        window.windowStart());
  }

  private static class NoOpTransactionManager implements PlatformTransactionManager {

    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) {
      return new SimpleTransactionStatus();
    }

    @Override
    public void commit(TransactionStatus status) {}

    @Override
    public void rollback(TransactionStatus status) {}
  }
}
