/*
 * どこで: Dispatch grouping
 * 何を: 候補通知を group key ごとの時間窓へ合流させ、窓の flush で digest をキューへ投入する
 * なぜ: 短時間に集中する同種通知を 1 通へまとめるため
 */
package com.example.dispatch.service.grouping;

import com.example.dispatch.model.GroupMember;
import com.example.dispatch.model.GroupWindow;
import com.example.dispatch.model.GroupingRule;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.OfferResult;
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
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class GroupingEngine {

  private static final Logger logger = LoggerFactory.getLogger(GroupingEngine.class);
  private static final int MAX_OPEN_ATTEMPTS = 3;
  private static final int FLUSH_SWEEP_LIMIT = 100;

  private final GroupWindowRepository groupWindowRepository;
  private final PriorityQueueStore queueStore;
  private final DigestComposer digestComposer;
  private final DispatchMetrics metrics;
  private final PlatformTransactionManager transactionManager;

  /**
   * 候補を group key の OPEN 窓へ合流させる。窓が無ければ新設する。
   *
   * <p>CRITICAL の候補は窓を経由せず即座に enqueue される。max-items に達した窓はその場で flush する。
   *
   * @throws DuplicateJobException 候補の jobId が既にキューか窓に存在する場合
   */
  public OfferResult offer(NotificationJob candidate, GroupingRule rule, Instant now) {
    if (candidate.priority() == Priority.CRITICAL) {
      queueStore.enqueue(candidate, now);
      metrics.recordGroupingResult("bypassed");
      logger.info("grouping bypassed for critical jobId={} type={}", candidate.jobId(), candidate.type());
      return OfferResult.bypassed(candidate.jobId());
    }
    final String groupKey = rule.groupKeyFor(candidate);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Offered offered =
        transactionTemplate.execute(status -> offerLocked(candidate, rule, groupKey, now));
    metrics.recordGroupingResult(
        offered.result().disposition() == OfferResult.Disposition.MERGED ? "merged" : "opened");
    logger.debug(
        "grouping offer jobId={} groupKey={} disposition={} memberCount={}",
        candidate.jobId(),
        groupKey,
        offered.result().disposition(),
        offered.memberCount());
    if (rule.reachesLimit(offered.memberCount())) {
      flushWindow(offered.result().windowId(), now);
    }
    return offered.result();
  }

  /** group key の OPEN 窓を flush する。OPEN 窓が無い、または他の呼び出しが先に flush した場合は空。 */
  public Optional<NotificationJob> flush(String groupKey, Instant now) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    return transactionTemplate.execute(
        status ->
            groupWindowRepository
                .findOpenForUpdate(groupKey)
                .flatMap(window -> flushWindow(window.windowId(), now)));
  }

  /** window_end を過ぎた OPEN 窓をまとめて flush し、投入した digest 数を返す。 */
  public int flushDue(Instant now) {
    final List<UUID> due = groupWindowRepository.findDueOpenWindowIds(now, FLUSH_SWEEP_LIMIT);
    int flushed = 0;
    for (UUID windowId : due) {
      try {
        if (flushWindow(windowId, now).isPresent()) {
          flushed++;
        }
      } catch (RuntimeException ex) {
        // 1 つの窓の失敗で後続の期限切れ窓を止めない
        logger.error("grouping flush failed windowId={}", windowId, ex);
      }
    }
    return flushed;
  }

  /** OPEN 窓を digest を出さずに破棄する。 */
  public boolean cancel(String groupKey, Instant now) {
    final boolean cancelled = groupWindowRepository.cancelOpen(groupKey, now) > 0;
    if (cancelled) {
      logger.info("grouping window cancelled groupKey={}", groupKey);
    }
    return cancelled;
  }

  /**
   * 窓に保留中のメンバーを、digest の状態に追従したジョブとして返す。
   *
   * <p>flush 前は PENDING、窓が cancel された場合は FAILED。
   */
  public Optional<NotificationJob> findMemberView(UUID jobId) {
    return groupWindowRepository
        .findMemberByJobId(jobId)
        .flatMap(
            member ->
                groupWindowRepository
                    .findById(member.windowId())
                    .map(window -> toMemberView(member, window)));
  }

  Optional<NotificationJob> flushWindow(UUID windowId, Instant now) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Optional<NotificationJob> digest =
        transactionTemplate.execute(
            status -> {
              // OPEN -> FLUSHING の CAS に勝った呼び出しだけが digest を作る
              final Optional<GroupWindow> claimed = groupWindowRepository.beginFlush(windowId, now);
              if (claimed.isEmpty()) {
                return Optional.<NotificationJob>empty();
              }
              final GroupWindow window = claimed.get();
              final List<GroupMember> members = groupWindowRepository.findMembers(windowId);
              if (members.isEmpty()) {
                groupWindowRepository.markFlushed(windowId, null, now);
                return Optional.<NotificationJob>empty();
              }
              final NotificationJob enqueued =
                  queueStore.enqueueFromWindow(
                      digestComposer.compose(window, members), windowId, now);
              groupWindowRepository.markFlushed(windowId, enqueued.jobId(), now);
              logger.info(
                  "grouping window flushed groupKey={} windowId={} members={} digestJobId={}",
                  window.groupKey(),
                  windowId,
                  members.size(),
                  enqueued.jobId());
              return Optional.of(enqueued);
            });
    if (digest.isPresent()) {
      metrics.recordGroupingResult("flushed");
    }
    return digest;
  }

  private Offered offerLocked(NotificationJob candidate, GroupingRule rule, String groupKey, Instant now) {
    for (int attempt = 0; attempt < MAX_OPEN_ATTEMPTS; attempt++) {
      final Optional<GroupWindow> open = groupWindowRepository.findOpenForUpdate(groupKey);
      if (open.isPresent()) {
        final GroupWindow window = open.get();
        if (window.acceptsAt(now)) {
          addMember(window.windowId(), window.memberCount(), candidate, now);
          return new Offered(
              new OfferResult(
                  OfferResult.Disposition.MERGED,
                  candidate.jobId(),
                  groupKey,
                  window.windowId(),
                  window.windowEnd()),
              window.memberCount() + 1);
        }
        // 期限切れの窓は sweeper を待たずにここで閉じ、新しい窓を開く
        flushWindow(window.windowId(), now);
      }
      final GroupWindow fresh =
          new GroupWindow(
              UUID.randomUUID(),
              groupKey,
              candidate.userId(),
              candidate.type(),
              rule.strategy(),
              now,
              now.plus(rule.window()),
              WindowState.OPEN,
              0,
              null,
              now,
              now,
              null);
      if (groupWindowRepository.insertOpenIfAbsent(fresh) == 1) {
        addMember(fresh.windowId(), 0, candidate, now);
        return new Offered(
            new OfferResult(
                OfferResult.Disposition.WINDOW_OPENED,
                candidate.jobId(),
                groupKey,
                fresh.windowId(),
                fresh.windowEnd()),
            1);
      }
      // 別プロセスが同じ group key の窓を先に開いたので、読み直して合流する
    }
    throw new IllegalStateException("group window contention groupKey=" + groupKey);
  }

  private void addMember(UUID windowId, int position, NotificationJob candidate, Instant now) {
    final GroupMember member =
        new GroupMember(
            windowId,
            position,
            candidate.jobId(),
            candidate.userId(),
            candidate.type(),
            candidate.priority(),
            candidate.payload(),
            candidate.maxAttempts(),
            candidate.traceId(),
            now);
    if (groupWindowRepository.insertMemberIfAbsent(member) == 0) {
      throw new DuplicateJobException(candidate.jobId());
    }
    groupWindowRepository.incrementMemberCount(windowId, now);
  }

  private NotificationJob toMemberView(GroupMember member, GroupWindow window) {
    final NotificationJob.NotificationJobBuilder view =
        NotificationJob.builder()
            .jobId(member.jobId())
            .userId(member.userId())
            .type(member.type())
            .priority(member.priority())
            .payload(member.payload())
            .maxAttempts(member.maxAttempts())
            .notBefore(window.windowEnd())
            .groupKey(window.groupKey())
            .traceId(member.traceId())
            .createdAt(member.createdAt())
            .updatedAt(window.updatedAt());
    if (window.state() == WindowState.CANCELLED) {
      return view.state(JobState.FAILED).lastError("group window cancelled").completedAt(window.closedAt()).build();
    }
    if (window.state() != WindowState.FLUSHED || window.digestJobId() == null) {
      return view.state(JobState.PENDING).build();
    }
    // digest が retention で消えている場合、削除対象は SUCCEEDED だけなので成功扱いにする
    return queueStore
        .findById(window.digestJobId())
        .map(
            digest ->
                view.state(digest.state())
                    .attempt(digest.attempt())
                    .deliveredChannels(digest.deliveredChannels())
                    .lastError(digest.lastError())
                    .completedAt(digest.completedAt())
                    .build())
        .orElseGet(() -> view.state(JobState.SUCCEEDED).completedAt(window.closedAt()).build());
  }

  private record Offered(OfferResult result, int memberCount) {}
}
