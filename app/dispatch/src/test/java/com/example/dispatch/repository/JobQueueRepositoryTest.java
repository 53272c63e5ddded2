/*
 * どこで: Dispatch テスト
 * 何を: Postgres での lease 順序/排他/CAS ack/lease 回収を検証する
 * なぜ: UPDATE ... RETURNING + SKIP LOCKED の挙動を実 DB で担保するため
 */
package com.example.dispatch.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.AbstractPostgresContainerTest;
import com.example.dispatch.DispatchTestJobs;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JobQueueRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
    private static final Duration LEASE = Duration.ofSeconds(30);

    @Autowired
    private JobQueueRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notification_jobs", new MapSqlParameterSource());
    }

    @Test
    void claimDueOrdersByPriorityThenNotBefore() {
        NotificationJob low = insert(DispatchTestJobs.queued("u_low", Priority.LOW, NOW.minusSeconds(30)));
        NotificationJob critical = insert(DispatchTestJobs.queued("u_crit", Priority.CRITICAL, NOW.minusSeconds(1)));
        NotificationJob mediumOld = insert(DispatchTestJobs.queued("u_m1", Priority.MEDIUM, NOW.minusSeconds(20)));
        NotificationJob mediumNew = insert(DispatchTestJobs.queued("u_m2", Priority.MEDIUM, NOW.minusSeconds(10)));

        List<NotificationJob> claimed = repository.claimDue(10, NOW, NOW.plus(LEASE), "w-1");

        assertThat(claimed).extracting(NotificationJob::jobId)
                .containsExactly(critical.jobId(), mediumOld.jobId(), mediumNew.jobId(), low.jobId());
        assertThat(claimed).allSatisfy(job -> {
            assertThat(job.state()).isEqualTo(JobState.LEASED);
            assertThat(job.leaseOwner()).isEqualTo("w-1");
            assertThat(job.leaseExpiresAt()).isEqualTo(NOW.plus(LEASE));
        });
    }

    @Test
    void claimDueSkipsFutureJobsAndRespectsLimit() {
        insert(DispatchTestJobs.queued("u_future", Priority.CRITICAL, NOW.plusSeconds(60)));
        insert(DispatchTestJobs.queued("u_1", Priority.HIGH, NOW.minusSeconds(2)));
        insert(DispatchTestJobs.queued("u_2", Priority.HIGH, NOW.minusSeconds(1)));

        List<NotificationJob> claimed = repository.claimDue(1, NOW, NOW.plus(LEASE), "w-1");

        assertThat(claimed).hasSize(1);
        assertThat(claimed.get(0).userId()).isEqualTo("u_1");
        assertThat(repository.countWaiting(null)).isEqualTo(2);
        assertThat(repository.countWaiting(Priority.CRITICAL)).isEqualTo(1);
    }

    @Test
    void concurrentClaimsNeverLeaseTheSameJobTwice() throws Exception {
        final int jobCount = 40;
        for (int i = 0; i < jobCount; i++) {
            insert(DispatchTestJobs.queued("u_" + i, Priority.MEDIUM, NOW.minusSeconds(i)));
        }
        final int workers = 4;
        final ExecutorService executor = Executors.newFixedThreadPool(workers);
        final CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<NotificationJob>>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                final String owner = "w-" + w;
                Callable<List<NotificationJob>> task = () -> {
                    start.await();
                    List<NotificationJob> all = new ArrayList<>();
                    List<NotificationJob> batch;
                    do {
                        batch = repository.claimDue(3, NOW, NOW.plus(LEASE), owner);
                        all.addAll(batch);
                    } while (!batch.isEmpty());
                    return all;
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<UUID> claimedIds = new ArrayList<>();
            for (Future<List<NotificationJob>> future : futures) {
                future.get().forEach(job -> claimedIds.add(job.jobId()));
            }
            Set<UUID> distinct = new HashSet<>(claimedIds);
            assertThat(claimedIds).hasSize(jobCount);
            assertThat(distinct).hasSize(jobCount);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void ackRequiresCurrentLeaseOwner() {
        NotificationJob job = insert(DispatchTestJobs.queued("u_1", Priority.HIGH, NOW.minusSeconds(1)));
        repository.claimDue(1, NOW, NOW.plus(LEASE), "w-1");

        // 別ワーカーの ack は lease_owner が一致しないため反映されない
        assertThat(repository.markSucceeded(job.jobId(), "w-2", List.of("email"), NOW)).isZero();
        assertThat(repository.markSucceeded(job.jobId(), "w-1", List.of("email"), NOW)).isEqualTo(1);

        NotificationJob stored = repository.findById(job.jobId()).orElseThrow();
        assertThat(stored.state()).isEqualTo(JobState.SUCCEEDED);
        assertThat(stored.deliveredChannels()).containsExactly("email");
        assertThat(stored.leaseOwner()).isNull();
        assertThat(stored.completedAt()).isEqualTo(NOW);
    }

    @Test
    void reapReturnsExpiredLeasesWithoutConsumingAttempt() {
        NotificationJob leased = insert(DispatchTestJobs.queued("u_1", Priority.HIGH, NOW.minusSeconds(1)));
        NotificationJob delivering = insert(DispatchTestJobs.queued("u_2", Priority.HIGH, NOW.minusSeconds(1)));
        repository.claimDue(2, NOW, NOW.plus(LEASE), "w-1");
        repository.markDelivering(delivering.jobId(), "w-1", NOW);

        // lease 期限前は回収しない
        assertThat(repository.reapExpiredLeases(NOW.plusSeconds(10))).isEmpty();

        List<UUID> reaped = repository.reapExpiredLeases(NOW.plus(LEASE).plusSeconds(1));

        assertThat(reaped).containsExactlyInAnyOrder(leased.jobId(), delivering.jobId());
        NotificationJob stored = repository.findById(delivering.jobId()).orElseThrow();
        assertThat(stored.state()).isEqualTo(JobState.QUEUED);
        assertThat(stored.attempt()).isZero();
        assertThat(stored.leaseOwner()).isNull();
        // 回収後の旧 owner の ack は無効になる
        assertThat(repository.markSucceeded(delivering.jobId(), "w-1", List.of(), NOW)).isZero();
    }

    @Test
    void requeuePersistsAttemptAndDeliveredChannels() {
        NotificationJob job = insert(DispatchTestJobs.queued("u_1", Priority.LOW, NOW.minusSeconds(1)));
        repository.claimDue(1, NOW, NOW.plus(LEASE), "w-1");

        int updated = repository.markRequeued(
                job.jobId(), "w-1", 1, NOW.plusSeconds(5), List.of("email"), "retryable failure", NOW);

        assertThat(updated).isEqualTo(1);
        NotificationJob stored = repository.findById(job.jobId()).orElseThrow();
        assertThat(stored.state()).isEqualTo(JobState.QUEUED);
        assertThat(stored.attempt()).isEqualTo(1);
        assertThat(stored.notBefore()).isEqualTo(NOW.plusSeconds(5));
        assertThat(stored.deliveredChannels()).containsExactly("email");
        assertThat(stored.lastError()).isEqualTo("retryable failure");
        // not_before 前は lease されない
        assertThat(repository.claimDue(1, NOW.plusSeconds(1), NOW.plus(LEASE), "w-1")).isEmpty();
    }

    @Test
    void insertIfAbsentIgnoresDuplicateJobId() {
        NotificationJob job = insert(DispatchTestJobs.queued("u_1", Priority.LOW, NOW));

        assertThat(repository.insertIfAbsent(job)).isZero();
        assertThat(repository.findById(job.jobId())).isPresent();
    }

    private NotificationJob insert(NotificationJob job) {
        assertThat(repository.insertIfAbsent(job)).isEqualTo(1);
        return job;
    }
}
